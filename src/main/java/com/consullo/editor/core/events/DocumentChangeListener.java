package com.consullo.editor.core.events;

/**
 * Listener interface for document change events.
 *
 * @since 1.0
 */
public interface DocumentChangeListener {

  /**
   * Called after a session document has been mutated.
   *
   * @param event event describing the mutation
   */
  void onChange(DocumentChangeEvent event);
}
