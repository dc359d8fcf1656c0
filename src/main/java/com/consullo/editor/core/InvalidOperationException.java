package com.consullo.editor.core;

/**
 * Raised when an action is structurally disallowed in the current state, such as deleting at the
 * start of a buffer or selecting an empty range.
 *
 * @since 1.0
 */
public class InvalidOperationException extends EditorException {

  private static final long serialVersionUID = 1L;

  public InvalidOperationException(final String message) {
    super(message);
  }
}
