package com.consullo.editor.core;

/**
 * Base type for recoverable buffer engine failures.
 *
 * <p>No subtype is fatal: the driving loop is expected to report the message (for example on the
 * status line) and continue accepting input.
 *
 * @since 1.0
 */
public class EditorException extends Exception {

  private static final long serialVersionUID = 1L;

  public EditorException(final String message) {
    super(message);
  }
}
