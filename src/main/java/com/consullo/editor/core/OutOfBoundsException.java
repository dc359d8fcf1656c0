package com.consullo.editor.core;

/**
 * Raised when an offset, line or document index falls outside its valid domain.
 *
 * @since 1.0
 */
public class OutOfBoundsException extends EditorException {

  private static final long serialVersionUID = 1L;

  public OutOfBoundsException(final String message) {
    super(message);
  }
}
