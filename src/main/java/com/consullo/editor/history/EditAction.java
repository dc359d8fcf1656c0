package com.consullo.editor.history;

import org.apache.commons.lang3.Validate;

/**
 * Structured edit recorded by the action log instead of a full snapshot.
 *
 * @param type kind of edit
 * @param position offset the edit applies at
 * @param text inserted or deleted text; a single char for the character kinds
 * @since 1.0
 */
public record EditAction(Type type, int position, String text) {

  public enum Type {
    INSERT_CHAR,
    DELETE_CHAR,
    INSERT_TEXT,
    DELETE_TEXT
  }

  public EditAction {
    Validate.notNull(type, "type must not be null");
    Validate.notNull(text, "text must not be null");
    Validate.isTrue(position >= 0, "position must be non-negative");
    if (type == Type.INSERT_CHAR || type == Type.DELETE_CHAR) {
      Validate.isTrue(text.length() == 1, "character actions carry exactly one char");
    }
  }

  public static EditAction insertChar(final int position, final char character) {
    return new EditAction(Type.INSERT_CHAR, position, String.valueOf(character));
  }

  public static EditAction deleteChar(final int position, final char character) {
    return new EditAction(Type.DELETE_CHAR, position, String.valueOf(character));
  }

  public static EditAction insertText(final int position, final String text) {
    return new EditAction(Type.INSERT_TEXT, position, text);
  }

  public static EditAction deleteText(final int position, final String text) {
    return new EditAction(Type.DELETE_TEXT, position, text);
  }

  /**
   * Returns the character of a single-character action.
   *
   * @return the character
   * @throws IllegalStateException for text actions
   */
  public char character() {
    if (type != Type.INSERT_CHAR && type != Type.DELETE_CHAR) {
      throw new IllegalStateException(type + " does not carry a single character");
    }
    return text.charAt(0);
  }

  /**
   * Returns the edit that reverts this one: inserts become deletes at the same position and vice
   * versa.
   *
   * @return inverse action
   */
  public EditAction inverse() {
    switch (type) {
      case INSERT_CHAR:
        return new EditAction(Type.DELETE_CHAR, position, text);
      case DELETE_CHAR:
        return new EditAction(Type.INSERT_CHAR, position, text);
      case INSERT_TEXT:
        return new EditAction(Type.DELETE_TEXT, position, text);
      case DELETE_TEXT:
        return new EditAction(Type.INSERT_TEXT, position, text);
      default:
        throw new IllegalStateException("Unknown action type " + type);
    }
  }
}
