package com.consullo.editor.core;

import org.apache.commons.lang3.Validate;

/**
 * Zero-based (column, line) coordinate into the line-decomposed view of a document.
 *
 * <p>A position carries no validity relative to any particular document. Validity is checked, or
 * clamped, when the position is translated to an offset.
 *
 * @param column zero-based column within the line
 * @param line zero-based line index
 * @since 1.0
 */
public record Position(int column, int line) {

  private static final Position ORIGIN = new Position(0, 0);

  public Position {
    Validate.isTrue(column >= 0, "column must be non-negative");
    Validate.isTrue(line >= 0, "line must be non-negative");
  }

  /**
   * Returns the top-left position.
   *
   * @return position (0, 0)
   */
  public static Position origin() {
    return ORIGIN;
  }

  public Position withColumn(final int newColumn) {
    return new Position(newColumn, this.line);
  }

  public Position withLine(final int newLine) {
    return new Position(this.column, newLine);
  }
}
