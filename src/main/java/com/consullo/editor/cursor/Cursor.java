package com.consullo.editor.cursor;

import com.consullo.editor.core.Position;
import com.consullo.editor.core.TextStorage;
import org.apache.commons.lang3.Validate;

/**
 * Live cursor held by the editing loop.
 *
 * <p>The cursor does not follow its document automatically. Every cursor-affecting mutation must
 * be followed by {@link #constrain(TextStorage)}.
 *
 * @since 1.0
 */
public final class Cursor {

  private Position position;

  public Cursor() {
    this(Position.origin());
  }

  public Cursor(final Position initial) {
    Validate.notNull(initial, "initial must not be null");
    this.position = initial;
  }

  public Position position() {
    return this.position;
  }

  public void moveTo(final Position target) {
    Validate.notNull(target, "target must not be null");
    this.position = target;
  }

  /**
   * Moves relative to the current position. Negative results saturate at zero.
   *
   * @param dx column delta
   * @param dy line delta
   */
  public void moveBy(final int dx, final int dy) {
    final int column = Math.max(0, this.position.column() + dx);
    final int line = Math.max(0, this.position.line() + dy);
    this.position = new Position(column, line);
  }

  /**
   * Applies typing bookkeeping for one inserted character: a line feed moves to column 0 of the
   * next line, anything else advances one column.
   *
   * @param ch inserted character
   */
  public void advance(final char ch) {
    if (ch == '\n') {
      this.position = new Position(0, this.position.line() + 1);
    } else {
      this.position = this.position.withColumn(this.position.column() + 1);
    }
  }

  /**
   * Clamps the cursor into the given storage.
   *
   * @param storage storage the cursor points into
   */
  public void constrain(final TextStorage storage) {
    this.position = CursorTranslator.constrain(storage, this.position);
  }

  /**
   * Returns the offset of the cursor in the given storage.
   *
   * @param storage storage the cursor points into
   * @return clamped offset
   */
  public int offsetIn(final TextStorage storage) {
    return CursorTranslator.toOffset(storage, this.position);
  }

  @Override
  public String toString() {
    return "Cursor[" + this.position.line() + ":" + this.position.column() + "]";
  }
}
