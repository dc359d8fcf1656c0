package com.consullo.editor.cursor;

import com.consullo.editor.core.Position;
import com.consullo.editor.core.TextStorage;
import org.apache.commons.lang3.Validate;

/**
 * Tolerant mapping between cursor positions and linear offsets.
 *
 * <p>Unlike the strict translation on {@link com.consullo.editor.core.Document}, these functions
 * never fail: a cursor can lag the buffer by one keystroke, so out-of-range lines and columns
 * saturate to the nearest valid value. All lookups are linear in the number of lines.
 *
 * @since 1.0
 */
public final class CursorTranslator {

  private CursorTranslator() {
  }

  /**
   * Converts a position to an offset, clamping the line and column.
   *
   * @param storage text storage
   * @param position cursor position
   * @return offset in {@code [0, storage.length()]}
   */
  public static int toOffset(final TextStorage storage, final Position position) {
    Validate.notNull(storage, "storage must not be null");
    Validate.notNull(position, "position must not be null");

    final int line = Math.min(position.line(), Math.max(0, storage.lineCount() - 1));
    int offset = 0;
    for (int i = 0; i < line; i++) {
      offset += storage.lineLength(i) + 1;
    }
    return offset + Math.min(position.column(), storage.lineLength(line));
  }

  /**
   * Converts an offset to a position. Offsets past the end map to the end of the last line.
   *
   * @param storage text storage
   * @param offset linear offset
   * @return matching position
   */
  public static Position fromOffset(final TextStorage storage, final int offset) {
    Validate.notNull(storage, "storage must not be null");

    final int target = Math.max(0, offset);
    int lineStart = 0;
    for (int i = 0; i < storage.lineCount(); i++) {
      final int lineLength = storage.lineLength(i);
      if (lineStart + lineLength >= target) {
        return new Position(target - lineStart, i);
      }
      lineStart += lineLength + 1;
    }

    final int lastLine = Math.max(0, storage.lineCount() - 1);
    return new Position(storage.lineLength(lastLine), lastLine);
  }

  /**
   * Clamps a position into the storage: the line into {@code [0, lineCount - 1]} and the column
   * into {@code [0, lineLength(line)]}.
   *
   * @param storage text storage
   * @param position position to clamp
   * @return valid position
   */
  public static Position constrain(final TextStorage storage, final Position position) {
    Validate.notNull(storage, "storage must not be null");
    Validate.notNull(position, "position must not be null");

    final int lineCount = storage.lineCount();
    if (lineCount == 0) {
      return Position.origin();
    }

    final int line = Math.min(position.line(), lineCount - 1);
    final int column = Math.min(position.column(), storage.lineLength(line));
    if (line == position.line() && column == position.column()) {
      return position;
    }
    return new Position(column, line);
  }
}
