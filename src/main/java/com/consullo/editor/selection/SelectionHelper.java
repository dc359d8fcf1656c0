package com.consullo.editor.selection;

import com.consullo.editor.core.EditorException;
import com.consullo.editor.core.InvalidOperationException;
import com.consullo.editor.core.TextStorage;
import com.consullo.editor.cursor.Cursor;
import com.consullo.editor.cursor.CursorTranslator;
import org.apache.commons.lang3.Validate;

/**
 * Copy, cut and paste over a text storage and a live cursor, backed by one {@link Clipboard}.
 *
 * <p>All edits go through the storage's single-character mutations, so a cut or paste on a
 * session marks its current document dirty exactly like typed input.
 *
 * @since 1.0
 */
public final class SelectionHelper {

  private final Clipboard clipboard;

  public SelectionHelper() {
    this(new Clipboard());
  }

  public SelectionHelper(final Clipboard clipboard) {
    Validate.notNull(clipboard, "clipboard must not be null");
    this.clipboard = clipboard;
  }

  public Clipboard clipboard() {
    return this.clipboard;
  }

  /**
   * Copies the chars in {@code [start, end)} to the clipboard.
   *
   * @param storage source storage
   * @param start first offset, inclusive
   * @param end last offset, exclusive
   * @return the copied text
   * @throws InvalidOperationException if the range is empty or outside the text
   */
  public String copy(final TextStorage storage, final int start, final int end) throws InvalidOperationException {
    Validate.notNull(storage, "storage must not be null");

    final int length = storage.length();
    if (start < 0 || start >= length || end > length || start >= end) {
      throw new InvalidOperationException("Invalid selection range [" + start + ", " + end + ") for length " + length);
    }

    final String selected = storage.content().substring(start, end);
    this.clipboard.set(selected);
    return selected;
  }

  /**
   * Copies {@code [start, end)} to the clipboard, removes it from the storage and moves the cursor
   * to {@code start}.
   *
   * @param storage storage to cut from
   * @param start first offset, inclusive
   * @param end last offset, exclusive
   * @param cursor live cursor, repositioned on success
   * @return the cut text
   * @throws EditorException if the range is invalid or a deletion fails
   */
  public String cut(final TextStorage storage, final int start, final int end, final Cursor cursor) throws EditorException {
    Validate.notNull(cursor, "cursor must not be null");
    final String selected = copy(storage, start, end);

    // Deleting before start + 1 removes the char at start; the rest of the range shifts onto it.
    for (int i = start; i < end; i++) {
      storage.delete(start + 1);
    }

    cursor.moveTo(CursorTranslator.fromOffset(storage, start));
    cursor.constrain(storage);
    return selected;
  }

  /**
   * Inserts text at the cursor one char at a time, advancing the cursor as typed input would.
   *
   * @param storage target storage
   * @param text text to insert
   * @param cursor live cursor
   * @throws EditorException if an insertion fails
   */
  public void paste(final TextStorage storage, final String text, final Cursor cursor) throws EditorException {
    Validate.notNull(storage, "storage must not be null");
    Validate.notNull(text, "text must not be null");
    Validate.notNull(cursor, "cursor must not be null");

    for (int i = 0; i < text.length(); i++) {
      final char ch = text.charAt(i);
      storage.insert(cursor.offsetIn(storage), ch);
      cursor.advance(ch);
    }
    cursor.constrain(storage);
  }

  /**
   * Pastes the clipboard content at the cursor.
   *
   * @param storage target storage
   * @param cursor live cursor
   * @throws EditorException if an insertion fails
   */
  public void paste(final TextStorage storage, final Cursor cursor) throws EditorException {
    paste(storage, this.clipboard.get(), cursor);
  }
}
