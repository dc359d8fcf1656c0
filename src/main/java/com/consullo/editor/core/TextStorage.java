package com.consullo.editor.core;

import java.util.Optional;

/**
 * Text storage abstraction shared by a single {@link Document} and by the multi-document session
 * that routes calls to its current document.
 *
 * <p>Offsets are zero-based {@code char} indexes into {@link #content()} and range over
 * {@code [0, length()]} inclusive. Lines are the content split on line feeds; a storage with no
 * content still has exactly one (empty) line.
 *
 * @since 1.0
 */
public interface TextStorage {

  /**
   * Returns the canonical text.
   *
   * @return full content, never null
   */
  String content();

  /**
   * Returns the length of the canonical text in chars.
   *
   * @return content length
   */
  int length();

  /**
   * Returns true when the storage holds no text.
   *
   * @return true if empty
   */
  boolean isEmpty();

  /**
   * Inserts a character at the given offset. A line feed splits the containing line in two.
   *
   * @param offset insertion offset in {@code [0, length()]}
   * @param ch character to insert
   * @throws OutOfBoundsException if {@code offset > length()}
   */
  void insert(int offset, char ch) throws EditorException;

  /**
   * Deletes the character immediately before {@code offset}. At column 0 of a non-first line this
   * removes the preceding line feed, merging the line into the previous one.
   *
   * @param offset cursor offset in {@code [1, length()]}
   * @throws InvalidOperationException if {@code offset} is the start of the buffer
   * @throws OutOfBoundsException if {@code offset > length()}
   */
  void delete(int offset) throws EditorException;

  /**
   * Appends text to the end of the storage. Appending empty text is a no-op.
   *
   * @param text text to append
   * @throws EditorException if the append is rejected
   */
  void append(String text) throws EditorException;

  /**
   * Resets the storage to a single empty line.
   */
  void clear();

  int lineCount();

  /**
   * Returns the length of a line, or 0 when the line does not exist.
   *
   * @param line zero-based line index
   * @return line length in chars
   */
  int lineLength(int line);

  /**
   * Returns a line without its line feed.
   *
   * @param line zero-based line index
   * @return the line, or empty when out of range
   */
  Optional<String> getLine(int line);
}
