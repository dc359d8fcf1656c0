package com.consullo.editor.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Single in-memory text container with a line index.
 *
 * <p>{@code text} is the canonical content and {@code lines} its split on line feeds. Structural
 * edits (insert, delete) work on {@code lines} and rebuild {@code text} before returning; append
 * works on {@code text} and re-derives {@code lines}. After every public mutation
 * {@code String.join("\n", lines).equals(text)} holds.
 *
 * <p>Offset to position mapping is a linear scan over the lines, accumulating
 * {@code line.length() + 1} for the separator. Not thread-safe; a document is owned by one
 * session.
 *
 * @since 1.0
 */
public final class Document implements TextStorage {

  private static final char LINE_FEED = '\n';

  private String text;
  private final List<String> lines;

  /**
   * Creates an empty document: empty text, one empty line.
   */
  public Document() {
    this.text = "";
    this.lines = new ArrayList<>();
    this.lines.add("");
  }

  private Document(final String content) {
    this.text = content;
    this.lines = splitLines(content);
  }

  /**
   * Creates a document from existing text, such as the content of an opened file.
   *
   * @param content initial text
   * @return new document
   */
  public static Document fromContent(final String content) {
    Validate.notNull(content, "content must not be null");
    return new Document(content);
  }

  /**
   * Creates an independent document holding a copy of another storage's content.
   *
   * @param storage storage to copy
   * @return new document
   */
  public static Document copyOf(final TextStorage storage) {
    Validate.notNull(storage, "storage must not be null");
    return new Document(storage.content());
  }

  @Override
  public String content() {
    return this.text;
  }

  @Override
  public int length() {
    return this.text.length();
  }

  @Override
  public boolean isEmpty() {
    return this.text.isEmpty();
  }

  @Override
  public void insert(final int offset, final char ch) throws EditorException {
    if (offset < 0 || offset > this.text.length()) {
      throw new OutOfBoundsException("insert offset " + offset + " is out of bounds for length " + this.text.length());
    }

    final Position at = toPosition(offset);
    final String line = this.lines.get(at.line());
    if (ch == LINE_FEED) {
      this.lines.set(at.line(), line.substring(0, at.column()));
      this.lines.add(at.line() + 1, line.substring(at.column()));
    } else {
      this.lines.set(at.line(), line.substring(0, at.column()) + ch + line.substring(at.column()));
    }

    rebuildText();
  }

  @Override
  public void delete(final int offset) throws EditorException {
    if (offset < 0 || offset > this.text.length()) {
      throw new OutOfBoundsException("delete offset " + offset + " is out of bounds for length " + this.text.length());
    }

    final Position at = toPosition(offset);
    if (at.column() == 0 && at.line() > 0) {
      // Remove the line feed ending the previous line.
      final String current = this.lines.remove(at.line());
      this.lines.set(at.line() - 1, this.lines.get(at.line() - 1) + current);
    } else if (at.column() > 0) {
      final String line = this.lines.get(at.line());
      this.lines.set(at.line(), line.substring(0, at.column() - 1) + line.substring(at.column()));
    } else {
      throw new InvalidOperationException("Cannot delete at beginning of buffer");
    }

    rebuildText();
  }

  @Override
  public void append(final String appended) {
    Validate.notNull(appended, "text must not be null");
    if (appended.isEmpty()) {
      return;
    }

    this.text = this.text + appended;
    rebuildLines();
  }

  @Override
  public void clear() {
    this.text = "";
    this.lines.clear();
    this.lines.add("");
  }

  @Override
  public int lineCount() {
    return this.lines.size();
  }

  @Override
  public int lineLength(final int line) {
    if (line < 0 || line >= this.lines.size()) {
      return 0;
    }
    return this.lines.get(line).length();
  }

  @Override
  public Optional<String> getLine(final int line) {
    if (line < 0 || line >= this.lines.size()) {
      return Optional.empty();
    }
    return Optional.of(this.lines.get(line));
  }

  /**
   * Returns a read-only view of the line index.
   *
   * @return lines without their line feeds
   */
  public List<String> lines() {
    return Collections.unmodifiableList(this.lines);
  }

  /**
   * Strictly translates an offset into a position.
   *
   * @param offset offset in {@code [0, length()]}
   * @return matching position
   * @throws OutOfBoundsException if the offset lies outside the text
   */
  public Position toPosition(final int offset) throws OutOfBoundsException {
    if (offset < 0) {
      throw new OutOfBoundsException("offset " + offset + " is negative");
    }

    int lineStart = 0;
    for (int i = 0; i < this.lines.size(); i++) {
      final int lineLength = this.lines.get(i).length();
      if (lineStart + lineLength >= offset) {
        return new Position(offset - lineStart, i);
      }
      lineStart += lineLength + 1;
    }

    throw new OutOfBoundsException("offset " + offset + " is out of bounds for length " + this.text.length());
  }

  /**
   * Strictly translates a position into an offset.
   *
   * @param position position inside the document
   * @return matching offset
   * @throws OutOfBoundsException if the line does not exist or the column is past the line end
   */
  public int toOffset(final Position position) throws OutOfBoundsException {
    Validate.notNull(position, "position must not be null");
    if (position.line() >= this.lines.size()) {
      throw new OutOfBoundsException("line " + position.line() + " is out of bounds for " + this.lines.size() + " lines");
    }

    int offset = 0;
    for (int i = 0; i < position.line(); i++) {
      offset += this.lines.get(i).length() + 1;
    }

    if (position.column() > this.lines.get(position.line()).length()) {
      throw new OutOfBoundsException("column " + position.column() + " is past the end of line " + position.line());
    }
    return offset + position.column();
  }

  @Override
  public String toString() {
    return "Document[length=" + this.text.length() + ", lines=" + this.lines.size() + "]";
  }

  private void rebuildText() {
    this.text = String.join("\n", this.lines);
  }

  private void rebuildLines() {
    this.lines.clear();
    this.lines.addAll(splitLines(this.text));
  }

  private static List<String> splitLines(final String content) {
    final List<String> out = new ArrayList<>();
    int start = 0;
    for (int i = 0; i < content.length(); i++) {
      if (content.charAt(i) == LINE_FEED) {
        out.add(content.substring(start, i));
        start = i + 1;
      }
    }
    out.add(content.substring(start));
    return out;
  }
}
