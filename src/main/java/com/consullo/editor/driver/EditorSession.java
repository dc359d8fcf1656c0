package com.consullo.editor.driver;

import com.consullo.editor.core.EditorException;
import com.consullo.editor.core.InvalidOperationException;
import com.consullo.editor.core.Position;
import com.consullo.editor.cursor.Cursor;
import com.consullo.editor.cursor.CursorTranslator;
import com.consullo.editor.display.DisplaySurface;
import com.consullo.editor.history.HistoryStack;
import com.consullo.editor.selection.SelectionHelper;
import com.consullo.editor.session.DocumentMetadata;
import com.consullo.editor.session.Session;
import java.io.IOException;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cursor-driven editing over a {@link Session}: the operations a keystroke dispatcher calls.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>the session and its live cursor</li>
 * <li>a selection helper with its clipboard</li>
 * <li>one snapshot history per open document</li>
 * </ul>
 * </p>
 *
 * <p>Each document's history is seeded with the document's text the first time it is edited and
 * receives a snapshot after every successful mutation, so the state returned by
 * {@link HistoryStack#undo()} is the text to restore.
 */
public final class EditorSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(EditorSession.class);

  private final Session session;
  private final EditorConfig config;
  private final Cursor cursor = new Cursor();
  private final SelectionHelper selection = new SelectionHelper();
  private final Map<DocumentMetadata, HistoryStack<String>> histories = new IdentityHashMap<>();

  private int selectionAnchor = -1;

  /**
   * Normalized selection range.
   *
   * @param start first offset, inclusive
   * @param end last offset, exclusive
   */
  public record Selection(int start, int end) {
  }

  public EditorSession(final Session session, final EditorConfig config) {
    Validate.notNull(session, "session must not be null");
    Validate.notNull(config, "config must not be null");
    Validate.isTrue(config.historyCapacity() > 0, "historyCapacity must be positive");
    Validate.isTrue(config.tabSize() >= 0, "tabSize must not be negative");
    this.session = session;
    this.config = config;
  }

  public Session session() {
    return session;
  }

  public Position cursor() {
    return cursor.position();
  }

  public String clipboard() {
    return selection.clipboard().get();
  }

  public boolean isReadOnly() {
    return config.readOnly();
  }

  public void insertChar(final char ch) throws EditorException {
    checkWritable();
    history();
    typeChar(ch);
    snapshot();
  }

  public void newline() throws EditorException {
    insertChar('\n');
  }

  /**
   * Inserts {@code tabSize} spaces as a single undo step. Does nothing when {@code tabSize} is 0.
   *
   * @throws EditorException if the session is read-only or an insertion fails
   */
  public void insertTab() throws EditorException {
    checkWritable();
    if (config.tabSize() == 0) {
      return;
    }
    history();
    for (int i = 0; i < config.tabSize(); i++) {
      typeChar(' ');
    }
    snapshot();
  }

  /**
   * Deletes the character before the cursor, joining lines at a line start. Does nothing at the
   * start of the document.
   *
   * @throws EditorException if the session is read-only or the deletion fails
   */
  public void backspace() throws EditorException {
    checkWritable();
    final int offset = cursor.offsetIn(session);
    if (offset == 0) {
      return;
    }

    history();
    final Position target = CursorTranslator.fromOffset(session, offset - 1);
    session.delete(offset);
    cursor.moveTo(target);
    cursor.constrain(session);
    snapshot();
  }

  /**
   * Deletes the character under the cursor. Does nothing at the end of the document.
   *
   * @throws EditorException if the session is read-only or the deletion fails
   */
  public void deleteForward() throws EditorException {
    checkWritable();
    final int offset = cursor.offsetIn(session);
    if (offset >= session.length()) {
      return;
    }

    history();
    session.delete(offset + 1);
    cursor.moveTo(CursorTranslator.fromOffset(session, offset));
    snapshot();
  }

  public void moveCursor(final int dx, final int dy) {
    cursor.moveBy(dx, dy);
    cursor.constrain(session);
  }

  public void moveTo(final Position position) {
    cursor.moveTo(position);
    cursor.constrain(session);
  }

  public void moveToLineStart() {
    cursor.moveTo(cursor.position().withColumn(0));
  }

  public void moveToLineEnd() {
    final int line = cursor.position().line();
    cursor.moveTo(cursor.position().withColumn(session.lineLength(line)));
  }

  public void startSelection() {
    selectionAnchor = cursor.offsetIn(session);
  }

  public void clearSelection() {
    selectionAnchor = -1;
  }

  /**
   * Returns the range between the selection anchor and the cursor, ordered.
   *
   * @return selection, or empty when no selection is active
   */
  public Optional<Selection> selectionRange() {
    if (selectionAnchor < 0) {
      return Optional.empty();
    }
    final int anchor = Math.min(selectionAnchor, session.length());
    final int at = cursor.offsetIn(session);
    return Optional.of(new Selection(Math.min(anchor, at), Math.max(anchor, at)));
  }

  public String copySelection() throws EditorException {
    final Selection range = requireSelection();
    return copy(range.start(), range.end());
  }

  public String cutSelection() throws EditorException {
    final Selection range = requireSelection();
    final String cut = cut(range.start(), range.end());
    clearSelection();
    return cut;
  }

  public String copy(final int start, final int end) throws EditorException {
    return selection.copy(session, start, end);
  }

  public String cut(final int start, final int end) throws EditorException {
    checkWritable();
    history();
    final String cut = selection.cut(session, start, end, cursor);
    snapshot();
    return cut;
  }

  /**
   * Pastes the clipboard at the cursor as a single undo step.
   *
   * @throws EditorException if the session is read-only or an insertion fails
   */
  public void paste() throws EditorException {
    checkWritable();
    if (selection.clipboard().isEmpty()) {
      return;
    }
    history();
    selection.paste(session, cursor);
    snapshot();
  }

  /**
   * Restores the current document to the text before its most recent edit.
   *
   * @return true if a state was restored
   * @throws InvalidOperationException if the session is read-only
   */
  public boolean undo() throws InvalidOperationException {
    checkWritable();
    final HistoryStack<String> history = history();
    // The oldest entry is the document's original text and stays put.
    if (history.undoCount() <= 1) {
      return false;
    }
    final Optional<String> state = history.undo();
    state.ifPresent(this::restore);
    return state.isPresent();
  }

  /**
   * Re-applies the most recently undone edit of the current document.
   *
   * @return true if a state was restored
   * @throws InvalidOperationException if the session is read-only
   */
  public boolean redo() throws InvalidOperationException {
    checkWritable();
    final Optional<String> state = history().redo();
    state.ifPresent(this::restore);
    return state.isPresent();
  }

  public boolean canUndo() {
    final HistoryStack<String> history = histories.get(session.currentMetadata());
    return history != null && history.undoCount() > 1;
  }

  public boolean canRedo() {
    final HistoryStack<String> history = histories.get(session.currentMetadata());
    return history != null && history.canRedo();
  }

  public int open(final String name) throws IOException {
    final int index = session.openOrFocus(name);
    resetCursor();
    return index;
  }

  public int newDocument() {
    final int index = session.newEmpty();
    resetCursor();
    return index;
  }

  public void nextDocument() throws EditorException {
    session.next();
    resetCursor();
  }

  public void previousDocument() throws EditorException {
    session.previous();
    resetCursor();
  }

  public void switchTo(final int index) throws EditorException {
    session.switchTo(index);
    resetCursor();
  }

  /**
   * Closes the current document and drops its history.
   *
   * @throws EditorException if the document cannot be closed
   */
  public void closeCurrent() throws EditorException {
    final DocumentMetadata closed = session.currentMetadata();
    session.closeCurrent();
    histories.remove(closed);
    resetCursor();
  }

  public void save() throws IOException, InvalidOperationException {
    checkWritable();
    session.saveCurrent();
  }

  public void saveAs(final String name) throws IOException, InvalidOperationException {
    checkWritable();
    session.saveCurrentAs(name);
  }

  /**
   * Formats the status line: document status from the session, then the one-based cursor line and
   * column.
   *
   * @return status text
   */
  public String statusLine() {
    final Position at = cursor.position();
    final StringBuilder sb = new StringBuilder(session.statusLine())
        .append(" | Position: ")
        .append(at.line() + 1)
        .append(':')
        .append(at.column() + 1);
    if (config.readOnly()) {
      sb.append(" | READ-ONLY");
    }
    return sb.toString();
  }

  /**
   * Draws the current document, status line and cursor on a display surface.
   *
   * @param display target surface
   * @throws Exception if the surface fails
   */
  public void render(final DisplaySurface display) throws Exception {
    Validate.notNull(display, "display must not be null");
    display.clear();
    display.renderText(session.content(), cursor.position());
    display.renderStatus(statusLine());
    display.moveCursor(cursor.position());
    display.refresh();
  }

  private void typeChar(final char ch) throws EditorException {
    session.insert(cursor.offsetIn(session), ch);
    cursor.advance(ch);
    cursor.constrain(session);
  }

  private void restore(final String text) {
    session.restoreCurrent(text);
    cursor.constrain(session);
    clearSelection();
  }

  private HistoryStack<String> history() {
    return histories.computeIfAbsent(session.currentMetadata(), info -> {
      // Baseline text plus historyCapacity edits.
      final HistoryStack<String> history = new HistoryStack<>(config.historyCapacity() + 1);
      history.saveState(session.content());
      return history;
    });
  }

  private void snapshot() {
    history().saveState(session.content());
  }

  private Selection requireSelection() throws InvalidOperationException {
    return selectionRange().orElseThrow(() -> new InvalidOperationException("No active selection"));
  }

  private void resetCursor() {
    cursor.moveTo(Position.origin());
    clearSelection();
    LOGGER.debug("Focused {}", session.currentMetadata().getName());
  }

  private void checkWritable() throws InvalidOperationException {
    if (config.readOnly()) {
      throw new InvalidOperationException("Cannot edit in read-only mode");
    }
  }
}
