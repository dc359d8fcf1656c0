package com.consullo.editor.display;

import com.consullo.editor.core.Position;
import java.util.ArrayDeque;
import java.util.Deque;
import org.apache.commons.lang3.Validate;

/**
 * Display surface without a terminal.
 *
 * <p>Keeps the most recent frame (text, status, cursor) for inspection and replays scripted input
 * codes, reporting {@link InputCode#END_OF_INPUT} once the script is exhausted.
 *
 * @since 1.0
 */
public final class HeadlessDisplaySurface implements DisplaySurface {

  private final int columns;
  private final int rows;
  private final Deque<Integer> scriptedInput = new ArrayDeque<>();

  private String text = "";
  private String status = "";
  private Position cursor = Position.origin();
  private int refreshCount;
  private boolean open;

  public HeadlessDisplaySurface(final int columns, final int rows) {
    Validate.isTrue(columns > 0, "columns must be positive");
    Validate.isTrue(rows > 1, "rows must leave room for the status line");
    this.columns = columns;
    this.rows = rows;
  }

  /**
   * Queues input codes returned by later {@link #readInput()} calls.
   *
   * @param codes input codes in order
   */
  public void enqueueInput(final int... codes) {
    for (final int code : codes) {
      this.scriptedInput.addLast(code);
    }
  }

  /**
   * Queues each char of a string as a typed keystroke.
   *
   * @param typed text to type
   */
  public void enqueueText(final String typed) {
    Validate.notNull(typed, "typed must not be null");
    for (int i = 0; i < typed.length(); i++) {
      this.scriptedInput.addLast((int) typed.charAt(i));
    }
  }

  @Override
  public void init() {
    this.open = true;
  }

  @Override
  public void clear() {
    this.text = "";
    this.status = "";
  }

  @Override
  public void renderText(final String newText, final Position newCursor) {
    Validate.notNull(newText, "text must not be null");
    Validate.notNull(newCursor, "cursor must not be null");
    this.text = newText;
    this.cursor = newCursor;
  }

  @Override
  public void renderStatus(final String newStatus) {
    Validate.notNull(newStatus, "status must not be null");
    this.status = newStatus;
  }

  @Override
  public void moveCursor(final Position position) {
    Validate.notNull(position, "position must not be null");
    this.cursor = position;
  }

  @Override
  public void refresh() {
    this.refreshCount++;
  }

  @Override
  public int readInput() {
    final Integer next = this.scriptedInput.pollFirst();
    return next != null ? next : InputCode.END_OF_INPUT;
  }

  @Override
  public int columns() {
    return this.columns;
  }

  @Override
  public int rows() {
    return this.rows;
  }

  @Override
  public void close() {
    this.open = false;
  }

  public String text() {
    return this.text;
  }

  public String status() {
    return this.status;
  }

  public Position cursor() {
    return this.cursor;
  }

  public int refreshCount() {
    return this.refreshCount;
  }

  public boolean isOpen() {
    return this.open;
  }
}
