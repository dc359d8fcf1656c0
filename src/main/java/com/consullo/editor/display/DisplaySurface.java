package com.consullo.editor.display;

import com.consullo.editor.core.Position;

/**
 * Terminal surface the editing loop renders to and reads keystrokes from.
 *
 * <p>The buffer engine never depends on a surface. Only the driver renders frames, and only the
 * dispatch loop reads input.
 *
 * @since 1.0
 */
public interface DisplaySurface extends AutoCloseable {

  void init() throws Exception;

  void clear() throws Exception;

  /**
   * Renders document text with the cursor at the given position.
   *
   * @param text text to render
   * @param cursor cursor position within the text
   * @throws Exception if rendering fails
   */
  void renderText(String text, Position cursor) throws Exception;

  /**
   * Renders the status line.
   *
   * @param status status text
   * @throws Exception if rendering fails
   */
  void renderStatus(String status) throws Exception;

  void moveCursor(Position position) throws Exception;

  /**
   * Flushes pending output to the terminal.
   *
   * @throws Exception if the flush fails
   */
  void refresh() throws Exception;

  /**
   * Blocks until the next keystroke.
   *
   * @return a printable character ordinal or one of the {@link InputCode} constants
   * @throws Exception if input cannot be read
   */
  int readInput() throws Exception;

  int columns();

  int rows();

  /**
   * Restores the terminal to its original mode.
   *
   * @throws Exception if the terminal cannot be restored
   */
  @Override
  void close() throws Exception;
}
