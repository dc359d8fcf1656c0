package com.consullo.editor.demo;

import com.consullo.editor.core.EditorException;
import com.consullo.editor.display.HeadlessDisplaySurface;
import com.consullo.editor.display.InputCode;
import com.consullo.editor.driver.EditorSession;
import com.consullo.editor.driver.EditorSessionFactory;
import com.consullo.editor.io.InMemoryFileService;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that replays a scripted editing session against a headless display and prints the
 * resulting document.
 *
 * <p>Without arguments the demo edits an in-memory {@code notes.txt}. With arguments it opens
 * those files from the current directory, edits the last one and saves it (with a backup).
 *
 * @since 1.0
 */
public final class EditorDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(EditorDemo.class);

  private EditorDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args files to open
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    final List<String> files = Arrays.asList(args);
    final EditorSession editor;
    if (files.isEmpty()) {
      final InMemoryFileService fileService = new InMemoryFileService(Map.of("notes.txt", "first line\n"));
      editor = EditorSessionFactory.createSession(
          fileService, List.of("notes.txt"), EditorSessionFactory.defaultConfig(false));
    } else {
      editor = EditorSessionFactory.createLocalSession(Path.of(".").toAbsolutePath().normalize(), files, false);
    }

    try (final HeadlessDisplaySurface display = new HeadlessDisplaySurface(80, 24)) {
      display.init();
      editor.session().addChangeListener(event -> LOGGER.debug("{} at {} in {}",
          event.kind(), event.offset(), event.documentName()));

      // Jump past the existing text, type two lines, fix a typo and duplicate the first word.
      display.enqueueInput(InputCode.ARROW_DOWN, InputCode.END);
      display.enqueueText("Hello wrold");
      display.enqueueInput(InputCode.BACKSPACE, InputCode.BACKSPACE, InputCode.BACKSPACE, InputCode.BACKSPACE);
      display.enqueueText("orld");
      display.enqueueInput(InputCode.LINE_FEED, InputCode.TAB);
      display.enqueueText("indented");

      int code;
      while ((code = display.readInput()) != InputCode.END_OF_INPUT) {
        replay(editor, code);
        editor.render(display);
      }

      editor.undo();
      editor.redo();
      editor.copy(0, 5);
      editor.moveToLineEnd();
      editor.paste();
      editor.save();
      editor.render(display);

      System.out.println("=== Document ===");
      System.out.println(display.text());
      System.out.println("=== " + display.status() + " ===");
      LOGGER.info("Demo completed after {} frames", display.refreshCount());
    }
  }

  private static void replay(final EditorSession editor, final int code) throws EditorException {
    if (InputCode.isPrintable(code)) {
      editor.insertChar((char) code);
    } else if (InputCode.isBackspace(code)) {
      editor.backspace();
    } else if (InputCode.isEnter(code)) {
      editor.newline();
    } else if (code == InputCode.TAB) {
      editor.insertTab();
    } else if (code == InputCode.DELETE) {
      editor.deleteForward();
    } else if (code == InputCode.ARROW_UP) {
      editor.moveCursor(0, -1);
    } else if (code == InputCode.ARROW_DOWN) {
      editor.moveCursor(0, 1);
    } else if (code == InputCode.ARROW_LEFT) {
      editor.moveCursor(-1, 0);
    } else if (code == InputCode.ARROW_RIGHT) {
      editor.moveCursor(1, 0);
    } else if (code == InputCode.HOME) {
      editor.moveToLineStart();
    } else if (code == InputCode.END) {
      editor.moveToLineEnd();
    } else {
      LOGGER.debug("Ignoring input code {}", code);
    }
  }
}
