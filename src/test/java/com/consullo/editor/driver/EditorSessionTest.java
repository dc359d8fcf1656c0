package com.consullo.editor.driver;

import com.consullo.editor.core.InvalidOperationException;
import com.consullo.editor.core.Position;
import com.consullo.editor.display.HeadlessDisplaySurface;
import com.consullo.editor.io.InMemoryFileService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Keystroke-level tests for the editing session over an in-memory file service.
 *
 * @since 1.0
 */
public class EditorSessionTest {

  @Test
  @DisplayName("Should delete before the cursor and step the cursor back")
  void backspace_EndOfWord_RemovesLastChar() throws Exception {
    final EditorSession editor = editorWith("Hello");
    editor.moveTo(new Position(5, 0));

    editor.backspace();

    assertThat(editor.session().content()).isEqualTo("Hell");
    assertThat(editor.cursor()).isEqualTo(new Position(4, 0));
  }

  @Test
  @DisplayName("Should join lines when backspacing at a line start")
  void backspace_LineStart_JoinsLines() throws Exception {
    final EditorSession editor = editorWith("ab\ncd");
    editor.moveTo(new Position(0, 1));

    editor.backspace();

    assertThat(editor.session().content()).isEqualTo("abcd");
    assertThat(editor.cursor()).isEqualTo(new Position(2, 0));
  }

  @Test
  @DisplayName("Should ignore backspace at the start and delete-forward at the end")
  void deleteKeys_AtBoundaries_DoNothing() throws Exception {
    final EditorSession editor = editorWith("ab");

    editor.backspace();
    editor.moveToLineEnd();
    editor.deleteForward();

    assertThat(editor.session().content()).isEqualTo("ab");
    assertThat(editor.session().currentMetadata().isDirty()).isFalse();
    assertThat(editor.canUndo()).isFalse();
  }

  @Test
  @DisplayName("Should delete the character under the cursor")
  void deleteForward_Middle_RemovesCharUnderCursor() throws Exception {
    final EditorSession editor = editorWith("abc");
    editor.moveTo(new Position(1, 0));

    editor.deleteForward();

    assertThat(editor.session().content()).isEqualTo("ac");
    assertThat(editor.cursor()).isEqualTo(new Position(1, 0));
  }

  @Test
  @DisplayName("Should undo and redo typed characters one at a time")
  void undoRedo_TypedChars_StepThroughStates() throws Exception {
    final EditorSession editor = editorWith("");
    editor.insertChar('a');
    editor.insertChar('b');

    assertThat(editor.undo()).isTrue();
    assertThat(editor.session().content()).isEqualTo("a");
    assertThat(editor.undo()).isTrue();
    assertThat(editor.session().content()).isEmpty();
    assertThat(editor.undo()).isFalse();

    assertThat(editor.redo()).isTrue();
    assertThat(editor.session().content()).isEqualTo("a");
    assertThat(editor.redo()).isTrue();
    assertThat(editor.session().content()).isEqualTo("ab");
    assertThat(editor.redo()).isFalse();
  }

  @Test
  @DisplayName("Should drop the redo branch after a new edit")
  void insertChar_AfterUndo_ClearsRedo() throws Exception {
    final EditorSession editor = editorWith("");
    editor.insertChar('a');
    editor.undo();

    editor.insertChar('z');

    assertThat(editor.canRedo()).isFalse();
    assertThat(editor.session().content()).isEqualTo("z");
  }

  @Test
  @DisplayName("Should insert a tab as spaces in a single undo step")
  void insertTab_DefaultSize_OneUndoStep() throws Exception {
    final EditorSession editor = editorWith("x");

    editor.insertTab();

    assertThat(editor.session().content()).isEqualTo("    x");
    assertThat(editor.cursor()).isEqualTo(new Position(4, 0));
    editor.undo();
    assertThat(editor.session().content()).isEqualTo("x");
  }

  @Test
  @DisplayName("Should break the line and move to the next line start on newline")
  void newline_MiddleOfLine_SplitsLine() throws Exception {
    final EditorSession editor = editorWith("abcd");
    editor.moveTo(new Position(2, 0));

    editor.newline();

    assertThat(editor.session().content()).isEqualTo("ab\ncd");
    assertThat(editor.cursor()).isEqualTo(new Position(0, 1));
  }

  @Test
  @DisplayName("Should copy, cut and paste through the selection")
  void selection_CopyCutPaste() throws Exception {
    final EditorSession editor = editorWith("Hello World");

    editor.startSelection();
    editor.moveTo(new Position(5, 0));
    assertThat(editor.selectionRange()).contains(new EditorSession.Selection(0, 5));
    assertThat(editor.copySelection()).isEqualTo("Hello");

    editor.moveToLineEnd();
    editor.paste();
    assertThat(editor.session().content()).isEqualTo("Hello WorldHello");

    editor.moveTo(new Position(11, 0));
    editor.startSelection();
    editor.moveTo(new Position(5, 0));
    assertThat(editor.cutSelection()).isEqualTo(" World");
    assertThat(editor.session().content()).isEqualTo("HelloHello");
    assertThat(editor.cursor()).isEqualTo(new Position(5, 0));
    assertThat(editor.selectionRange()).isEmpty();
    assertThat(editor.clipboard()).isEqualTo(" World");
  }

  @Test
  @DisplayName("Should fail when copying without a selection")
  void copySelection_NoSelection_Throws() throws Exception {
    final EditorSession editor = editorWith("abc");

    assertThatThrownBy(editor::copySelection).isInstanceOf(InvalidOperationException.class);
  }

  @Test
  @DisplayName("Should reject edits in read-only mode")
  void readOnly_Edits_Rejected() throws Exception {
    final InMemoryFileService files = new InMemoryFileService(Map.of("a.txt", "abc"));
    final EditorSession editor = EditorSessionFactory.createSession(
        files, List.of("a.txt"), EditorSessionFactory.defaultConfig(true));

    assertThatThrownBy(() -> editor.insertChar('x'))
        .isInstanceOf(InvalidOperationException.class)
        .hasMessage("Cannot edit in read-only mode");
    assertThatThrownBy(editor::save).isInstanceOf(InvalidOperationException.class);
    assertThat(editor.copy(0, 2)).isEqualTo("ab");
    assertThat(editor.session().content()).isEqualTo("abc");
    assertThat(editor.statusLine()).endsWith(" | READ-ONLY");
  }

  @Test
  @DisplayName("Should save through the file service and clear the dirty marker")
  void save_AfterEdit_WritesFile() throws Exception {
    final InMemoryFileService files = new InMemoryFileService(Map.of("a.txt", "abc"));
    final EditorSession editor = EditorSessionFactory.createSession(
        files, List.of("a.txt"), EditorSessionFactory.defaultConfig(false));
    editor.moveToLineEnd();
    editor.insertChar('d');
    assertThat(editor.statusLine()).isEqualTo("a.txt* | Position: 1:5");

    editor.save();

    assertThat(files.read("a.txt")).contains("abcd");
    assertThat(editor.statusLine()).isEqualTo("a.txt | Position: 1:5");
  }

  @Test
  @DisplayName("Should keep a separate history per document")
  void history_PerDocument() throws Exception {
    final InMemoryFileService files = new InMemoryFileService(Map.of("a.txt", "a", "b.txt", "b"));
    final EditorSession editor = EditorSessionFactory.createSession(
        files, List.of("a.txt", "b.txt"), EditorSessionFactory.defaultConfig(false));

    editor.insertChar('1');
    editor.previousDocument();
    assertThat(editor.cursor()).isEqualTo(Position.origin());
    assertThat(editor.canUndo()).isFalse();
    editor.insertChar('2');

    editor.nextDocument();
    editor.undo();
    assertThat(editor.session().content()).isEqualTo("b");

    editor.switchTo(0);
    assertThat(editor.session().content()).isEqualTo("2a");
    editor.closeCurrent();
    assertThat(editor.session().count()).isEqualTo(1);
    assertThat(editor.session().currentMetadata().getName()).isEqualTo("b.txt");
  }

  @Test
  @DisplayName("Should open new documents and focus them with a reset cursor")
  void openAndNewDocument_FocusNewDocument() throws Exception {
    final InMemoryFileService files = new InMemoryFileService(Map.of("a.txt", "abc"));
    final EditorSession editor = EditorSessionFactory.createSession(
        files, List.of(), EditorSessionFactory.defaultConfig(false));
    editor.insertChar('x');

    assertThat(editor.open("a.txt")).isEqualTo(1);
    assertThat(editor.cursor()).isEqualTo(Position.origin());
    assertThat(editor.newDocument()).isEqualTo(2);
    assertThat(editor.session().currentMetadata().getName()).isEqualTo("*untitled-1");

    editor.saveAs("c.txt");
    assertThat(files.read("c.txt")).contains("");
  }

  @Test
  @DisplayName("Should render the document, status line and cursor on a display")
  void render_HeadlessDisplay_DrawsFrame() throws Exception {
    final EditorSession editor = editorWith("one\ntwo");
    editor.moveTo(new Position(9, 1));
    final HeadlessDisplaySurface display = new HeadlessDisplaySurface(80, 24);

    editor.render(display);

    assertThat(display.text()).isEqualTo("one\ntwo");
    assertThat(display.cursor()).isEqualTo(new Position(3, 1));
    assertThat(display.status()).isEqualTo("doc.txt | Position: 2:4");
    assertThat(display.refreshCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should keep the cursor inside the document while moving")
  void moveCursor_PastEdges_IsConstrained() throws Exception {
    final EditorSession editor = editorWith("ab\nc");

    editor.moveCursor(5, 0);
    assertThat(editor.cursor()).isEqualTo(new Position(2, 0));
    editor.moveCursor(0, 3);
    assertThat(editor.cursor()).isEqualTo(new Position(1, 1));
    editor.moveToLineStart();
    editor.moveCursor(-1, -1);
    assertThat(editor.cursor()).isEqualTo(Position.origin());
  }

  @Test
  @DisplayName("Should keep exactly historyCapacity edits undoable")
  void undo_SmallCapacity_UndoesEveryKeptEdit() throws Exception {
    final EditorSession single = editorWith("", new EditorConfig(1, 4, false));
    single.insertChar('a');
    assertThat(single.undo()).isTrue();
    assertThat(single.session().content()).isEmpty();

    final EditorSession editor = editorWith("", new EditorConfig(3, 4, false));
    editor.insertChar('a');
    editor.insertChar('b');
    editor.insertChar('c');
    assertThat(editor.undo()).isTrue();
    assertThat(editor.undo()).isTrue();
    assertThat(editor.undo()).isTrue();
    assertThat(editor.session().content()).isEmpty();
    assertThat(editor.undo()).isFalse();
  }

  @Test
  @DisplayName("Should record nothing when the tab size is zero")
  void insertTab_ZeroSize_IsNoOp() throws Exception {
    final EditorSession editor = editorWith("x", new EditorConfig(10, 0, false));

    editor.insertTab();

    assertThat(editor.session().content()).isEqualTo("x");
    assertThat(editor.canUndo()).isFalse();
    assertThat(editor.session().currentMetadata().isDirty()).isFalse();
  }

  @Test
  @DisplayName("Should refuse to save under the name of another open document")
  void saveAs_NameOfOtherDocument_Rejected() throws Exception {
    final InMemoryFileService files = new InMemoryFileService(Map.of("a.txt", "a", "b.txt", "b"));
    final EditorSession editor = EditorSessionFactory.createSession(
        files, List.of("a.txt", "b.txt"), EditorSessionFactory.defaultConfig(false));

    assertThatThrownBy(() -> editor.saveAs("a.txt")).isInstanceOf(InvalidOperationException.class);
    assertThat(editor.session().currentMetadata().getName()).isEqualTo("b.txt");
    assertThat(files.read("a.txt")).contains("a");

    editor.saveAs("b.txt");
    assertThat(files.read("b.txt")).contains("b");
  }

  private static EditorSession editorWith(final String content, final EditorConfig config) throws Exception {
    final InMemoryFileService files = new InMemoryFileService(Map.of("doc.txt", content));
    return EditorSessionFactory.createSession(files, List.of("doc.txt"), config);
  }

  private static EditorSession editorWith(final String content) throws Exception {
    final InMemoryFileService files = new InMemoryFileService(Map.of("doc.txt", content));
    return EditorSessionFactory.createSession(files, List.of("doc.txt"), EditorSessionFactory.defaultConfig(false));
  }
}
