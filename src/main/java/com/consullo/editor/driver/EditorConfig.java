package com.consullo.editor.driver;

/**
 * Editing session configuration values.
 *
 * @param historyCapacity undoable edits kept per document
 * @param tabSize spaces inserted by a tab keystroke; 0 makes the tab key a no-op
 * @param readOnly if true, every mutating operation is rejected
 * @since 1.0
 */
public record EditorConfig(
    int historyCapacity,
    int tabSize,
    boolean readOnly) {
}
