package com.consullo.editor.history;

import java.util.Optional;

/**
 * Linear undo/redo history.
 *
 * <p>Operations never fail: an empty history is an expected steady state and is reported as
 * {@link Optional#empty()}.
 *
 * @param <T> recorded state type
 * @since 1.0
 */
public interface UndoRedoSystem<T> {

  /**
   * Records a new state and invalidates the redo history.
   *
   * @param state state to record
   */
  void saveState(T state);

  /**
   * Steps back in the history.
   *
   * @return the state to restore, or empty if there is nothing to undo
   */
  Optional<T> undo();

  /**
   * Steps forward to a previously undone state.
   *
   * @return the state to restore, or empty if there is nothing to redo
   */
  Optional<T> redo();

  boolean canUndo();

  boolean canRedo();

  void clear();
}
