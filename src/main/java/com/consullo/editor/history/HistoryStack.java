package com.consullo.editor.history;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.function.Predicate;
import org.apache.commons.lang3.Validate;

/**
 * Bounded dual-stack history of full-content snapshots.
 *
 * <p>Both stacks hold at most {@code capacity} entries and evict oldest-first independently.
 * {@link #undo()} returns the new top of the undo stack after popping, that is the state recorded
 * before the one being undone; {@link #redo()} returns the entry it pops.
 *
 * @param <T> snapshot type
 * @since 1.0
 */
public final class HistoryStack<T> implements UndoRedoSystem<T> {

  public static final int DEFAULT_CAPACITY = 100;

  // Newest entries are at the tail of each deque.
  private final Deque<T> undoStack;
  private final Deque<T> redoStack;
  private final int capacity;

  public HistoryStack() {
    this(DEFAULT_CAPACITY);
  }

  public HistoryStack(final int capacity) {
    Validate.isTrue(capacity > 0, "capacity must be positive");
    this.capacity = capacity;
    this.undoStack = new ArrayDeque<>(capacity);
    this.redoStack = new ArrayDeque<>(capacity);
  }

  @Override
  public void saveState(final T state) {
    Validate.notNull(state, "state must not be null");
    this.undoStack.addLast(state);
    this.redoStack.clear();
    enforceCapacity();
  }

  @Override
  public Optional<T> undo() {
    if (popUndo().isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(this.undoStack.peekLast());
  }

  @Override
  public Optional<T> redo() {
    final T state = this.redoStack.pollLast();
    if (state == null) {
      return Optional.empty();
    }
    this.undoStack.addLast(state);
    enforceCapacity();
    return Optional.of(state);
  }

  @Override
  public boolean canUndo() {
    return !this.undoStack.isEmpty();
  }

  @Override
  public boolean canRedo() {
    return !this.redoStack.isEmpty();
  }

  @Override
  public void clear() {
    this.undoStack.clear();
    this.redoStack.clear();
  }

  public int size() {
    return this.undoStack.size();
  }

  public boolean isEmpty() {
    return this.undoStack.isEmpty();
  }

  public int undoCount() {
    return this.undoStack.size();
  }

  public int redoCount() {
    return this.redoStack.size();
  }

  public int capacity() {
    return this.capacity;
  }

  /**
   * Pops the newest undo entry onto the redo stack.
   *
   * @return the popped entry, or empty if the undo stack was empty
   */
  Optional<T> popUndo() {
    final T current = this.undoStack.pollLast();
    if (current == null) {
      return Optional.empty();
    }
    this.redoStack.addLast(current);
    enforceCapacity();
    return Optional.of(current);
  }

  /**
   * Drops every entry matching the predicate from both stacks, keeping the order of the rest.
   *
   * @param expired predicate selecting entries to drop
   */
  void removeIf(final Predicate<T> expired) {
    this.undoStack.removeIf(expired);
    this.redoStack.removeIf(expired);
  }

  private void enforceCapacity() {
    while (this.undoStack.size() > this.capacity) {
      this.undoStack.pollFirst();
    }
    while (this.redoStack.size() > this.capacity) {
      this.redoStack.pollFirst();
    }
  }
}
