package com.consullo.editor.history;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Undo/redo history whose entries expire after a maximum age.
 *
 * <p>Expired entries are dropped lazily, before every query, save, undo and redo.
 *
 * @param <T> recorded state type
 * @since 1.0
 */
public final class TimestampedHistory<T> implements UndoRedoSystem<T> {

  private final HistoryStack<Entry<T>> history;
  private final Duration maxAge;
  private final Clock clock;

  private record Entry<T>(T value, Instant recordedAt) {
  }

  public TimestampedHistory(final Duration maxAge) {
    this(maxAge, HistoryStack.DEFAULT_CAPACITY, Clock.systemUTC());
  }

  public TimestampedHistory(final Duration maxAge, final int capacity, final Clock clock) {
    Validate.notNull(maxAge, "maxAge must not be null");
    Validate.isTrue(!maxAge.isNegative(), "maxAge must not be negative");
    Validate.notNull(clock, "clock must not be null");
    this.history = new HistoryStack<>(capacity);
    this.maxAge = maxAge;
    this.clock = clock;
  }

  @Override
  public void saveState(final T state) {
    Validate.notNull(state, "state must not be null");
    this.history.saveState(new Entry<>(state, this.clock.instant()));
    removeExpired();
  }

  @Override
  public Optional<T> undo() {
    removeExpired();
    return this.history.undo().map(Entry::value);
  }

  @Override
  public Optional<T> redo() {
    removeExpired();
    return this.history.redo().map(Entry::value);
  }

  @Override
  public boolean canUndo() {
    removeExpired();
    return this.history.canUndo();
  }

  @Override
  public boolean canRedo() {
    removeExpired();
    return this.history.canRedo();
  }

  @Override
  public void clear() {
    this.history.clear();
  }

  public int undoCount() {
    return this.history.undoCount();
  }

  private void removeExpired() {
    final Instant cutoff = this.clock.instant().minus(this.maxAge);
    this.history.removeIf(entry -> entry.recordedAt().isBefore(cutoff));
  }
}
