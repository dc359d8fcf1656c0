package com.consullo.editor.history;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undo/redo log of structured {@link EditAction}s.
 *
 * <p>Actions recorded between {@link #startGroup()} and {@link #endGroup()} are meant to form one
 * logical undo unit. Only the last action recorded during the group is kept as that unit's undo
 * entry; the earlier members are dropped and cannot be replayed.
 *
 * @since 1.0
 */
public final class ActionHistory {

  private static final Logger LOGGER = LoggerFactory.getLogger(ActionHistory.class);

  private final HistoryStack<EditAction> actions;
  private final List<EditAction> currentGroup = new ArrayList<>();
  private boolean grouping;

  /**
   * Undo and redo depth of an action log.
   *
   * @param undoCount entries available to undo
   * @param redoCount entries available to redo
   */
  public record Stats(int undoCount, int redoCount) {
  }

  public ActionHistory() {
    this(HistoryStack.DEFAULT_CAPACITY);
  }

  public ActionHistory(final int capacity) {
    this.actions = new HistoryStack<>(capacity);
  }

  public void startGroup() {
    this.grouping = true;
    this.currentGroup.clear();
  }

  public void endGroup() {
    if (this.grouping && !this.currentGroup.isEmpty()) {
      // TODO: keep the whole group once compound undo replay is agreed on
      final EditAction last = this.currentGroup.get(this.currentGroup.size() - 1);
      if (this.currentGroup.size() > 1) {
        LOGGER.debug("Collapsing group of {} actions to its last action {}", this.currentGroup.size(), last);
      }
      this.actions.saveState(last);
    }
    this.grouping = false;
    this.currentGroup.clear();
  }

  public boolean isGrouping() {
    return this.grouping;
  }

  /**
   * Records an action, buffering it while a group is open.
   *
   * @param action action to record
   */
  public void recordAction(final EditAction action) {
    Validate.notNull(action, "action must not be null");
    if (this.grouping) {
      this.currentGroup.add(action);
    } else {
      this.actions.saveState(action);
    }
  }

  /**
   * Undoes the most recent action.
   *
   * @return the edit to apply to revert it, or empty if there is nothing to undo
   */
  public Optional<EditAction> undoAction() {
    return this.actions.popUndo().map(EditAction::inverse);
  }

  /**
   * Redoes the most recently undone action.
   *
   * @return the edit to re-apply, or empty if there is nothing to redo
   */
  public Optional<EditAction> redoAction() {
    return this.actions.redo();
  }

  public boolean canUndo() {
    return this.actions.canUndo();
  }

  public boolean canRedo() {
    return this.actions.canRedo();
  }

  public void clear() {
    this.actions.clear();
    this.currentGroup.clear();
    this.grouping = false;
  }

  public Stats stats() {
    return new Stats(this.actions.undoCount(), this.actions.redoCount());
  }
}
