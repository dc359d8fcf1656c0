package com.consullo.editor.core.events;

import java.time.Instant;

/**
 * Describes a successful mutation of a session document, published so that a display layer can
 * refresh its text and status line.
 *
 * @param timestampUtc event timestamp in UTC
 * @param documentIndex index of the mutated document within its session
 * @param documentName name of the mutated document
 * @param kind kind of mutation
 * @param offset offset the mutation was applied at, or -1 when it covers the whole document
 * @since 1.0
 */
public record DocumentChangeEvent(
    Instant timestampUtc,
    int documentIndex,
    String documentName,
    Kind kind,
    int offset) {

  public enum Kind {
    INSERT,
    DELETE,
    APPEND,
    CLEAR,
    RESTORE
  }

  /**
   * Creates an event for an edit at a single offset.
   *
   * @param documentIndex document index
   * @param documentName document name
   * @param kind mutation kind
   * @param offset edit offset
   * @return change event
   */
  public static DocumentChangeEvent at(int documentIndex, String documentName, Kind kind, int offset) {
    return new DocumentChangeEvent(Instant.now(), documentIndex, documentName, kind, offset);
  }

  /**
   * Creates an event for a mutation affecting the whole document.
   *
   * @param documentIndex document index
   * @param documentName document name
   * @param kind mutation kind
   * @return change event
   */
  public static DocumentChangeEvent whole(int documentIndex, String documentName, Kind kind) {
    return new DocumentChangeEvent(Instant.now(), documentIndex, documentName, kind, -1);
  }
}
