package com.consullo.editor.io;

import java.io.IOException;

/**
 * Persistent storage used by a session to open and save documents.
 *
 * <p>Both calls are synchronous and atomic from the engine's point of view. Implementations
 * enforce their own size and permission policy and report violations as {@link IOException}s,
 * which the engine propagates unmodified.
 *
 * @since 1.0
 */
public interface FileService {

  /**
   * Reads the full text stored under a name.
   *
   * @param name document name
   * @return stored text
   * @throws IOException if the file is missing, unreadable or rejected by policy
   */
  String open(String name) throws IOException;

  /**
   * Stores text under a name, verbatim.
   *
   * @param name document name
   * @param text text to store
   * @throws IOException if the write fails or is rejected by policy
   */
  void save(String name, String text) throws IOException;
}
