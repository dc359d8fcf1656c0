package com.consullo.editor.driver;

import com.consullo.editor.history.HistoryStack;
import com.consullo.editor.io.FileService;
import com.consullo.editor.io.FileServiceConfig;
import com.consullo.editor.io.LocalFileService;
import com.consullo.editor.session.Session;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Factory for editing sessions with sensible defaults.
 *
 * <p>
 * Centralizes:
 * <ul>
 * <li>history depth and tab width</li>
 * <li>file size limit and backup policy for local files</li>
 * <li>working directory defaults</li>
 * </ul>
 * </p>
 */
public final class EditorSessionFactory {

  public static final int DEFAULT_TAB_SIZE = 4;
  public static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024;

  private EditorSessionFactory() {
  }

  /**
   * Returns the default editing configuration.
   *
   * @param readOnly if true, reject all edits
   * @return configuration
   */
  public static EditorConfig defaultConfig(final boolean readOnly) {
    return new EditorConfig(HistoryStack.DEFAULT_CAPACITY, DEFAULT_TAB_SIZE, readOnly);
  }

  /**
   * Creates an editing session over local files.
   *
   * @param workingDirectory directory relative names resolve against (if null, uses current directory)
   * @param files files to open, in order; empty for one untitled document
   * @param readOnly if true, reject all edits
   * @return editing session focused on the last opened file
   * @throws IOException if a file cannot be opened
   */
  public static EditorSession createLocalSession(
          final Path workingDirectory,
          final List<String> files,
          final boolean readOnly
  ) throws IOException {
    if (files == null) {
      throw new IllegalArgumentException("files must not be null.");
    }

    final Path workDir = workingDirectory != null ? workingDirectory : Path.of(".").toAbsolutePath().normalize();
    final FileService fileService = new LocalFileService(new FileServiceConfig(workDir, DEFAULT_MAX_FILE_SIZE, true));
    return createSession(fileService, files, defaultConfig(readOnly));
  }

  /**
   * Creates an editing session over an arbitrary file service.
   *
   * @param fileService storage backend
   * @param files files to open, in order; empty for one untitled document
   * @param config editing configuration
   * @return editing session
   * @throws IOException if a file cannot be opened
   */
  public static EditorSession createSession(
          final FileService fileService,
          final List<String> files,
          final EditorConfig config
  ) throws IOException {
    if (fileService == null || files == null || config == null) {
      throw new IllegalArgumentException("fileService/files/config must not be null.");
    }
    return new EditorSession(Session.fromFiles(fileService, files), config);
  }
}
