package com.consullo.editor.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File service backed by the local file system.
 *
 * <p>Policy enforced on every call:
 * <ul>
 * <li>names must be non-empty and free of NUL characters</li>
 * <li>relative names resolve against the configured base directory</li>
 * <li>files larger than {@code maxFileSize} bytes are neither read nor written</li>
 * <li>with auto-backup on, an existing file is copied to {@code <name>.backup} before it is
 * overwritten</li>
 * </ul>
 * Text is read and written as UTF-8, verbatim.
 *
 * @since 1.0
 */
public final class LocalFileService implements FileService {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileService.class);

  private static final String BACKUP_SUFFIX = ".backup";

  private final Path baseDirectory;
  private final long maxFileSize;
  private final boolean autoBackup;

  /**
   * Creates a file service.
   *
   * @param config base directory, size limit and backup policy
   */
  public LocalFileService(final FileServiceConfig config) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(config.baseDirectory(), "baseDirectory must not be null");
    Validate.isTrue(config.maxFileSize() > 0, "maxFileSize must be positive");

    this.baseDirectory = config.baseDirectory().toAbsolutePath().normalize();
    this.maxFileSize = config.maxFileSize();
    this.autoBackup = config.autoBackup();
  }

  @Override
  public String open(final String name) throws IOException {
    final Path path = resolve(name);

    if (!Files.exists(path)) {
      throw new NoSuchFileException(path.toString(), null, "File not found: " + name);
    }
    if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
      throw new AccessDeniedException(path.toString(), null, "Cannot read file: " + name);
    }

    final long size = Files.size(path);
    if (size > this.maxFileSize) {
      throw new IOException("File size " + size + " exceeds maximum limit of " + this.maxFileSize + " bytes: " + name);
    }

    return Files.readString(path, StandardCharsets.UTF_8);
  }

  @Override
  public void save(final String name, final String text) throws IOException {
    Validate.notNull(text, "text must not be null");
    final Path path = resolve(name);

    final byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    if (bytes.length > this.maxFileSize) {
      throw new IOException("File size exceeds maximum limit of " + this.maxFileSize + " bytes: " + name);
    }

    if (Files.exists(path)) {
      if (!Files.isWritable(path)) {
        throw new AccessDeniedException(path.toString(), null, "Cannot write to file: " + name);
      }
      if (this.autoBackup) {
        final Path backup = backupFile(path);
        LOGGER.info("Backup created: {}", backup);
      }
    }

    final Path parent = path.getParent();
    if (parent != null && !Files.exists(parent)) {
      Files.createDirectories(parent);
    }

    try {
      Files.write(path, bytes);
    } catch (final IOException e) {
      LOGGER.warn("Saving {} failed: {}", path, e.getMessage(), e);
      throw e;
    }
  }

  /**
   * Returns true if a file exists under the given name.
   *
   * @param name document name
   * @return true if the file exists
   * @throws IOException if the name is rejected
   */
  public boolean exists(final String name) throws IOException {
    return Files.exists(resolve(name));
  }

  /**
   * Resolves a document name against the base directory.
   *
   * @param name document name
   * @return absolute, normalized path
   * @throws IOException if the name is empty or contains NUL characters
   */
  public Path resolve(final String name) throws IOException {
    Validate.notNull(name, "name must not be null");
    if (name.isEmpty()) {
      throw new IOException("Filename cannot be empty");
    }
    if (name.indexOf('\0') >= 0) {
      throw new IOException("Filename cannot contain null bytes");
    }
    return this.baseDirectory.resolve(name).normalize();
  }

  /**
   * Copies an existing file to its backup sibling.
   *
   * @param path file to back up
   * @return backup path
   * @throws IOException if the copy fails
   */
  Path backupFile(final Path path) throws IOException {
    final Path backup = path.resolveSibling(path.getFileName() + BACKUP_SUFFIX);
    Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
    return backup;
  }
}
