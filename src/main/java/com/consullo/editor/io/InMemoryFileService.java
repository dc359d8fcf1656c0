package com.consullo.editor.io;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Map-backed file service for tests and demos.
 *
 * @since 1.0
 */
public final class InMemoryFileService implements FileService {

  private final Map<String, String> files = new LinkedHashMap<>();

  public InMemoryFileService() {
  }

  /**
   * Creates a service pre-populated with files.
   *
   * @param initialFiles name to content mapping
   */
  public InMemoryFileService(final Map<String, String> initialFiles) {
    Validate.notNull(initialFiles, "initialFiles must not be null");
    this.files.putAll(initialFiles);
  }

  @Override
  public String open(final String name) throws IOException {
    Validate.notNull(name, "name must not be null");
    final String text = this.files.get(name);
    if (text == null) {
      throw new NoSuchFileException(name);
    }
    return text;
  }

  @Override
  public void save(final String name, final String text) throws IOException {
    Validate.notNull(name, "name must not be null");
    Validate.notNull(text, "text must not be null");
    this.files.put(name, text);
  }

  public Optional<String> read(final String name) {
    return Optional.ofNullable(this.files.get(name));
  }
}
