package com.consullo.editor.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * File system tests for the local file service.
 *
 * @since 1.0
 */
public class LocalFileServiceTest {

  @TempDir
  Path dir;

  @Test
  @DisplayName("Should save and reopen text verbatim as UTF-8")
  void saveThenOpen_Utf8Text_RoundTrips() throws Exception {
    final LocalFileService service = new LocalFileService(new FileServiceConfig(dir, 1024, false));

    service.save("notes.txt", "café\r\nline two\n");

    assertThat(service.open("notes.txt")).isEqualTo("café\r\nline two\n");
    assertThat(Files.readAllBytes(dir.resolve("notes.txt")))
        .isEqualTo("café\r\nline two\n".getBytes(StandardCharsets.UTF_8));
    assertThat(service.exists("notes.txt")).isTrue();
  }

  @Test
  @DisplayName("Should back up the previous content before overwriting")
  void save_ExistingFileWithBackup_WritesBackup() throws Exception {
    final LocalFileService service = new LocalFileService(new FileServiceConfig(dir, 1024, true));
    Files.writeString(dir.resolve("a.txt"), "old");

    service.save("a.txt", "new");

    assertThat(Files.readString(dir.resolve("a.txt"))).isEqualTo("new");
    assertThat(Files.readString(dir.resolve("a.txt.backup"))).isEqualTo("old");
  }

  @Test
  @DisplayName("Should not create a backup for a new file or with backups disabled")
  void save_NoBackupCases() throws Exception {
    final LocalFileService withBackup = new LocalFileService(new FileServiceConfig(dir, 1024, true));
    withBackup.save("fresh.txt", "x");
    assertThat(dir.resolve("fresh.txt.backup")).doesNotExist();

    final LocalFileService withoutBackup = new LocalFileService(new FileServiceConfig(dir, 1024, false));
    withoutBackup.save("fresh.txt", "y");
    assertThat(dir.resolve("fresh.txt.backup")).doesNotExist();
  }

  @Test
  @DisplayName("Should create missing parent directories on save")
  void save_NestedName_CreatesParents() throws Exception {
    final LocalFileService service = new LocalFileService(new FileServiceConfig(dir, 1024, false));

    service.save("sub/dir/file.txt", "nested");

    assertThat(Files.readString(dir.resolve("sub/dir/file.txt"))).isEqualTo("nested");
  }

  @Test
  @DisplayName("Should reject files over the size limit in both directions")
  void sizeLimit_Enforced() throws Exception {
    final LocalFileService service = new LocalFileService(new FileServiceConfig(dir, 4, false));
    Files.writeString(dir.resolve("big.txt"), "12345");

    assertThatThrownBy(() -> service.open("big.txt"))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("exceeds maximum limit");
    assertThatThrownBy(() -> service.save("other.txt", "12345"))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("exceeds maximum limit");
    assertThat(dir.resolve("other.txt")).doesNotExist();
  }

  @Test
  @DisplayName("Should report a missing file")
  void open_Missing_ThrowsNoSuchFile() {
    final LocalFileService service = new LocalFileService(new FileServiceConfig(dir, 1024, false));

    assertThatThrownBy(() -> service.open("nope.txt")).isInstanceOf(NoSuchFileException.class);
  }

  @Test
  @DisplayName("Should reject empty names and names containing NUL")
  void resolve_BadNames_Throw() {
    final LocalFileService service = new LocalFileService(new FileServiceConfig(dir, 1024, false));

    assertThatThrownBy(() -> service.open("")).isInstanceOf(IOException.class).hasMessage("Filename cannot be empty");
    assertThatThrownBy(() -> service.save("a\0b", "x"))
        .isInstanceOf(IOException.class)
        .hasMessage("Filename cannot contain null bytes");
  }

  @Test
  @DisplayName("Should reject an invalid configuration")
  void new_InvalidConfig_Throws() {
    assertThatThrownBy(() -> new LocalFileService(new FileServiceConfig(dir, 0, false)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new LocalFileService(new FileServiceConfig(null, 10, false)))
        .isInstanceOf(NullPointerException.class);
  }
}
