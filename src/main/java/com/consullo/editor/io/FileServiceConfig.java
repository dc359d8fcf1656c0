package com.consullo.editor.io;

import java.nio.file.Path;

/**
 * Configuration for the local file service.
 *
 * @param baseDirectory directory relative names are resolved against
 * @param maxFileSize maximum file size in bytes accepted on open and save
 * @param autoBackup if true, copy an existing file to a {@code .backup} sibling before overwriting
 * @since 1.0
 */
public record FileServiceConfig(
    Path baseDirectory,
    long maxFileSize,
    boolean autoBackup) {
}
