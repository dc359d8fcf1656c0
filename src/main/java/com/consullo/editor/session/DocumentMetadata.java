package com.consullo.editor.session;

import org.apache.commons.lang3.Validate;

/**
 * Per-document bookkeeping kept by a {@link Session} alongside each document.
 *
 * <p>{@code dirty} is set by every successful mutation and cleared by a successful save.
 *
 * @since 1.0
 */
public final class DocumentMetadata {

  private String name;
  private boolean dirty;

  public DocumentMetadata(final String name) {
    Validate.notNull(name, "name must not be null");
    this.name = name;
    this.dirty = false;
  }

  public String getName() {
    return name;
  }

  void setName(final String name) {
    Validate.notNull(name, "name must not be null");
    this.name = name;
  }

  public boolean isDirty() {
    return dirty;
  }

  void markDirty() {
    this.dirty = true;
  }

  void markClean() {
    this.dirty = false;
  }

  @Override
  public String toString() {
    return "DocumentMetadata[name=" + name + ", dirty=" + dirty + "]";
  }
}
