package com.consullo.editor.selection;

import org.apache.commons.lang3.Validate;

/**
 * Single-slot clipboard. Every copy or cut replaces the whole content.
 *
 * @since 1.0
 */
public final class Clipboard {

  private String content = "";

  public void set(final String text) {
    Validate.notNull(text, "text must not be null");
    this.content = text;
  }

  public String get() {
    return this.content;
  }

  public boolean isEmpty() {
    return this.content.isEmpty();
  }
}
