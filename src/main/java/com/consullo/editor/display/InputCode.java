package com.consullo.editor.display;

/**
 * Reserved input codes produced by a {@link DisplaySurface}. Printable characters are reported as
 * their own ordinal.
 *
 * @since 1.0
 */
public final class InputCode {

  public static final int BACKSPACE_CTRL_H = 8;
  public static final int TAB = 9;
  public static final int LINE_FEED = 10;
  public static final int CARRIAGE_RETURN = 13;
  public static final int ESCAPE = 27;
  public static final int BACKSPACE = 127;

  public static final int ARROW_UP = 1001;
  public static final int ARROW_DOWN = 1002;
  public static final int ARROW_LEFT = 1003;
  public static final int ARROW_RIGHT = 1004;
  public static final int DELETE = 1005;
  public static final int HOME = 1006;
  public static final int END = 1007;

  // Reported once a scripted or closed input source has nothing left.
  public static final int END_OF_INPUT = -1;

  private InputCode() {
  }

  public static boolean isPrintable(final int code) {
    return code >= 32 && code <= 126;
  }

  public static boolean isBackspace(final int code) {
    return code == BACKSPACE || code == BACKSPACE_CTRL_H;
  }

  public static boolean isEnter(final int code) {
    return code == LINE_FEED || code == CARRIAGE_RETURN;
  }
}
