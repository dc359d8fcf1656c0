package com.consullo.editor.display;

import com.consullo.editor.core.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the headless display surface and input code helpers.
 *
 * @since 1.0
 */
public class HeadlessDisplaySurfaceTest {

  @Test
  @DisplayName("Should replay scripted input in order and then report end of input")
  void readInput_Scripted_ReplaysInOrder() {
    final HeadlessDisplaySurface display = new HeadlessDisplaySurface(80, 24);
    display.enqueueText("ab");
    display.enqueueInput(InputCode.ARROW_LEFT, InputCode.CARRIAGE_RETURN);

    assertThat(display.readInput()).isEqualTo('a');
    assertThat(display.readInput()).isEqualTo('b');
    assertThat(display.readInput()).isEqualTo(InputCode.ARROW_LEFT);
    assertThat(display.readInput()).isEqualTo(InputCode.CARRIAGE_RETURN);
    assertThat(display.readInput()).isEqualTo(InputCode.END_OF_INPUT);
  }

  @Test
  @DisplayName("Should keep the last rendered frame")
  void render_Frame_IsRetained() {
    final HeadlessDisplaySurface display = new HeadlessDisplaySurface(40, 10);
    display.init();

    display.renderText("text", new Position(1, 0));
    display.renderStatus("status");
    display.moveCursor(new Position(2, 0));
    display.refresh();

    assertThat(display.isOpen()).isTrue();
    assertThat(display.text()).isEqualTo("text");
    assertThat(display.status()).isEqualTo("status");
    assertThat(display.cursor()).isEqualTo(new Position(2, 0));
    assertThat(display.refreshCount()).isEqualTo(1);

    display.clear();
    display.close();
    assertThat(display.text()).isEmpty();
    assertThat(display.isOpen()).isFalse();
  }

  @Test
  @DisplayName("Should require room for a status line")
  void new_SingleRow_Throws() {
    assertThatThrownBy(() -> new HeadlessDisplaySurface(80, 1)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should classify input codes")
  void inputCode_Classification() {
    assertThat(InputCode.isPrintable('x')).isTrue();
    assertThat(InputCode.isPrintable(InputCode.ESCAPE)).isFalse();
    assertThat(InputCode.isPrintable(InputCode.ARROW_UP)).isFalse();
    assertThat(InputCode.isBackspace(InputCode.BACKSPACE)).isTrue();
    assertThat(InputCode.isBackspace(InputCode.BACKSPACE_CTRL_H)).isTrue();
    assertThat(InputCode.isEnter(InputCode.LINE_FEED)).isTrue();
    assertThat(InputCode.isEnter(InputCode.CARRIAGE_RETURN)).isTrue();
  }
}
