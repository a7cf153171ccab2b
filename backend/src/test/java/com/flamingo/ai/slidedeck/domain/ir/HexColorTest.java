package com.flamingo.ai.slidedeck.domain.ir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.Color;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexColorTest {

  @Test
  @DisplayName("accepts six hex digits in any case, with or without #")
  void shouldAcceptSixDigitHex() {
    assertThat(HexColor.isValid("#1A73E8")).isTrue();
    assertThat(HexColor.isValid("1a73e8")).isTrue();
    assertThat(HexColor.isValid("#abc")).isFalse();
    assertThat(HexColor.isValid("#1a73e8ff")).isFalse();
    assertThat(HexColor.isValid("#gggggg")).isFalse();
    assertThat(HexColor.isValid(null)).isFalse();
  }

  @Test
  @DisplayName("normalizes to lowercase with a leading #")
  void shouldNormalizeToLowercaseWithHash() {
    assertThat(HexColor.normalize("1A73E8")).isEqualTo("#1a73e8");
    assertThat(HexColor.normalize("#FFFFFF")).isEqualTo("#ffffff");
  }

  @Test
  void shouldRejectInvalidColorOnNormalize() {
    assertThatThrownBy(() -> HexColor.normalize("blue"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("blue");
  }

  @Test
  @DisplayName("canonical form normalizes valid colors and leaves invalid ones for validation")
  void shouldCanonicalizeOnlyValidColors() {
    assertThat(HexColor.canonical("ABCDEF")).isEqualTo("#abcdef");
    assertThat(HexColor.canonical("red")).isEqualTo("red");
    assertThat(TextBox.withDefaults("x").fontColor("#12345").build().fontColor())
        .isEqualTo("#12345");
  }

  @Test
  void shouldConvertToAndFromAwtColor() {
    Color color = HexColor.toColor("#E8710A");

    assertThat(color.getRed()).isEqualTo(0xe8);
    assertThat(color.getGreen()).isEqualTo(0x71);
    assertThat(color.getBlue()).isEqualTo(0x0a);
    assertThat(HexColor.fromColor(color)).isEqualTo("#e8710a");
  }

  @Test
  void shouldFormatSignedRgbBytes() {
    assertThat(HexColor.fromRgbBytes(new byte[] {(byte) 0xff, 0x00, (byte) 0x80}))
        .isEqualTo("#ff0080");
  }
}
