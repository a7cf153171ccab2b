package com.flamingo.ai.slidedeck.domain.enums;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class GenerationModeTest {

  @Test
  void shouldDefaultToFromScratch() {
    assertThat(GenerationMode.fromValue(null)).isEqualTo(GenerationMode.FROM_SCRATCH);
  }

  @Test
  void shouldResolveWireValues() {
    assertThat(GenerationMode.fromValue("template")).isEqualTo(GenerationMode.TEMPLATE);
    assertThat(GenerationMode.fromValue("reference")).isEqualTo(GenerationMode.REFERENCE);
  }

  @Test
  void shouldRejectUnknownValue() {
    assertThatThrownBy(() -> GenerationMode.fromValue("remix"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void onlyFromScratchIgnoresUploads() {
    assertThat(GenerationMode.FROM_SCRATCH.usesUploadedFile()).isFalse();
    assertThat(GenerationMode.TEMPLATE.usesUploadedFile()).isTrue();
    assertThat(GenerationMode.REFERENCE.usesUploadedFile()).isTrue();
  }
}
