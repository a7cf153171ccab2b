package com.flamingo.ai.slidedeck.service.compiler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.slidedeck.domain.enums.LayoutType;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class LayoutResolverTest {

  private static final List<String> OFFICE_LAYOUTS =
      List.of(
          "Title Slide",
          "Title and Content",
          "Section Header",
          "Two Content",
          "Comparison",
          "Title Only",
          "Blank",
          "Content with Caption",
          "Picture with Caption");

  private final LayoutResolver resolver = new LayoutResolver();

  @Test
  @DisplayName("maps each layout type onto its preferred stock layout")
  void shouldResolvePreferredNames() {
    assertThat(resolver.resolve(LayoutType.TITLE, OFFICE_LAYOUTS)).isEqualTo(0);
    assertThat(resolver.resolve(LayoutType.TITLE_CONTENT, OFFICE_LAYOUTS)).isEqualTo(1);
    assertThat(resolver.resolve(LayoutType.SECTION_HEADER, OFFICE_LAYOUTS)).isEqualTo(2);
    assertThat(resolver.resolve(LayoutType.TWO_COLUMN, OFFICE_LAYOUTS)).isEqualTo(3);
    assertThat(resolver.resolve(LayoutType.BLANK, OFFICE_LAYOUTS)).isEqualTo(6);
    assertThat(resolver.resolve(LayoutType.IMAGE_FULL, OFFICE_LAYOUTS)).isEqualTo(6);
  }

  @Test
  @DisplayName("earlier names in the priority list win over document order")
  void shouldHonorNamePriority() {
    List<String> layouts = List.of("Title", "Other", "Title Slide");

    assertThat(resolver.resolve(LayoutType.TITLE, layouts)).isEqualTo(2);
  }

  @Test
  void shouldUseSecondaryNameWhenPrimaryMissing() {
    List<String> layouts = List.of("Cover", "Comparison");

    assertThat(resolver.resolve(LayoutType.TWO_COLUMN, layouts)).isEqualTo(1);
  }

  @Test
  @DisplayName("first of duplicate names wins")
  void shouldPickFirstDuplicate() {
    List<String> layouts = List.of("Blank", "Blank");

    assertThat(resolver.resolve(LayoutType.BLANK, layouts)).isEqualTo(0);
  }

  @Test
  @DisplayName("falls back to index 6 when nothing matches")
  void shouldFallBackToIndexSix() {
    List<String> layouts = Arrays.asList("a", "b", "c", "d", "e", "f", "g", "h");

    assertThat(resolver.resolve(LayoutType.SECTION_HEADER, layouts)).isEqualTo(6);
  }

  @Test
  @DisplayName("falls back to the last layout when index 6 does not exist")
  void shouldFallBackToLastLayout() {
    List<String> layouts = List.of("a", "b", "c");

    assertThat(resolver.resolve(LayoutType.TITLE, layouts)).isEqualTo(2);
  }

  @ParameterizedTest
  @EnumSource(LayoutType.class)
  @DisplayName("a single unnamed layout satisfies every layout type")
  void shouldResolveAgainstSingleUnnamedLayout(LayoutType layoutType) {
    assertThat(resolver.resolve(layoutType, Arrays.asList((String) null))).isZero();
  }

  @Test
  void shouldRejectEmptyLayoutList() {
    assertThatThrownBy(() -> resolver.resolve(LayoutType.BLANK, List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
