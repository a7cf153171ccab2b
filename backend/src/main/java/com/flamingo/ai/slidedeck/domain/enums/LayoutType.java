package com.flamingo.ai.slidedeck.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/** Semantic slide layout requested by the IR, mapped onto a named layout of the base document. */
public enum LayoutType {
  TITLE("title", List.of("Title Slide", "Title")),
  TITLE_CONTENT("title_content", List.of("Title and Content", "Title, Content")),
  TWO_COLUMN("two_column", List.of("Two Content", "Comparison")),
  BLANK("blank", List.of("Blank")),
  SECTION_HEADER("section_header", List.of("Section Header")),
  IMAGE_FULL("image_full", List.of("Blank", "Picture with Caption"));

  private final String value;
  private final List<String> preferredLayoutNames;

  LayoutType(String value, List<String> preferredLayoutNames) {
    this.value = value;
    this.preferredLayoutNames = preferredLayoutNames;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Layout names accepted for this type, in priority order. */
  public List<String> getPreferredLayoutNames() {
    return preferredLayoutNames;
  }
}
