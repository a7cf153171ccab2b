package com.flamingo.ai.slidedeck.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Vertical anchor of the text inside a text box. */
public enum VerticalAlignment {
  TOP("top"),
  MIDDLE("middle"),
  BOTTOM("bottom");

  private final String value;

  VerticalAlignment(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
