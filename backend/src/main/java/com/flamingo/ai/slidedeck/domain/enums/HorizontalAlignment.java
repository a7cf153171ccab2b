package com.flamingo.ai.slidedeck.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Horizontal paragraph alignment of a text box. */
public enum HorizontalAlignment {
  LEFT("left"),
  CENTER("center"),
  RIGHT("right");

  private final String value;

  HorizontalAlignment(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
