package com.flamingo.ai.slidedeck.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Discriminator of the slide element variants. */
public enum ElementType {
  /** {@link com.flamingo.ai.slidedeck.domain.ir.TextBox}. */
  TEXT("text"),

  /** {@link com.flamingo.ai.slidedeck.domain.ir.ImageElement}. */
  IMAGE("image"),

  /** {@link com.flamingo.ai.slidedeck.domain.ir.ChartElement}. */
  CHART("chart");

  private final String value;

  ElementType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
