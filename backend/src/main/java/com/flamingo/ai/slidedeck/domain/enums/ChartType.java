package com.flamingo.ai.slidedeck.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Chart kind requested by the IR. Advisory only: every chart is rendered as a table. */
public enum ChartType {
  BAR("bar"),
  LINE("line"),
  PIE("pie"),
  DOUGHNUT("doughnut");

  private final String value;

  ChartType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
