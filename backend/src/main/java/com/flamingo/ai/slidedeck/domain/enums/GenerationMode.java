package com.flamingo.ai.slidedeck.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Defines how an uploaded file takes part in generation. */
public enum GenerationMode {
  /** Blank base document, no design constraints. */
  FROM_SCRATCH("from_scratch"),

  /** Uploaded file is the base document and its design tokens constrain generation. */
  TEMPLATE("template"),

  /** Uploaded file only contributes design tokens; the base document is blank. */
  REFERENCE("reference");

  private final String value;

  GenerationMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Resolves a wire value; null means {@link #FROM_SCRATCH}.
   *
   * @throws IllegalArgumentException if the value names no mode
   */
  public static GenerationMode fromValue(String value) {
    if (value == null) {
      return FROM_SCRATCH;
    }
    for (GenerationMode mode : values()) {
      if (mode.value.equals(value)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown generation mode: " + value);
  }

  public boolean usesUploadedFile() {
    return this != FROM_SCRATCH;
  }
}
