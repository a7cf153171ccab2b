package com.flamingo.ai.slidedeck.exception;

/**
 * A single violated constraint in an IR document.
 *
 * @param path JSON path of the offending field, e.g. {@code slides[1].elements[0].font_size}
 * @param message what is wrong with it
 */
public record FieldViolation(String path, String message) {

  @Override
  public String toString() {
    return path + ": " + message;
  }
}
