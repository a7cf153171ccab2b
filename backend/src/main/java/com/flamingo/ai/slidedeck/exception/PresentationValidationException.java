package com.flamingo.ai.slidedeck.exception;

import java.util.List;
import java.util.stream.Collectors;

/** Exception thrown when an IR document or provider response fails schema validation. */
public class PresentationValidationException extends RuntimeException {

  private final List<FieldViolation> violations;

  public PresentationValidationException(List<FieldViolation> violations) {
    super(describe(violations));
    this.violations = List.copyOf(violations);
  }

  public PresentationValidationException(FieldViolation violation, Throwable cause) {
    super(describe(List.of(violation)), cause);
    this.violations = List.of(violation);
  }

  public List<FieldViolation> getViolations() {
    return violations;
  }

  public String getUserMessage() {
    return "Validation failed: " + describe(violations);
  }

  private static String describe(List<FieldViolation> violations) {
    return violations.stream().map(FieldViolation::toString).collect(Collectors.joining("; "));
  }
}
