package com.flamingo.ai.slidedeck.exception;

/** Exception thrown when a presentation id or one of its artifacts is unknown. */
public class PresentationNotFoundException extends RuntimeException {

  private final String presentationId;

  public PresentationNotFoundException(String presentationId) {
    super("Presentation not found: " + presentationId);
    this.presentationId = presentationId;
  }

  public PresentationNotFoundException(String presentationId, String message) {
    super(message);
    this.presentationId = presentationId;
  }

  public String getPresentationId() {
    return presentationId;
  }
}
