package com.flamingo.ai.slidedeck.exception;

import java.nio.file.Path;

/** Exception thrown when a presentation file cannot be built or persisted. */
public class PresentationBuildException extends RuntimeException {

  private final Path outputPath;
  private final String userMessage;

  public PresentationBuildException(Path outputPath, String message, Throwable cause) {
    super(message, cause);
    this.outputPath = outputPath;
    this.userMessage = "Failed to build the presentation file";
  }

  public PresentationBuildException(
      Path outputPath, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.outputPath = outputPath;
    this.userMessage = userMessage;
  }

  public Path getOutputPath() {
    return outputPath;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
