package com.flamingo.ai.slidedeck.exception;

import java.nio.file.Path;

/** Exception thrown when a file cannot be opened as a presentation for style extraction. */
public class StyleExtractionException extends RuntimeException {

  private final Path sourcePath;

  public StyleExtractionException(Path sourcePath, String message, Throwable cause) {
    super(message, cause);
    this.sourcePath = sourcePath;
  }

  public Path getSourcePath() {
    return sourcePath;
  }

  public String getUserMessage() {
    return "The uploaded file could not be read as a .pptx presentation";
  }
}
