package com.flamingo.ai.slidedeck.exception;

/**
 * Exception thrown when the text-generation provider is misconfigured (unknown provider name,
 * missing API key). Retrying cannot help.
 */
public class LlmConfigurationException extends RuntimeException {

  public LlmConfigurationException(String message) {
    super(message);
  }

  public String getUserMessage() {
    return "AI provider is not configured: " + getMessage();
  }
}
