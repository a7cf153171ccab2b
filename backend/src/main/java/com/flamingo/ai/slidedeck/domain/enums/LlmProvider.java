package com.flamingo.ai.slidedeck.domain.enums;

import com.flamingo.ai.slidedeck.exception.LlmConfigurationException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Text-generation providers that can be selected through configuration. */
public enum LlmProvider {
  GEMINI("gemini"),
  OPENAI("openai"),
  CLAUDE("claude");

  private final String value;

  LlmProvider(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Resolves a configured provider name (case-insensitive).
   *
   * @throws LlmConfigurationException if the name matches no provider
   */
  public static LlmProvider fromConfig(String name) {
    String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(provider -> provider.value.equals(normalized))
        .findFirst()
        .orElseThrow(
            () ->
                new LlmConfigurationException(
                    "Unknown LLM provider: '"
                        + normalized
                        + "'. Supported: "
                        + Arrays.stream(values())
                            .map(LlmProvider::getValue)
                            .collect(Collectors.joining(", "))));
  }
}
