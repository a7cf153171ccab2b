package com.flamingo.ai.slidedeck.service.ir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.slidedeck.domain.ir.Presentation;
import com.flamingo.ai.slidedeck.exception.FieldViolation;
import com.flamingo.ai.slidedeck.exception.PresentationValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw provider text into a validated {@link Presentation}. The text may be wrapped in a
 * markdown code fence ({@code ```json ... ```}), which is stripped before parsing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PresentationResponseParser {

  private static final String FENCE = "```";
  private static final int LOGGED_PREFIX_CHARS = 500;

  private final ObjectMapper objectMapper;
  private final PresentationReader presentationReader;

  /**
   * Parses and validates a provider response.
   *
   * @param rawText provider output, optionally fenced
   * @return the validated presentation
   * @throws PresentationValidationException if the text is not JSON or violates the schema
   */
  public Presentation parse(String rawText) {
    String json = stripFence(rawText == null ? "" : rawText);
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      log.error(
          "Failed to parse provider JSON: {} | raw: {}",
          e.getOriginalMessage(),
          json.substring(0, Math.min(json.length(), LOGGED_PREFIX_CHARS)));
      throw new PresentationValidationException(
          new FieldViolation("$", "invalid JSON: " + e.getOriginalMessage()), e);
    }
    if (root == null || root.isMissingNode()) {
      throw new PresentationValidationException(
          new FieldViolation("$", "invalid JSON: empty response"), null);
    }

    Presentation presentation = presentationReader.read(root);
    log.info(
        "Parsed presentation '{}' with {} slides",
        presentation.title(),
        presentation.slides().size());
    return presentation;
  }

  static String stripFence(String rawText) {
    String text = rawText.strip();
    if (text.startsWith(FENCE)) {
      int newline = text.indexOf('\n');
      text = newline >= 0 ? text.substring(newline + 1) : text.substring(FENCE.length());
    }
    if (text.endsWith(FENCE)) {
      text = text.substring(0, text.length() - FENCE.length());
    }
    return text.strip();
  }
}
