package com.flamingo.ai.slidedeck.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.slidedeck.domain.ir.DesignTokens;
import com.flamingo.ai.slidedeck.domain.ir.Presentation;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds the user messages sent with {@link PresentationPrompts}. */
@Component
@RequiredArgsConstructor
public class PromptBuilder {

  static final int MAX_PALETTE_COLORS = 10;

  private final ObjectMapper objectMapper;

  /**
   * User message for a new presentation.
   *
   * @param prompt the user's description
   * @param numSlides exact slide count, or null to let the model decide
   * @param designTokens tokens of an uploaded file, or null
   */
  public String generationMessage(String prompt, Integer numSlides, DesignTokens designTokens) {
    StringBuilder message = new StringBuilder("Create a presentation about:\n\n").append(prompt);

    if (numSlides != null && numSlides > 0) {
      message.append("\n\nGenerate exactly ").append(numSlides).append(" slides.");
    }

    if (designTokens != null) {
      message
          .append("\n\n## Design Constraints (from uploaded template/reference)\n")
          .append("You MUST use these design tokens:\n")
          .append("- Primary color: ").append(designTokens.primaryColor()).append('\n')
          .append("- Secondary color: ").append(designTokens.secondaryColor()).append('\n')
          .append("- Background color: ").append(designTokens.backgroundColor()).append('\n')
          .append("- Heading font: ").append(designTokens.fontHeading()).append('\n')
          .append("- Body font: ").append(designTokens.fontBody()).append('\n');
      List<String> palette = designTokens.extractedColors();
      if (!palette.isEmpty()) {
        List<String> shown = palette.subList(0, Math.min(MAX_PALETTE_COLORS, palette.size()));
        message.append("- Available palette: ").append(String.join(", ", shown)).append('\n');
      }
    }
    return message.toString();
  }

  /** User message for refining {@code current}; embeds it as pretty-printed JSON. */
  public String refinementMessage(Presentation current, String instruction) {
    String json;
    try {
      json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(current);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize presentation for refinement", e);
    }
    return "## Current Presentation JSON\n\n```json\n"
        + json
        + "\n```\n\n## User Instruction\n\n"
        + instruction
        + "\n\nApply the changes and return the complete updated JSON.";
  }
}
