package com.flamingo.ai.slidedeck.domain.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;

/**
 * Style fragment recovered from an existing presentation and used to constrain generation.
 *
 * @param layoutNames layout names of the document in native order, duplicates kept
 * @param extractedColors every explicit color found, sorted and unique
 * @param extractedFonts every explicit font family found, sorted and unique
 */
@Builder(toBuilder = true)
public record DesignTokens(
    @JsonProperty("primary_color") String primaryColor,
    @JsonProperty("secondary_color") String secondaryColor,
    @JsonProperty("background_color") String backgroundColor,
    @JsonProperty("font_heading") String fontHeading,
    @JsonProperty("font_body") String fontBody,
    @JsonProperty("layout_names") List<String> layoutNames,
    @JsonProperty("extracted_colors") List<String> extractedColors,
    @JsonProperty("extracted_fonts") List<String> extractedFonts) {

  public DesignTokens {
    primaryColor = ThemeSettings.normalizeOr(primaryColor, ThemeSettings.DEFAULT_PRIMARY_COLOR);
    secondaryColor =
        ThemeSettings.normalizeOr(secondaryColor, ThemeSettings.DEFAULT_SECONDARY_COLOR);
    backgroundColor =
        ThemeSettings.normalizeOr(backgroundColor, ThemeSettings.DEFAULT_BACKGROUND_COLOR);
    fontHeading = fontHeading == null ? ThemeSettings.DEFAULT_FONT : fontHeading;
    fontBody = fontBody == null ? ThemeSettings.DEFAULT_FONT : fontBody;
    layoutNames = layoutNames == null ? List.of() : List.copyOf(layoutNames);
    extractedColors = extractedColors == null ? List.of() : List.copyOf(extractedColors);
    extractedFonts = extractedFonts == null ? List.of() : List.copyOf(extractedFonts);
  }
}
