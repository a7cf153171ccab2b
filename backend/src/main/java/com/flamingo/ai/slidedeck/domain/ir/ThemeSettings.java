package com.flamingo.ai.slidedeck.domain.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;

/** Global theme of a presentation. */
@Builder(toBuilder = true)
public record ThemeSettings(
    @JsonProperty("primary_color")
        @Pattern(regexp = HexColor.CANONICAL_REGEX, message = HexColor.INVALID_MESSAGE)
        String primaryColor,
    @JsonProperty("secondary_color")
        @Pattern(regexp = HexColor.CANONICAL_REGEX, message = HexColor.INVALID_MESSAGE)
        String secondaryColor,
    @JsonProperty("background_color")
        @Pattern(regexp = HexColor.CANONICAL_REGEX, message = HexColor.INVALID_MESSAGE)
        String backgroundColor,
    @JsonProperty("font_heading") @NotBlank(message = "must not be blank") String fontHeading,
    @JsonProperty("font_body") @NotBlank(message = "must not be blank") String fontBody) {

  public static final String DEFAULT_PRIMARY_COLOR = "#1a73e8";
  public static final String DEFAULT_SECONDARY_COLOR = "#e8710a";
  public static final String DEFAULT_BACKGROUND_COLOR = "#ffffff";
  public static final String DEFAULT_FONT = "Calibri";

  public ThemeSettings {
    primaryColor = normalizeOr(primaryColor, DEFAULT_PRIMARY_COLOR);
    secondaryColor = normalizeOr(secondaryColor, DEFAULT_SECONDARY_COLOR);
    backgroundColor = normalizeOr(backgroundColor, DEFAULT_BACKGROUND_COLOR);
    fontHeading = fontHeading == null ? DEFAULT_FONT : fontHeading;
    fontBody = fontBody == null ? DEFAULT_FONT : fontBody;
  }

  public static ThemeSettings defaults() {
    return builder().build();
  }

  static String normalizeOr(String color, String fallback) {
    return color == null ? fallback : HexColor.canonical(color);
  }
}
