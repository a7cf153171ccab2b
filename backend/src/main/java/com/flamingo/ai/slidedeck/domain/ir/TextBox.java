package com.flamingo.ai.slidedeck.domain.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.slidedeck.domain.enums.ElementType;
import com.flamingo.ai.slidedeck.domain.enums.HorizontalAlignment;
import com.flamingo.ai.slidedeck.domain.enums.VerticalAlignment;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

/**
 * A text box holding a single paragraph.
 *
 * @param content text of the box; line breaks stay inside the one paragraph
 * @param isTitle whether this box is the slide title
 * @param fontSize font size in points (6-96)
 * @param fontColor lowercase {@code #rrggbb}
 */
@Builder(toBuilder = true)
public record TextBox(
    @JsonProperty("content") String content,
    @JsonProperty("is_title") boolean isTitle,
    @JsonProperty("x") @PositiveOrZero(message = TextBox.MIN_POSITION_MESSAGE) double x,
    @JsonProperty("y") @PositiveOrZero(message = TextBox.MIN_POSITION_MESSAGE) double y,
    @JsonProperty("width") @Positive(message = TextBox.MIN_EXTENT_MESSAGE) double width,
    @JsonProperty("height") @Positive(message = TextBox.MIN_EXTENT_MESSAGE) double height,
    @JsonProperty("font_name") @NotBlank(message = "must not be blank") String fontName,
    @JsonProperty("font_size")
        @Min(value = TextBox.MIN_FONT_SIZE, message = TextBox.FONT_SIZE_MESSAGE)
        @Max(value = TextBox.MAX_FONT_SIZE, message = TextBox.FONT_SIZE_MESSAGE)
        int fontSize,
    @JsonProperty("font_bold") boolean fontBold,
    @JsonProperty("font_italic") boolean fontItalic,
    @JsonProperty("font_color")
        @Pattern(regexp = HexColor.CANONICAL_REGEX, message = HexColor.INVALID_MESSAGE)
        String fontColor,
    @JsonProperty("alignment") HorizontalAlignment alignment,
    @JsonProperty("vertical_alignment") VerticalAlignment verticalAlignment)
    implements SlideElement {

  public static final double DEFAULT_X = 0.5;
  public static final double DEFAULT_Y = 0.5;
  public static final double DEFAULT_WIDTH = 9.0;
  public static final double DEFAULT_HEIGHT = 1.0;
  public static final String DEFAULT_FONT_NAME = "Calibri";
  public static final int DEFAULT_FONT_SIZE = 18;
  public static final String DEFAULT_FONT_COLOR = "#333333";
  public static final int MIN_FONT_SIZE = 6;
  public static final int MAX_FONT_SIZE = 96;

  static final String FONT_SIZE_MESSAGE = "must be between 6 and 96";
  static final String MIN_POSITION_MESSAGE = "must be greater than or equal to 0";
  static final String MIN_EXTENT_MESSAGE = "must be greater than 0";

  public TextBox {
    fontName = fontName == null ? DEFAULT_FONT_NAME : fontName;
    fontColor = fontColor == null ? DEFAULT_FONT_COLOR : HexColor.canonical(fontColor);
    alignment = alignment == null ? HorizontalAlignment.LEFT : alignment;
    verticalAlignment = verticalAlignment == null ? VerticalAlignment.TOP : verticalAlignment;
  }

  /** A builder pre-filled with the IR defaults. */
  public static TextBoxBuilder withDefaults(String content) {
    return builder()
        .content(content)
        .x(DEFAULT_X)
        .y(DEFAULT_Y)
        .width(DEFAULT_WIDTH)
        .height(DEFAULT_HEIGHT)
        .fontName(DEFAULT_FONT_NAME)
        .fontSize(DEFAULT_FONT_SIZE)
        .fontColor(DEFAULT_FONT_COLOR)
        .alignment(HorizontalAlignment.LEFT)
        .verticalAlignment(VerticalAlignment.TOP);
  }

  @Override
  public ElementType elementType() {
    return ElementType.TEXT;
  }
}
