package com.flamingo.ai.slidedeck.domain.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.slidedeck.domain.enums.ElementType;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

/**
 * An image loaded from {@code url} or, failing that, {@code path}. Having neither is valid and
 * renders as a placeholder.
 */
@Builder(toBuilder = true)
public record ImageElement(
    @JsonProperty("url") @JsonInclude(JsonInclude.Include.NON_NULL) String url,
    @JsonProperty("path") @JsonInclude(JsonInclude.Include.NON_NULL) String path,
    @JsonProperty("alt_text") String altText,
    @JsonProperty("x") @PositiveOrZero(message = TextBox.MIN_POSITION_MESSAGE) double x,
    @JsonProperty("y") @PositiveOrZero(message = TextBox.MIN_POSITION_MESSAGE) double y,
    @JsonProperty("width") @Positive(message = TextBox.MIN_EXTENT_MESSAGE) double width,
    @JsonProperty("height") @Positive(message = TextBox.MIN_EXTENT_MESSAGE) double height)
    implements SlideElement {

  public static final double DEFAULT_X = 1.0;
  public static final double DEFAULT_Y = 1.5;
  public static final double DEFAULT_WIDTH = 8.0;
  public static final double DEFAULT_HEIGHT = 5.0;

  public ImageElement {
    altText = altText == null ? "" : altText;
  }

  public boolean hasUrl() {
    return url != null && !url.isBlank();
  }

  public boolean hasPath() {
    return path != null && !path.isBlank();
  }

  @Override
  public ElementType elementType() {
    return ElementType.IMAGE;
  }
}
