package com.flamingo.ai.slidedeck.domain.ir;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flamingo.ai.slidedeck.domain.enums.ElementType;

/**
 * A positioned element on a slide. Closed over {@link TextBox}, {@link ImageElement} and {@link
 * ChartElement}; the {@code type} tag written to JSON is the single discriminator.
 *
 * <p>Geometry is in inches from the top-left corner of the 13.333 x 7.5 inch canvas.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = TextBox.class, name = "text"),
  @JsonSubTypes.Type(value = ImageElement.class, name = "image"),
  @JsonSubTypes.Type(value = ChartElement.class, name = "chart")
})
public sealed interface SlideElement permits TextBox, ImageElement, ChartElement {

  ElementType elementType();

  double x();

  double y();

  double width();

  double height();
}
