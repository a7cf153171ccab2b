package com.flamingo.ai.slidedeck.domain.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.slidedeck.domain.enums.ChartType;
import com.flamingo.ai.slidedeck.domain.enums.ElementType;
import java.util.List;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

/** Chart data, emitted as a table. */
@Builder(toBuilder = true)
public record ChartElement(
    @JsonProperty("chart_type") ChartType chartType,
    @JsonProperty("title") String title,
    @JsonProperty("categories") List<String> categories,
    @JsonProperty("series") List<ChartSeries> series,
    @JsonProperty("x") @PositiveOrZero(message = TextBox.MIN_POSITION_MESSAGE) double x,
    @JsonProperty("y") @PositiveOrZero(message = TextBox.MIN_POSITION_MESSAGE) double y,
    @JsonProperty("width") @Positive(message = TextBox.MIN_EXTENT_MESSAGE) double width,
    @JsonProperty("height") @Positive(message = TextBox.MIN_EXTENT_MESSAGE) double height)
    implements SlideElement {

  public static final double DEFAULT_X = 1.0;
  public static final double DEFAULT_Y = 1.5;
  public static final double DEFAULT_WIDTH = 8.0;
  public static final double DEFAULT_HEIGHT = 5.0;

  public ChartElement {
    chartType = chartType == null ? ChartType.BAR : chartType;
    title = title == null ? "" : title;
    categories = categories == null ? List.of() : List.copyOf(categories);
    series = series == null ? List.of() : List.copyOf(series);
  }

  /** Whether there is enough data to build a table. */
  public boolean hasData() {
    return !categories.isEmpty() && !series.isEmpty();
  }

  @Override
  public ElementType elementType() {
    return ElementType.CHART;
  }
}
