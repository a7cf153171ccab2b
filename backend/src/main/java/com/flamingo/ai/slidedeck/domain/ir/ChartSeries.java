package com.flamingo.ai.slidedeck.domain.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One named data series of a chart.
 *
 * @param values scalar values (numbers, strings, booleans or {@code null}) in category order
 */
public record ChartSeries(
    @JsonProperty("name") String name, @JsonProperty("values") List<Object> values) {

  public ChartSeries {
    name = name == null ? "" : name;
    // List.copyOf rejects null entries, which are legal values here
    values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
  }

  /** Text of the value at {@code index}, as written into a table cell. */
  public String valueText(int index) {
    Object value = values.get(index);
    return value == null ? "" : String.valueOf(value);
  }
}
