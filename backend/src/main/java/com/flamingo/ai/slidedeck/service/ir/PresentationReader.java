package com.flamingo.ai.slidedeck.service.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.flamingo.ai.slidedeck.domain.enums.ChartType;
import com.flamingo.ai.slidedeck.domain.enums.ElementType;
import com.flamingo.ai.slidedeck.domain.enums.HorizontalAlignment;
import com.flamingo.ai.slidedeck.domain.enums.LayoutType;
import com.flamingo.ai.slidedeck.domain.enums.VerticalAlignment;
import com.flamingo.ai.slidedeck.domain.ir.ChartElement;
import com.flamingo.ai.slidedeck.domain.ir.ChartSeries;
import com.flamingo.ai.slidedeck.domain.ir.HexColor;
import com.flamingo.ai.slidedeck.domain.ir.ImageElement;
import com.flamingo.ai.slidedeck.domain.ir.Presentation;
import com.flamingo.ai.slidedeck.domain.ir.Slide;
import com.flamingo.ai.slidedeck.domain.ir.SlideElement;
import com.flamingo.ai.slidedeck.domain.ir.TextBox;
import com.flamingo.ai.slidedeck.domain.ir.ThemeSettings;
import com.flamingo.ai.slidedeck.exception.FieldViolation;
import com.flamingo.ai.slidedeck.exception.PresentationValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Path;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads a parsed JSON tree into a validated {@link Presentation}.
 *
 * <p>Validation is total and runs in two passes whose results are reported together. The tree
 * walk checks node kinds, required fields and enum or tag membership; the value constraints
 * declared on the IR records (ranges, colors, blank names) are then checked by Bean Validation.
 * Absent optional fields (or explicit JSON {@code null}) take the IR defaults; unknown keys are
 * ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PresentationReader {

  private static final PropertyNamingStrategies.NamingBase JSON_NAMES =
      new PropertyNamingStrategies.SnakeCaseStrategy();

  private final Validator validator;

  /**
   * Converts the tree to a presentation.
   *
   * @param root parsed JSON document
   * @return the validated presentation
   * @throws PresentationValidationException listing every violated constraint
   */
  public Presentation read(JsonNode root) {
    Walk walk = new Walk();
    Presentation presentation = walk.presentation(root);
    List<FieldViolation> violations = new ArrayList<>(walk.violations);
    if (presentation != null) {
      Set<String> reported =
          violations.stream().map(FieldViolation::path).collect(Collectors.toSet());
      validator.validate(presentation).stream()
          .map(PresentationReader::toFieldViolation)
          .filter(violation -> !reported.contains(violation.path()))
          .sorted(Comparator.comparing(FieldViolation::path))
          .forEach(violations::add);
    }
    if (!violations.isEmpty()) {
      log.debug("IR rejected with {} violation(s)", violations.size());
      throw new PresentationValidationException(violations);
    }
    return presentation;
  }

  static FieldViolation toFieldViolation(ConstraintViolation<Presentation> violation) {
    return new FieldViolation(jsonPath(violation.getPropertyPath()), violation.getMessage());
  }

  /** Renders a bean property path with the JSON field names, e.g. {@code slides[0].font_size}. */
  static String jsonPath(Path propertyPath) {
    StringBuilder path = new StringBuilder();
    for (Path.Node node : propertyPath) {
      if (node.getIndex() != null) {
        path.append('[').append(node.getIndex()).append(']');
      }
      if (node.getName() != null) {
        if (path.length() > 0) {
          path.append('.');
        }
        path.append(JSON_NAMES.translate(node.getName()));
      }
    }
    return path.toString();
  }

  /** Single-use traversal state. */
  private static final class Walk {

    private final List<FieldViolation> violations = new ArrayList<>();

    Presentation presentation(JsonNode root) {
      if (root == null || !root.isObject()) {
        fail("$", "must be a JSON object");
        return null;
      }
      String title = requiredString(root, "title", "");
      List<Slide> slides = new ArrayList<>();
      JsonNode slidesNode = array(root, "slides", "");
      if (slidesNode != null) {
        for (int i = 0; i < slidesNode.size(); i++) {
          slides.add(slide(slidesNode.get(i), "slides[" + i + "]"));
        }
      }
      String subtitle = optionalString(root, "subtitle", "", "");
      String author = optionalString(root, "author", "", Presentation.DEFAULT_AUTHOR);
      ThemeSettings theme = theme(root.get("theme"), "theme");
      if (slides.contains(null)) {
        return null;
      }
      return Presentation.builder()
          .title(title)
          .subtitle(subtitle)
          .author(author)
          .theme(theme)
          .slides(slides)
          .build();
    }

    ThemeSettings theme(JsonNode node, String path) {
      if (isAbsent(node)) {
        return ThemeSettings.defaults();
      }
      if (!node.isObject()) {
        fail(path, "must be an object");
        return null;
      }
      return ThemeSettings.builder()
          .primaryColor(color(node, "primary_color", path, ThemeSettings.DEFAULT_PRIMARY_COLOR))
          .secondaryColor(
              color(node, "secondary_color", path, ThemeSettings.DEFAULT_SECONDARY_COLOR))
          .backgroundColor(
              color(node, "background_color", path, ThemeSettings.DEFAULT_BACKGROUND_COLOR))
          .fontHeading(optionalString(node, "font_heading", path, ThemeSettings.DEFAULT_FONT))
          .fontBody(optionalString(node, "font_body", path, ThemeSettings.DEFAULT_FONT))
          .build();
    }

    Slide slide(JsonNode node, String path) {
      if (node == null || !node.isObject()) {
        fail(path, "must be an object");
        return null;
      }
      List<SlideElement> elements = new ArrayList<>();
      JsonNode elementsNode = array(node, "elements", path);
      if (elementsNode != null) {
        for (int i = 0; i < elementsNode.size(); i++) {
          elements.add(element(elementsNode.get(i), path + ".elements[" + i + "]"));
        }
      }
      LayoutType layout =
          enumValue(node, "layout", path, LayoutType.values(), LayoutType::getValue, null);
      String background = color(node, "background_color", path, Slide.DEFAULT_BACKGROUND_COLOR);
      String notes = optionalString(node, "speaker_notes", path, "");
      if (elements.contains(null)) {
        return null;
      }
      return Slide.builder()
          .layout(layout)
          .backgroundColor(background)
          .elements(elements)
          .speakerNotes(notes)
          .build();
    }

    SlideElement element(JsonNode node, String path) {
      if (node == null || !node.isObject()) {
        fail(path, "must be an object");
        return null;
      }
      JsonNode typeNode = node.get("type");
      if (isAbsent(typeNode)) {
        fail(join(path, "type"), "is required");
        return null;
      }
      ElementType type =
          enumValue(node, "type", path, ElementType.values(), ElementType::getValue, null);
      if (type == null) {
        return null;
      }
      return switch (type) {
        case TEXT -> textBox(node, path);
        case IMAGE -> image(node, path);
        case CHART -> chart(node, path);
      };
    }

    TextBox textBox(JsonNode node, String path) {
      String content = requiredString(node, "content", path);
      return TextBox.builder()
          .content(content)
          .isTitle(bool(node, "is_title", path, false))
          .x(number(node, "x", path, TextBox.DEFAULT_X))
          .y(number(node, "y", path, TextBox.DEFAULT_Y))
          .width(number(node, "width", path, TextBox.DEFAULT_WIDTH))
          .height(number(node, "height", path, TextBox.DEFAULT_HEIGHT))
          .fontName(optionalString(node, "font_name", path, TextBox.DEFAULT_FONT_NAME))
          .fontSize(integer(node, "font_size", path, TextBox.DEFAULT_FONT_SIZE))
          .fontBold(bool(node, "font_bold", path, false))
          .fontItalic(bool(node, "font_italic", path, false))
          .fontColor(color(node, "font_color", path, TextBox.DEFAULT_FONT_COLOR))
          .alignment(
              enumValue(
                  node,
                  "alignment",
                  path,
                  HorizontalAlignment.values(),
                  HorizontalAlignment::getValue,
                  HorizontalAlignment.LEFT))
          .verticalAlignment(
              enumValue(
                  node,
                  "vertical_alignment",
                  path,
                  VerticalAlignment.values(),
                  VerticalAlignment::getValue,
                  VerticalAlignment.TOP))
          .build();
    }

    ImageElement image(JsonNode node, String path) {
      return ImageElement.builder()
          .url(optionalString(node, "url", path, null))
          .path(optionalString(node, "path", path, null))
          .altText(optionalString(node, "alt_text", path, ""))
          .x(number(node, "x", path, ImageElement.DEFAULT_X))
          .y(number(node, "y", path, ImageElement.DEFAULT_Y))
          .width(number(node, "width", path, ImageElement.DEFAULT_WIDTH))
          .height(number(node, "height", path, ImageElement.DEFAULT_HEIGHT))
          .build();
    }

    ChartElement chart(JsonNode node, String path) {
      List<String> categories = new ArrayList<>();
      JsonNode categoriesNode = array(node, "categories", path);
      if (categoriesNode != null) {
        for (int i = 0; i < categoriesNode.size(); i++) {
          JsonNode category = categoriesNode.get(i);
          if (category.isValueNode() && !category.isNull()) {
            categories.add(category.asText());
          } else {
            fail(join(path, "categories[" + i + "]"), "must be a scalar label");
          }
        }
      }
      List<ChartSeries> series = new ArrayList<>();
      JsonNode seriesNode = array(node, "series", path);
      if (seriesNode != null) {
        for (int i = 0; i < seriesNode.size(); i++) {
          series.add(series(seriesNode.get(i), join(path, "series[" + i + "]")));
        }
      }
      if (series.contains(null)) {
        return null;
      }
      return ChartElement.builder()
          .chartType(
              enumValue(
                  node, "chart_type", path, ChartType.values(), ChartType::getValue, ChartType.BAR))
          .title(optionalString(node, "title", path, ""))
          .categories(categories)
          .series(series)
          .x(number(node, "x", path, ChartElement.DEFAULT_X))
          .y(number(node, "y", path, ChartElement.DEFAULT_Y))
          .width(number(node, "width", path, ChartElement.DEFAULT_WIDTH))
          .height(number(node, "height", path, ChartElement.DEFAULT_HEIGHT))
          .build();
    }

    ChartSeries series(JsonNode node, String path) {
      if (node == null || !node.isObject()) {
        fail(path, "must be an object with name and values");
        return null;
      }
      String name = optionalString(node, "name", path, "");
      List<Object> values = new ArrayList<>();
      JsonNode valuesNode = array(node, "values", path);
      if (valuesNode != null) {
        for (int i = 0; i < valuesNode.size(); i++) {
          JsonNode value = valuesNode.get(i);
          if (value.isNull()) {
            values.add(null);
          } else if (value.isIntegralNumber()) {
            values.add(value.numberValue());
          } else if (value.isNumber()) {
            values.add(value.doubleValue());
          } else if (value.isBoolean()) {
            values.add(value.booleanValue());
          } else if (value.isTextual()) {
            values.add(value.textValue());
          } else {
            fail(join(path, "values[" + i + "]"), "must be a scalar value");
          }
        }
      }
      return new ChartSeries(name, values);
    }

    String requiredString(JsonNode node, String field, String path) {
      JsonNode value = node.get(field);
      if (isAbsent(value)) {
        fail(join(path, field), "is required");
        return null;
      }
      if (!value.isTextual()) {
        fail(join(path, field), "must be a string");
        return null;
      }
      return value.textValue();
    }

    String optionalString(JsonNode node, String field, String path, String defaultValue) {
      JsonNode value = node.get(field);
      if (isAbsent(value)) {
        return defaultValue;
      }
      if (!value.isTextual()) {
        fail(join(path, field), "must be a string");
        return defaultValue;
      }
      return value.textValue();
    }

    String color(JsonNode node, String field, String path, String defaultValue) {
      return HexColor.canonical(optionalString(node, field, path, defaultValue));
    }

    boolean bool(JsonNode node, String field, String path, boolean defaultValue) {
      JsonNode value = node.get(field);
      if (isAbsent(value)) {
        return defaultValue;
      }
      if (!value.isBoolean()) {
        fail(join(path, field), "must be a boolean");
        return defaultValue;
      }
      return value.booleanValue();
    }

    double number(JsonNode node, String field, String path, double defaultValue) {
      JsonNode value = node.get(field);
      if (isAbsent(value)) {
        return defaultValue;
      }
      if (!value.isNumber()) {
        fail(join(path, field), "must be a number");
        return defaultValue;
      }
      return value.doubleValue();
    }

    /** Whole numbers outside the int range saturate and are caught by the font size bounds. */
    int integer(JsonNode node, String field, String path, int defaultValue) {
      JsonNode value = node.get(field);
      if (isAbsent(value)) {
        return defaultValue;
      }
      boolean whole =
          value.isIntegralNumber()
              || (value.isNumber() && value.doubleValue() == Math.rint(value.doubleValue()));
      if (!whole) {
        fail(join(path, field), "must be an integer");
        return defaultValue;
      }
      return (int) value.doubleValue();
    }

    <E extends Enum<E>> E enumValue(
        JsonNode node,
        String field,
        String path,
        E[] constants,
        Function<E, String> wireValue,
        E defaultValue) {
      JsonNode value = node.get(field);
      if (isAbsent(value)) {
        return defaultValue;
      }
      if (value.isTextual()) {
        for (E constant : constants) {
          if (wireValue.apply(constant).equals(value.textValue())) {
            return constant;
          }
        }
      }
      String allowed =
          Arrays.stream(constants).map(wireValue).collect(Collectors.joining(", "));
      fail(join(path, field), "must be one of [" + allowed + "], got " + value);
      return defaultValue;
    }

    JsonNode array(JsonNode node, String field, String path) {
      JsonNode value = node.get(field);
      if (isAbsent(value)) {
        return null;
      }
      if (!value.isArray()) {
        fail(join(path, field), "must be an array");
        return null;
      }
      return value;
    }

    void fail(String path, String message) {
      violations.add(new FieldViolation(path, message));
    }

    private static boolean isAbsent(JsonNode value) {
      return value == null || value.isNull() || value.isMissingNode();
    }

    private static String join(String path, String field) {
      return path.isEmpty() ? field : path + "." + field;
    }
  }
}
