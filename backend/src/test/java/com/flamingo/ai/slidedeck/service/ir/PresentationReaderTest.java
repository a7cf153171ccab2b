package com.flamingo.ai.slidedeck.service.ir;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.slidedeck.domain.enums.ChartType;
import com.flamingo.ai.slidedeck.domain.enums.HorizontalAlignment;
import com.flamingo.ai.slidedeck.domain.enums.LayoutType;
import com.flamingo.ai.slidedeck.domain.enums.VerticalAlignment;
import com.flamingo.ai.slidedeck.domain.ir.ChartElement;
import com.flamingo.ai.slidedeck.domain.ir.ImageElement;
import com.flamingo.ai.slidedeck.domain.ir.Presentation;
import com.flamingo.ai.slidedeck.domain.ir.Slide;
import com.flamingo.ai.slidedeck.domain.ir.TextBox;
import com.flamingo.ai.slidedeck.exception.FieldViolation;
import com.flamingo.ai.slidedeck.exception.PresentationValidationException;
import jakarta.validation.Validation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PresentationReaderTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final PresentationReader reader =
      new PresentationReader(Validation.buildDefaultValidatorFactory().getValidator());

  private Presentation read(String json) throws Exception {
    JsonNode root = objectMapper.readTree(json);
    return reader.read(root);
  }

  private PresentationValidationException rejected(String json) throws Exception {
    JsonNode root = objectMapper.readTree(json);
    try {
      reader.read(root);
    } catch (PresentationValidationException e) {
      return e;
    }
    throw new AssertionError("Expected the document to be rejected");
  }

  @Nested
  @DisplayName("defaults")
  class Defaults {

    @Test
    @DisplayName("fills every omitted field with its default")
    void shouldApplyDefaults() throws Exception {
      Presentation presentation =
          read(
              """
              {"title": "Quarterly Review",
               "slides": [{"elements": [{"type": "text", "content": "Hello"}]}]}
              """);

      assertThat(presentation.subtitle()).isEmpty();
      assertThat(presentation.author()).isEqualTo("SlideDeck AI");
      assertThat(presentation.theme().primaryColor()).isEqualTo("#1a73e8");
      assertThat(presentation.theme().secondaryColor()).isEqualTo("#e8710a");
      assertThat(presentation.theme().fontHeading()).isEqualTo("Calibri");

      Slide slide = presentation.slides().get(0);
      assertThat(slide.layout()).isEqualTo(LayoutType.TITLE_CONTENT);
      assertThat(slide.backgroundColor()).isEqualTo("#ffffff");
      assertThat(slide.speakerNotes()).isEmpty();

      TextBox text = (TextBox) slide.elements().get(0);
      assertThat(text.x()).isEqualTo(0.5);
      assertThat(text.y()).isEqualTo(0.5);
      assertThat(text.width()).isEqualTo(9.0);
      assertThat(text.height()).isEqualTo(1.0);
      assertThat(text.fontName()).isEqualTo("Calibri");
      assertThat(text.fontSize()).isEqualTo(18);
      assertThat(text.fontColor()).isEqualTo("#333333");
      assertThat(text.alignment()).isEqualTo(HorizontalAlignment.LEFT);
      assertThat(text.verticalAlignment()).isEqualTo(VerticalAlignment.TOP);
      assertThat(text.isTitle()).isFalse();
    }

    @Test
    @DisplayName("treats explicit null like an absent field")
    void shouldTreatNullAsAbsent() throws Exception {
      Presentation presentation =
          read(
              """
              {"title": "T", "subtitle": null, "theme": null,
               "slides": [{"layout": null, "background_color": null,
                 "elements": [{"type": "text", "content": "x", "font_size": null}]}]}
              """);

      assertThat(presentation.subtitle()).isEmpty();
      assertThat(presentation.theme().backgroundColor()).isEqualTo("#ffffff");
      TextBox text = (TextBox) presentation.slides().get(0).elements().get(0);
      assertThat(text.fontSize()).isEqualTo(18);
    }

    @Test
    @DisplayName("image and chart elements get their own geometry defaults")
    void shouldApplyImageAndChartDefaults() throws Exception {
      Presentation presentation =
          read(
              """
              {"title": "T", "slides": [{"elements": [
                {"type": "image", "alt_text": "logo"},
                {"type": "chart", "categories": ["Q1"], "series": [{"name": "s", "values": [1]}]}
              ]}]}
              """);

      ImageElement image = (ImageElement) presentation.slides().get(0).elements().get(0);
      assertThat(image.x()).isEqualTo(1.0);
      assertThat(image.y()).isEqualTo(1.5);
      assertThat(image.width()).isEqualTo(8.0);
      assertThat(image.height()).isEqualTo(5.0);
      assertThat(image.hasUrl()).isFalse();
      assertThat(image.hasPath()).isFalse();

      ChartElement chart = (ChartElement) presentation.slides().get(0).elements().get(1);
      assertThat(chart.chartType()).isEqualTo(ChartType.BAR);
      assertThat(chart.width()).isEqualTo(8.0);
      assertThat(chart.title()).isEmpty();
    }
  }

  @Nested
  @DisplayName("normalization")
  class Normalization {

    @Test
    void shouldNormalizeColorsToLowercaseWithHash() throws Exception {
      Presentation presentation =
          read(
              """
              {"title": "T", "theme": {"primary_color": "ABCDEF"},
               "slides": [{"background_color": "#FFAA00",
                 "elements": [{"type": "text", "content": "x", "font_color": "#00FF00"}]}]}
              """);

      assertThat(presentation.theme().primaryColor()).isEqualTo("#abcdef");
      Slide slide = presentation.slides().get(0);
      assertThat(slide.backgroundColor()).isEqualTo("#ffaa00");
      assertThat(((TextBox) slide.elements().get(0)).fontColor()).isEqualTo("#00ff00");
    }

    @Test
    @DisplayName("accepts a whole-number font size written as a float")
    void shouldAcceptWholeFloatFontSize() throws Exception {
      Presentation presentation =
          read(
              """
              {"title": "T", "slides": [{"elements": [
                {"type": "text", "content": "x", "font_size": 24.0}]}]}
              """);

      assertThat(((TextBox) presentation.slides().get(0).elements().get(0)).fontSize())
          .isEqualTo(24);
    }

    @Test
    @DisplayName("keeps mixed chart values including nulls")
    void shouldKeepMixedChartValues() throws Exception {
      Presentation presentation =
          read(
              """
              {"title": "T", "slides": [{"elements": [{"type": "chart", "chart_type": "line",
                "categories": ["Q1", "Q2", "Q3"],
                "series": [{"name": "Revenue", "values": [10, 2.5, null]},
                           {"name": "Notes", "values": ["n/a", true]}]}]}]}
              """);

      ChartElement chart = (ChartElement) presentation.slides().get(0).elements().get(0);
      assertThat(chart.chartType()).isEqualTo(ChartType.LINE);
      assertThat(chart.series().get(0).valueText(0)).isEqualTo("10");
      assertThat(chart.series().get(0).valueText(1)).isEqualTo("2.5");
      assertThat(chart.series().get(0).valueText(2)).isEmpty();
      assertThat(chart.series().get(1).valueText(0)).isEqualTo("n/a");
      assertThat(chart.series().get(1).valueText(1)).isEqualTo("true");
    }
  }

  @Nested
  @DisplayName("violations")
  class Violations {

    @Test
    @DisplayName("reports every violation in one pass")
    void shouldReportAllViolations() throws Exception {
      PresentationValidationException ex =
          rejected(
              """
              {"title": "T", "slides": [
                {"elements": []},
                {"layout": "hero", "elements": [
                  {"type": "text", "content": "x", "font_size": 100}]}]}
              """);

      assertThat(ex.getViolations())
          .extracting(FieldViolation::path)
          .containsExactlyInAnyOrder("slides[1].layout", "slides[1].elements[0].font_size");
      assertThat(ex.getMessage()).contains("must be between 6 and 96");
    }

    @Test
    void shouldRequireTitle() throws Exception {
      assertThat(rejected("{\"slides\": []}").getViolations())
          .containsExactly(new FieldViolation("title", "is required"));
      assertThat(rejected("{\"title\": \"  \"}").getViolations())
          .containsExactly(new FieldViolation("title", "must not be blank"));
    }

    @Test
    void shouldRejectNonObjectRoot() throws Exception {
      assertThat(rejected("[1, 2]").getViolations())
          .extracting(FieldViolation::path)
          .containsExactly("$");
    }

    @Test
    @DisplayName("rejects fractional and string font sizes")
    void shouldRejectNonIntegerFontSize() throws Exception {
      PresentationValidationException ex =
          rejected(
              """
              {"title": "T", "slides": [{"elements": [
                {"type": "text", "content": "a", "font_size": 24.5},
                {"type": "text", "content": "b", "font_size": "24"}]}]}
              """);

      assertThat(ex.getViolations())
          .extracting(FieldViolation::toString)
          .containsExactly(
              "slides[0].elements[0].font_size: must be an integer",
              "slides[0].elements[1].font_size: must be an integer");
    }

    @Test
    void shouldRejectOutOfBoundsGeometry() throws Exception {
      PresentationValidationException ex =
          rejected(
              """
              {"title": "T", "slides": [{"elements": [
                {"type": "text", "content": "a", "x": -0.1, "width": 0}]}]}
              """);

      assertThat(ex.getViolations())
          .containsExactly(
              new FieldViolation("slides[0].elements[0].width", "must be greater than 0"),
              new FieldViolation(
                  "slides[0].elements[0].x", "must be greater than or equal to 0"));
    }

    @Test
    void shouldRejectMissingAndUnknownElementType() throws Exception {
      PresentationValidationException ex =
          rejected(
              """
              {"title": "T", "slides": [{"elements": [
                {"content": "no type"}, {"type": "video"}]}]}
              """);

      assertThat(ex.getViolations())
          .extracting(FieldViolation::path)
          .containsExactly("slides[0].elements[0].type", "slides[0].elements[1].type");
      assertThat(ex.getViolations().get(0).message()).isEqualTo("is required");
      assertThat(ex.getViolations().get(1).message()).contains("text, image, chart");
    }

    @Test
    void shouldRejectInvalidColorsAndMissingContent() throws Exception {
      PresentationValidationException ex =
          rejected(
              """
              {"title": "T", "theme": {"primary_color": "#12345"},
               "slides": [{"elements": [{"type": "text", "font_color": "red"}]}]}
              """);

      assertThat(ex.getViolations())
          .extracting(FieldViolation::path)
          .containsExactlyInAnyOrder(
              "theme.primary_color",
              "slides[0].elements[0].content",
              "slides[0].elements[0].font_color");
    }

    @Test
    @DisplayName("reports type errors from the walk together with declared value constraints")
    void shouldMergeStructuralAndValueViolations() throws Exception {
      PresentationValidationException ex =
          rejected(
              """
              {"title": "T", "theme": {"font_body": " "},
               "slides": [{"layout": "hero", "background_color": "white", "elements": [
                 {"type": "image", "height": -2, "alt_text": 5},
                 {"type": "chart", "y": -1, "chart_type": "radar", "categories": ["Q1"]},
                 {"type": "text", "content": "x", "font_name": "", "font_size": 5}]}]}
              """);

      assertThat(ex.getViolations())
          .extracting(FieldViolation::path)
          .containsExactly(
              "slides[0].elements[0].alt_text",
              "slides[0].elements[1].chart_type",
              "slides[0].layout",
              "slides[0].background_color",
              "slides[0].elements[0].height",
              "slides[0].elements[1].y",
              "slides[0].elements[2].font_name",
              "slides[0].elements[2].font_size",
              "theme.font_body");
    }

    @Test
    void shouldRejectNonScalarChartValues() throws Exception {
      PresentationValidationException ex =
          rejected(
              """
              {"title": "T", "slides": [{"elements": [{"type": "chart",
                "categories": ["Q1"], "series": [{"name": "s", "values": [[1]]}, 7]}]}]}
              """);

      assertThat(ex.getViolations())
          .extracting(FieldViolation::path)
          .containsExactly(
              "slides[0].elements[0].series[0].values[0]", "slides[0].elements[0].series[1]");
    }
  }
}
