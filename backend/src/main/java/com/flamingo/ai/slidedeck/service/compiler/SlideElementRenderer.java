package com.flamingo.ai.slidedeck.service.compiler;

import com.flamingo.ai.slidedeck.domain.enums.HorizontalAlignment;
import com.flamingo.ai.slidedeck.domain.enums.VerticalAlignment;
import com.flamingo.ai.slidedeck.domain.ir.ChartElement;
import com.flamingo.ai.slidedeck.domain.ir.ChartSeries;
import com.flamingo.ai.slidedeck.domain.ir.HexColor;
import com.flamingo.ai.slidedeck.domain.ir.ImageElement;
import com.flamingo.ai.slidedeck.domain.ir.SlideElement;
import com.flamingo.ai.slidedeck.domain.ir.TextBox;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.sl.usermodel.PictureData.PictureType;
import org.apache.poi.sl.usermodel.TextParagraph.TextAlign;
import org.apache.poi.sl.usermodel.TextShape.TextAutofit;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.springframework.stereotype.Component;

/**
 * Emits IR elements as shapes on a slide. Every element yields exactly one shape: an image that
 * cannot be loaded becomes a placeholder text box, a chart without data becomes its title box.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlideElementRenderer {

  static final int IMAGE_PLACEHOLDER_FONT_SIZE = 14;
  static final String IMAGE_PLACEHOLDER_COLOR = "#999999";
  static final int CHART_TITLE_FONT_SIZE = 16;
  static final double CHART_TITLE_HEIGHT = 0.5;
  static final String CHART_FALLBACK_TITLE = "[Chart]";

  private static final String LINE_BREAK_PATTERN = "\\r\\n|\\r|\\n|\\u000b";

  private final ImageLoader imageLoader;
  private final MeterRegistry meterRegistry;

  /** Renders one element; the slide's shape count grows by exactly one. */
  public void render(XMLSlideShow ppt, XSLFSlide slide, SlideElement element) {
    if (element instanceof TextBox textBox) {
      renderText(slide, textBox);
    } else if (element instanceof ImageElement image) {
      renderImage(ppt, slide, image);
    } else if (element instanceof ChartElement chart) {
      renderChart(slide, chart);
    } else {
      throw new IllegalArgumentException("Unsupported element: " + element.getClass().getName());
    }
  }

  XSLFTextBox renderText(XSLFSlide slide, TextBox textBox) {
    XSLFTextBox box = slide.createTextBox();
    box.setAnchor(SlideGeometry.anchorOf(textBox));
    box.setWordWrap(true);
    box.setTextAutofit(TextAutofit.NONE);
    box.setVerticalAlignment(toPoi(textBox.verticalAlignment()));
    box.clearText();

    XSLFTextParagraph paragraph = box.addNewTextParagraph();
    paragraph.setTextAlign(toPoi(textBox.alignment()));

    String[] lines = textBox.content().split(LINE_BREAK_PATTERN, -1);
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) {
        applyFont(paragraph.addLineBreak(), textBox);
      }
      XSLFTextRun run = paragraph.addNewTextRun();
      run.setText(lines[i]);
      applyFont(run, textBox);
    }
    return box;
  }

  private void renderImage(XMLSlideShow ppt, XSLFSlide slide, ImageElement image) {
    if (!image.hasUrl() && !image.hasPath()) {
      log.warn("Image element has no source, emitting placeholder");
      renderImagePlaceholder(slide, image);
      return;
    }
    XSLFPictureShape picture = null;
    try {
      byte[] data = imageLoader.load(image);
      PictureType pictureType = PictureFormats.detect(data);
      XSLFPictureData pictureData = ppt.addPicture(data, pictureType);
      picture = slide.createPicture(pictureData);
      picture.setAnchor(SlideGeometry.anchorOf(image));
    } catch (IOException | RuntimeException e) {
      log.warn(
          "Could not embed image {}: {}",
          image.hasUrl() ? image.url() : image.path(),
          e.getMessage());
      if (picture != null) {
        slide.removeShape(picture);
      }
      renderImagePlaceholder(slide, image);
    }
  }

  private void renderImagePlaceholder(XSLFSlide slide, ImageElement image) {
    meterRegistry.counter("presentation.elements.degraded", "element", "image").increment();
    String label = image.altText().isEmpty() ? "unavailable" : image.altText();
    TextBox placeholder =
        TextBox.withDefaults("[Image: " + label + "]")
            .x(image.x())
            .y(image.y())
            .width(image.width())
            .height(image.height())
            .fontSize(IMAGE_PLACEHOLDER_FONT_SIZE)
            .fontColor(IMAGE_PLACEHOLDER_COLOR)
            .alignment(HorizontalAlignment.CENTER)
            .verticalAlignment(VerticalAlignment.MIDDLE)
            .build();
    renderText(slide, placeholder);
  }

  private void renderChart(XSLFSlide slide, ChartElement chart) {
    if (!chart.hasData()) {
      log.warn("Chart '{}' has no categories or series, emitting title only", chart.title());
      meterRegistry.counter("presentation.elements.degraded", "element", "chart").increment();
      TextBox titleBox =
          TextBox.withDefaults(chart.title().isEmpty() ? CHART_FALLBACK_TITLE : chart.title())
              .x(chart.x())
              .y(chart.y())
              .width(chart.width())
              .height(CHART_TITLE_HEIGHT)
              .fontSize(CHART_TITLE_FONT_SIZE)
              .fontBold(true)
              .alignment(HorizontalAlignment.CENTER)
              .build();
      renderText(slide, titleBox);
      return;
    }

    List<String> categories = chart.categories();
    List<ChartSeries> series = chart.series();
    int rows = series.size() + 1;
    int cols = categories.size() + 1;

    XSLFTable table = slide.createTable(rows, cols);
    table.setAnchor(SlideGeometry.anchorOf(chart));
    double columnWidth = SlideGeometry.toPoints(chart.width()) / cols;
    for (int c = 0; c < cols; c++) {
      table.setColumnWidth(c, columnWidth);
    }
    double rowHeight = SlideGeometry.toPoints(chart.height()) / rows;
    for (int r = 0; r < rows; r++) {
      table.getRows().get(r).setHeight(rowHeight);
    }

    table.getCell(0, 0).setText(chart.title());
    for (int c = 0; c < categories.size(); c++) {
      table.getCell(0, c + 1).setText(categories.get(c));
    }
    for (int r = 0; r < series.size(); r++) {
      ChartSeries row = series.get(r);
      table.getCell(r + 1, 0).setText(row.name());
      int filled = Math.min(row.values().size(), categories.size());
      for (int c = 0; c < filled; c++) {
        table.getCell(r + 1, c + 1).setText(row.valueText(c));
      }
    }
  }

  private static void applyFont(XSLFTextRun run, TextBox textBox) {
    run.setFontFamily(textBox.fontName());
    run.setFontSize((double) textBox.fontSize());
    run.setBold(textBox.fontBold());
    run.setItalic(textBox.fontItalic());
    run.setFontColor(HexColor.toColor(textBox.fontColor()));
  }

  private static TextAlign toPoi(HorizontalAlignment alignment) {
    return switch (alignment) {
      case CENTER -> TextAlign.CENTER;
      case RIGHT -> TextAlign.RIGHT;
      case LEFT -> TextAlign.LEFT;
    };
  }

  private static org.apache.poi.sl.usermodel.VerticalAlignment toPoi(VerticalAlignment alignment) {
    return switch (alignment) {
      case MIDDLE -> org.apache.poi.sl.usermodel.VerticalAlignment.MIDDLE;
      case BOTTOM -> org.apache.poi.sl.usermodel.VerticalAlignment.BOTTOM;
      case TOP -> org.apache.poi.sl.usermodel.VerticalAlignment.TOP;
    };
  }
}
