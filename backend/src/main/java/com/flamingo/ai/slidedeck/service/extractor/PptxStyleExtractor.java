package com.flamingo.ai.slidedeck.service.extractor;

import com.flamingo.ai.slidedeck.domain.ir.DesignTokens;
import com.flamingo.ai.slidedeck.domain.ir.HexColor;
import com.flamingo.ai.slidedeck.domain.ir.ThemeSettings;
import com.flamingo.ai.slidedeck.exception.StyleExtractionException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFSlideLayout;
import org.apache.poi.xslf.usermodel.XSLFSlideMaster;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.drawingml.x2006.main.CTShapeProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.CTSolidColorFillProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextCharacterProperties;
import org.openxmlformats.schemas.presentationml.x2006.main.CTBackgroundProperties;
import org.openxmlformats.schemas.presentationml.x2006.main.CTCommonSlideData;
import org.openxmlformats.schemas.presentationml.x2006.main.CTShape;
import org.springframework.stereotype.Service;

/**
 * Reads explicit styling out of a .pptx with Apache POI.
 *
 * <p>Only values written directly on a run or shape count. Scheme colors and anything inherited
 * from masters or layouts are skipped. Inspection failures on a single shape or run drop that item
 * and the walk carries on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PptxStyleExtractor implements StyleExtractor {

  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "presentation.extract", description = "Time to extract design tokens")
  public DesignTokens extract(Path presentationFile) {
    log.info("Extracting design tokens from {}", presentationFile);
    try (InputStream in = Files.newInputStream(presentationFile);
        XMLSlideShow ppt = new XMLSlideShow(in)) {
      SortedSet<String> colors = new TreeSet<>();
      SortedSet<String> fonts = new TreeSet<>();

      for (XSLFSlide slide : ppt.getSlides()) {
        collectBackground(slide, colors);
        for (XSLFShape shape : slide.getShapes()) {
          collectShape(shape, colors, fonts);
        }
      }

      DesignTokens tokens = toTokens(colors, fonts, layoutNames(ppt));
      meterRegistry.counter("presentation.extractions").increment();
      log.info(
          "Extracted {} colors, {} fonts and {} layouts from {}",
          tokens.extractedColors().size(),
          tokens.extractedFonts().size(),
          tokens.layoutNames().size(),
          presentationFile);
      return tokens;
    } catch (IOException | RuntimeException e) {
      log.error("Failed to read presentation {}: {}", presentationFile, e.getMessage());
      throw new StyleExtractionException(
          presentationFile, "Cannot open " + presentationFile + ": " + e.getMessage(), e);
    }
  }

  static DesignTokens toTokens(
      SortedSet<String> colors, SortedSet<String> fonts, List<String> layoutNames) {
    List<String> colorList = List.copyOf(colors);
    List<String> fontList = List.copyOf(fonts);
    String heading = fontList.isEmpty() ? null : fontList.get(0);
    String body = fontList.size() > 1 ? fontList.get(1) : heading;
    return DesignTokens.builder()
        .primaryColor(colorList.isEmpty() ? null : colorList.get(0))
        .secondaryColor(colorList.size() > 1 ? colorList.get(1) : null)
        .backgroundColor(ThemeSettings.DEFAULT_BACKGROUND_COLOR)
        .fontHeading(heading)
        .fontBody(body)
        .layoutNames(layoutNames)
        .extractedColors(colorList)
        .extractedFonts(fontList)
        .build();
  }

  private static List<String> layoutNames(XMLSlideShow ppt) {
    List<String> names = new ArrayList<>();
    for (XSLFSlideMaster master : ppt.getSlideMasters()) {
      for (XSLFSlideLayout layout : master.getSlideLayouts()) {
        String name = layout.getName();
        if (name != null && !name.isBlank()) {
          names.add(name);
        }
      }
    }
    return names;
  }

  /** Records the slide's own solid sRGB background; master and layout backgrounds are skipped. */
  private void collectBackground(XSLFSlide slide, SortedSet<String> colors) {
    try {
      CTCommonSlideData cSld = slide.getXmlObject().getCSld();
      if (cSld.isSetBg() && cSld.getBg().isSetBgPr()) {
        CTBackgroundProperties bgPr = cSld.getBg().getBgPr();
        String color = explicitColor(bgPr.isSetSolidFill() ? bgPr.getSolidFill() : null);
        if (color != null) {
          colors.add(color);
        }
      }
    } catch (RuntimeException e) {
      log.debug("Skipping background of slide {}: {}", slide.getSlideNumber(), e.getMessage());
    }
  }

  private void collectShape(XSLFShape shape, SortedSet<String> colors, SortedSet<String> fonts) {
    if (shape instanceof XSLFGroupShape group) {
      for (XSLFShape child : group.getShapes()) {
        collectShape(child, colors, fonts);
      }
      return;
    }

    try {
      String fill = explicitShapeFill(shape.getXmlObject());
      if (fill != null) {
        colors.add(fill);
      }
    } catch (RuntimeException e) {
      log.debug("Skipping fill of shape '{}': {}", shape.getShapeName(), e.getMessage());
    }

    if (shape instanceof XSLFTextShape textShape) {
      for (XSLFTextParagraph paragraph : textShape.getTextParagraphs()) {
        for (XSLFTextRun run : paragraph.getTextRuns()) {
          collectRun(run, colors, fonts);
        }
      }
    }
  }

  private void collectRun(XSLFTextRun run, SortedSet<String> colors, SortedSet<String> fonts) {
    try {
      CTTextCharacterProperties props = run.getRPr(false);
      if (props == null) {
        return;
      }
      String color = explicitColor(props.isSetSolidFill() ? props.getSolidFill() : null);
      if (color != null) {
        colors.add(color);
      }
      if (props.isSetLatin()) {
        String typeface = props.getLatin().getTypeface();
        // "+mj-lt" and "+mn-lt" point at theme fonts
        if (typeface != null && !typeface.isBlank() && !typeface.startsWith("+")) {
          fonts.add(typeface);
        }
      }
    } catch (RuntimeException e) {
      log.debug("Skipping text run '{}': {}", run.getRawText(), e.getMessage());
    }
  }

  private static String explicitShapeFill(XmlObject xml) {
    if (xml instanceof CTShape ctShape && ctShape.getSpPr() != null) {
      CTShapeProperties spPr = ctShape.getSpPr();
      return explicitColor(spPr.isSetSolidFill() ? spPr.getSolidFill() : null);
    }
    return null;
  }

  private static String explicitColor(CTSolidColorFillProperties solidFill) {
    if (solidFill == null || !solidFill.isSetSrgbClr()) {
      return null;
    }
    return HexColor.fromRgbBytes(solidFill.getSrgbClr().getVal());
  }
}
