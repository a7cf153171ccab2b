package com.flamingo.ai.slidedeck.service.compiler;

import com.flamingo.ai.slidedeck.domain.ir.HexColor;
import com.flamingo.ai.slidedeck.domain.ir.Presentation;
import com.flamingo.ai.slidedeck.domain.ir.Slide;
import com.flamingo.ai.slidedeck.domain.ir.SlideElement;
import com.flamingo.ai.slidedeck.exception.PresentationBuildException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.sl.usermodel.Placeholder;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFNotes;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFSlideLayout;
import org.apache.poi.xslf.usermodel.XSLFSlideMaster;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.springframework.stereotype.Service;

/** Compiles the IR into a .pptx file with Apache POI. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PptxDocumentCompiler implements DocumentCompiler {

  private final LayoutResolver layoutResolver;
  private final SlideElementRenderer elementRenderer;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "presentation.compile", description = "Time to build a .pptx file")
  public Path compile(Presentation presentation, Path output, Path template) {
    log.info(
        "Building '{}' ({} slides) to {}{}",
        presentation.title(),
        presentation.slides().size(),
        output,
        template != null ? " from template " + template : "");

    try (XMLSlideShow ppt = openBase(template, output)) {
      List<XSLFSlideLayout> layouts = listLayouts(ppt);
      if (layouts.isEmpty()) {
        throw new PresentationBuildException(
            output,
            "Base document has no slide layouts",
            "The template has no slide layouts",
            null);
      }
      List<String> layoutNames = layouts.stream().map(XSLFSlideLayout::getName).toList();

      ppt.getProperties().getCoreProperties().setTitle(presentation.title());
      ppt.getProperties().getCoreProperties().setCreator(presentation.author());

      for (Slide slide : presentation.slides()) {
        XSLFSlideLayout layout = layouts.get(layoutResolver.resolve(slide.layout(), layoutNames));
        emitSlide(ppt, layout, slide);
      }

      save(ppt, output);
    } catch (IOException e) {
      throw new PresentationBuildException(
          output, "Failed to release presentation resources: " + e.getMessage(), e);
    }

    meterRegistry.counter("presentation.built").increment();
    log.info("Presentation written to {}", output);
    return output;
  }

  private XMLSlideShow openBase(Path template, Path output) {
    if (template == null || !Files.exists(template)) {
      XMLSlideShow ppt = new XMLSlideShow();
      ppt.setPageSize(SlideGeometry.canvasSize());
      return ppt;
    }
    XMLSlideShow ppt;
    try (InputStream in = Files.newInputStream(template)) {
      ppt = new XMLSlideShow(in);
    } catch (IOException | RuntimeException e) {
      log.error("Failed to open template {}: {}", template, e.getMessage());
      throw new PresentationBuildException(
          output,
          "Failed to open template " + template + ": " + e.getMessage(),
          "The template file could not be opened",
          e);
    }
    int existing = ppt.getSlides().size();
    for (int i = existing - 1; i >= 0; i--) {
      ppt.removeSlide(i);
    }
    log.debug("Stripped {} slides from template {}", existing, template);
    return ppt;
  }

  static List<XSLFSlideLayout> listLayouts(XMLSlideShow ppt) {
    List<XSLFSlideLayout> layouts = new ArrayList<>();
    for (XSLFSlideMaster master : ppt.getSlideMasters()) {
      layouts.addAll(List.of(master.getSlideLayouts()));
    }
    return layouts;
  }

  private void emitSlide(XMLSlideShow ppt, XSLFSlideLayout layout, Slide slide) {
    XSLFSlide target = ppt.createSlide(layout);
    for (XSLFShape shape : new ArrayList<>(target.getShapes())) {
      if (shape.isPlaceholder()) {
        target.removeShape(shape);
      }
    }
    target.getBackground().setFillColor(HexColor.toColor(slide.backgroundColor()));

    for (SlideElement element : slide.elements()) {
      elementRenderer.render(ppt, target, element);
    }

    if (slide.hasSpeakerNotes()) {
      writeNotes(ppt, target, slide.speakerNotes());
    }
  }

  private void writeNotes(XMLSlideShow ppt, XSLFSlide slide, String speakerNotes) {
    XSLFNotes notes = ppt.getNotesSlide(slide);
    for (XSLFTextShape shape : notes.getPlaceholders()) {
      if (shape.getTextType() == Placeholder.BODY) {
        shape.setText(speakerNotes);
        return;
      }
    }
    log.warn(
        "Notes page of slide {} has no body placeholder, notes dropped", slide.getSlideNumber());
  }

  private void save(XMLSlideShow ppt, Path output) {
    Path directory = output.toAbsolutePath().getParent();
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new PresentationBuildException(
          output, "Cannot create output directory " + directory + ": " + e.getMessage(), e);
    }

    Path temp = null;
    try {
      temp = Files.createTempFile(directory, ".slidedeck-", ".pptx.tmp");
      try (OutputStream out = Files.newOutputStream(temp)) {
        ppt.write(out);
      }
      moveIntoPlace(temp, output);
    } catch (IOException | RuntimeException e) {
      log.error("Failed to save presentation to {}: {}", output, e.getMessage());
      throw new PresentationBuildException(
          output, "Failed to save presentation to " + output + ": " + e.getMessage(), e);
    } finally {
      if (temp != null) {
        deleteTemp(temp);
      }
    }
  }

  private static void moveIntoPlace(Path temp, Path output) throws IOException {
    try {
      Files.move(
          temp, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteTemp(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
    }
  }
}
