package com.flamingo.ai.slidedeck.service.preview;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.slidedeck.config.SlideDeckConfig;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import javax.imageio.ImageIO;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class LibreOfficePreviewRendererTest {

  @TempDir Path tempDir;

  private SlideDeckConfig config;
  private LibreOfficePreviewRenderer renderer;
  private Path pptx;

  @BeforeEach
  void setUp() throws Exception {
    config = new SlideDeckConfig();
    renderer = new LibreOfficePreviewRenderer(config);
    pptx = Files.writeString(tempDir.resolve("deck.pptx"), "placeholder");
  }

  @Test
  void shouldSkipWhenDisabled() {
    config.getPreview().setEnabled(false);
    Path previews = tempDir.resolve("previews");

    assertThat(renderer.render(pptx, previews)).isEmpty();
    assertThat(previews).doesNotExist();
  }

  @Test
  @DisplayName("a missing converter binary yields no previews and clears stale images")
  void shouldReturnEmptyWhenConverterIsMissing() throws Exception {
    config.getPreview().setCommand("slidedeck-no-such-converter");
    Path previews = Files.createDirectories(tempDir.resolve("previews"));
    Path stale = Files.writeString(previews.resolve("slide-3.png"), "old");

    List<Path> images = renderer.render(pptx, previews);

    assertThat(images).isEmpty();
    assertThat(stale).doesNotExist();
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void shouldReturnEmptyWhenConverterFails() {
    config.getPreview().setCommand("false");

    assertThat(renderer.render(pptx, tempDir.resolve("previews"))).isEmpty();
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  @DisplayName("a converter that exits cleanly without writing a PDF yields no previews")
  void shouldReturnEmptyWhenConverterProducesNoPdf() {
    config.getPreview().setCommand("true");

    assertThat(renderer.render(pptx, tempDir.resolve("previews"))).isEmpty();
  }

  @Test
  @DisplayName("rasterizes every page to a one-based slide image")
  void shouldRasterizeEveryPage() throws Exception {
    Path pdf = tempDir.resolve("deck.pdf");
    try (PDDocument document = new PDDocument()) {
      document.addPage(new PDPage(new PDRectangle(960, 540)));
      document.addPage(new PDPage(new PDRectangle(960, 540)));
      document.save(pdf.toFile());
    }

    List<Path> images = LibreOfficePreviewRenderer.rasterize(pdf, tempDir, 36f);

    assertThat(images)
        .containsExactly(tempDir.resolve("slide-1.png"), tempDir.resolve("slide-2.png"));
    BufferedImage first = ImageIO.read(images.get(0).toFile());
    assertThat(first.getWidth()).isEqualTo(480);
    assertThat(first.getHeight()).isEqualTo(270);
  }
}
