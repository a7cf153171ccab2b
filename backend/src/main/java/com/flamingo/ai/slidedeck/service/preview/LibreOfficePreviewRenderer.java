package com.flamingo.ai.slidedeck.service.preview;

import com.flamingo.ai.slidedeck.config.SlideDeckConfig;
import io.micrometer.core.annotation.Timed;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import javax.imageio.ImageIO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

/**
 * Converts the .pptx to PDF with a headless LibreOffice process, then rasterizes every PDF page to
 * {@code slide-<n>.png} with PDFBox.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LibreOfficePreviewRenderer implements PreviewRenderer {

  static final String IMAGE_PREFIX = "slide-";
  static final String IMAGE_SUFFIX = ".png";

  private final SlideDeckConfig config;

  @Override
  @Timed(value = "presentation.preview", description = "Time to render slide previews")
  public List<Path> render(Path presentationFile, Path outputDirectory) {
    SlideDeckConfig.Preview settings = config.getPreview();
    if (!settings.isEnabled()) {
      log.debug("Preview rendering disabled, skipping {}", presentationFile);
      return List.of();
    }

    try {
      Files.createDirectories(outputDirectory);
      deleteOldImages(outputDirectory);

      Path pdf = convertToPdf(presentationFile, outputDirectory, settings);
      if (pdf == null) {
        return List.of();
      }
      List<Path> images = rasterize(pdf, outputDirectory, settings.getDpi());
      Files.deleteIfExists(pdf);
      log.info("Rendered {} slide images to {}", images.size(), outputDirectory);
      return images;
    } catch (IOException e) {
      log.error("Preview rendering failed for {}: {}", presentationFile, e.getMessage());
      return List.of();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Preview rendering interrupted for {}", presentationFile);
      return List.of();
    }
  }

  private Path convertToPdf(
      Path presentationFile, Path outputDirectory, SlideDeckConfig.Preview settings)
      throws IOException, InterruptedException {
    Path processLog = Files.createTempFile(outputDirectory, "convert-", ".log");
    try {
      Process process =
          new ProcessBuilder(
                  settings.getCommand(),
                  "--headless",
                  "--convert-to",
                  "pdf",
                  "--outdir",
                  outputDirectory.toString(),
                  presentationFile.toString())
              .redirectErrorStream(true)
              .redirectOutput(processLog.toFile())
              .start();

      if (!process.waitFor(settings.getTimeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        log.error(
            "{} did not finish within {}s, giving up on previews",
            settings.getCommand(),
            settings.getTimeoutSeconds());
        return null;
      }
      if (process.exitValue() != 0) {
        log.error(
            "{} exited with code {}: {}",
            settings.getCommand(),
            process.exitValue(),
            Files.readString(processLog, StandardCharsets.UTF_8).strip());
        return null;
      }
    } finally {
      Files.deleteIfExists(processLog);
    }

    Path pdf = outputDirectory.resolve(stem(presentationFile) + ".pdf");
    if (!Files.exists(pdf)) {
      log.error("{} did not produce {}", settings.getCommand(), pdf);
      return null;
    }
    return pdf;
  }

  static List<Path> rasterize(Path pdf, Path outputDirectory, float dpi) throws IOException {
    List<Path> images = new ArrayList<>();
    try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
      PDFRenderer renderer = new PDFRenderer(document);
      for (int page = 0; page < document.getNumberOfPages(); page++) {
        BufferedImage image = renderer.renderImageWithDPI(page, dpi);
        Path target = outputDirectory.resolve(IMAGE_PREFIX + (page + 1) + IMAGE_SUFFIX);
        ImageIO.write(image, "png", target.toFile());
        images.add(target);
      }
    }
    return images;
  }

  private static void deleteOldImages(Path outputDirectory) throws IOException {
    try (DirectoryStream<Path> stale =
        Files.newDirectoryStream(outputDirectory, IMAGE_PREFIX + "*" + IMAGE_SUFFIX)) {
      for (Path image : stale) {
        Files.deleteIfExists(image);
      }
    }
  }

  private static String stem(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
