package com.flamingo.ai.slidedeck.service.preview;

import java.nio.file.Path;
import java.util.List;

/** Renders a presentation file to one image per slide. Best effort: never throws. */
public interface PreviewRenderer {

  /**
   * @param presentationFile the .pptx to render
   * @param outputDirectory where the images go; created if missing
   * @return image paths in slide order, or an empty list when rendering is unavailable or fails
   */
  List<Path> render(Path presentationFile, Path outputDirectory);
}
