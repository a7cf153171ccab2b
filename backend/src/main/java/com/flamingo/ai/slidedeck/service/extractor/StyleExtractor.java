package com.flamingo.ai.slidedeck.service.extractor;

import com.flamingo.ai.slidedeck.domain.ir.DesignTokens;
import java.nio.file.Path;

/** Recovers design tokens from an existing presentation file. */
public interface StyleExtractor {

  /**
   * Extracts colors, fonts and layout names.
   *
   * @throws com.flamingo.ai.slidedeck.exception.StyleExtractionException if the file cannot be
   *     opened as a presentation
   */
  DesignTokens extract(Path presentationFile);
}
