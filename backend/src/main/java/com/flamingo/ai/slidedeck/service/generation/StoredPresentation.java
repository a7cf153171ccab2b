package com.flamingo.ai.slidedeck.service.generation;

import com.flamingo.ai.slidedeck.domain.enums.GenerationMode;
import com.flamingo.ai.slidedeck.domain.ir.DesignTokens;
import com.flamingo.ai.slidedeck.domain.ir.Presentation;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * A generated presentation with its files on disk.
 *
 * @param designTokens tokens of the uploaded file, null when generated from scratch
 * @param templatePath base document reused on every rebuild, null for a blank document
 * @param previewPaths slide images in slide order, empty when previews are unavailable
 */
@Builder(toBuilder = true)
public record StoredPresentation(
    String id,
    Presentation presentation,
    GenerationMode generationMode,
    DesignTokens designTokens,
    Path pptxPath,
    Path templatePath,
    List<Path> previewPaths,
    Instant updatedAt) {

  public StoredPresentation {
    previewPaths = previewPaths == null ? List.of() : List.copyOf(previewPaths);
  }
}
