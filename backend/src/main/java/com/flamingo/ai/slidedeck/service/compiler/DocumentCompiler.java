package com.flamingo.ai.slidedeck.service.compiler;

import com.flamingo.ai.slidedeck.domain.ir.Presentation;
import java.nio.file.Path;

/** Renders a validated presentation into a document file. */
public interface DocumentCompiler {

  /**
   * Builds the document.
   *
   * @param presentation validated IR
   * @param output destination file; replaced if it exists
   * @param template optional base document whose masters and layouts are reused, may be null
   * @return {@code output}
   * @throws com.flamingo.ai.slidedeck.exception.PresentationBuildException if the template cannot
   *     be opened or the file cannot be written
   */
  Path compile(Presentation presentation, Path output, Path template);
}
