package com.flamingo.ai.slidedeck.service.generation;

import com.flamingo.ai.slidedeck.domain.enums.GenerationMode;
import com.flamingo.ai.slidedeck.domain.ir.DesignTokens;
import java.nio.file.Path;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for generating, refining and serving presentations. */
public interface GenerationService {

  /**
   * Generates a presentation from a prompt and builds its file and previews.
   *
   * @param prompt the user's description
   * @param numSlides exact slide count, or null
   * @param mode how {@code file} is used
   * @param file uploaded .pptx; required unless {@code mode} is from_scratch, ignored otherwise
   * @return the stored presentation
   * @throws com.flamingo.ai.slidedeck.exception.PresentationValidationException if the file is
   *     missing or not a .pptx, or the provider output is invalid
   */
  StoredPresentation generate(
      String prompt, Integer numSlides, GenerationMode mode, MultipartFile file);

  /**
   * Applies an instruction to a stored presentation and rebuilds it at the same path.
   *
   * @throws com.flamingo.ai.slidedeck.exception.PresentationNotFoundException if the id is unknown
   */
  StoredPresentation refine(String presentationId, String instruction);

  /**
   * @throws com.flamingo.ai.slidedeck.exception.PresentationNotFoundException if the id is unknown
   */
  StoredPresentation getPresentation(String presentationId);

  /**
   * Path of the built .pptx.
   *
   * @throws com.flamingo.ai.slidedeck.exception.PresentationNotFoundException if the id is unknown
   *     or the file is gone
   */
  Path getPresentationFile(String presentationId);

  /**
   * Path of one slide image.
   *
   * @param slideIndex zero-based slide index
   * @throws com.flamingo.ai.slidedeck.exception.PresentationNotFoundException if the id or index is
   *     unknown
   */
  Path getPreviewImage(String presentationId, int slideIndex);

  /**
   * Extracts design tokens from an uploaded .pptx without generating anything.
   *
   * @throws com.flamingo.ai.slidedeck.exception.StyleExtractionException if the file is not a
   *     readable presentation
   */
  DesignTokens extractDesignTokens(MultipartFile file);
}
