package com.flamingo.ai.slidedeck.service.generation;

import com.flamingo.ai.slidedeck.config.SlideDeckConfig;
import com.flamingo.ai.slidedeck.domain.enums.GenerationMode;
import com.flamingo.ai.slidedeck.domain.ir.DesignTokens;
import com.flamingo.ai.slidedeck.domain.ir.Presentation;
import com.flamingo.ai.slidedeck.exception.FieldViolation;
import com.flamingo.ai.slidedeck.exception.PresentationBuildException;
import com.flamingo.ai.slidedeck.exception.PresentationNotFoundException;
import com.flamingo.ai.slidedeck.exception.PresentationValidationException;
import com.flamingo.ai.slidedeck.service.compiler.DocumentCompiler;
import com.flamingo.ai.slidedeck.service.extractor.StyleExtractor;
import com.flamingo.ai.slidedeck.service.ir.PresentationResponseParser;
import com.flamingo.ai.slidedeck.service.llm.LlmGateway;
import com.flamingo.ai.slidedeck.service.llm.PresentationPrompts;
import com.flamingo.ai.slidedeck.service.llm.PromptBuilder;
import com.flamingo.ai.slidedeck.service.preview.PreviewRenderer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the GenerationService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class GenerationServiceImpl implements GenerationService {

  static final String UPLOAD_FILE_NAME = "upload.pptx";
  static final String PREVIEW_DIRECTORY = "previews";
  private static final String PPTX_EXTENSION = ".pptx";

  private final SlideDeckConfig config;
  private final LlmGateway llmGateway;
  private final PromptBuilder promptBuilder;
  private final PresentationResponseParser responseParser;
  private final DocumentCompiler documentCompiler;
  private final StyleExtractor styleExtractor;
  private final PreviewRenderer previewRenderer;
  private final PresentationStore presentationStore;
  private final MeterRegistry meterRegistry;

  private final Map<String, BuildLock> buildLocks = new ConcurrentHashMap<>();

  @Override
  @Timed(value = "presentation.generate", description = "Time to generate a presentation")
  public StoredPresentation generate(
      String prompt, Integer numSlides, GenerationMode mode, MultipartFile file) {
    GenerationMode generationMode = mode == null ? GenerationMode.FROM_SCRATCH : mode;
    String presentationId = UUID.randomUUID().toString();
    Path workDirectory = workDirectory(presentationId);
    log.info(
        "Generating presentation {} (mode: {}, slides: {})",
        presentationId,
        generationMode.getValue(),
        numSlides != null ? numSlides : "auto");

    DesignTokens designTokens = null;
    Path templatePath = null;
    if (generationMode.usesUploadedFile()) {
      Path upload = saveUpload(file, workDirectory.resolve(UPLOAD_FILE_NAME));
      designTokens = styleExtractor.extract(upload);
      if (generationMode == GenerationMode.TEMPLATE) {
        templatePath = upload;
      }
    } else if (file != null && !file.isEmpty()) {
      log.debug("Ignoring uploaded file {} in from_scratch mode", file.getOriginalFilename());
    }

    String userMessage = promptBuilder.generationMessage(prompt, numSlides, designTokens);
    String rawText = llmGateway.generate(PresentationPrompts.GENERATION_SYSTEM_PROMPT, userMessage);
    Presentation presentation = responseParser.parse(rawText);

    StoredPresentation stored =
        StoredPresentation.builder()
            .id(presentationId)
            .generationMode(generationMode)
            .designTokens(designTokens)
            .pptxPath(workDirectory.resolve(presentationId + PPTX_EXTENSION))
            .templatePath(templatePath)
            .build();
    StoredPresentation built = build(stored, presentation);
    meterRegistry.counter("presentation.generated", "mode", generationMode.getValue()).increment();
    return built;
  }

  @Override
  @Timed(value = "presentation.refine", description = "Time to refine a presentation")
  public StoredPresentation refine(String presentationId, String instruction) {
    StoredPresentation current = getPresentation(presentationId);
    log.info("Refining presentation {}", presentationId);

    String userMessage = promptBuilder.refinementMessage(current.presentation(), instruction);
    String rawText = llmGateway.generate(PresentationPrompts.REFINEMENT_SYSTEM_PROMPT, userMessage);
    Presentation refined = responseParser.parse(rawText);

    StoredPresentation built = build(current, refined);
    meterRegistry.counter("presentation.refined").increment();
    return built;
  }

  @Override
  public StoredPresentation getPresentation(String presentationId) {
    return presentationStore
        .find(presentationId)
        .orElseThrow(() -> new PresentationNotFoundException(presentationId));
  }

  @Override
  public Path getPresentationFile(String presentationId) {
    Path pptx = getPresentation(presentationId).pptxPath();
    if (!Files.exists(pptx)) {
      log.warn("Presentation file missing on disk: {}", pptx);
      throw new PresentationNotFoundException(presentationId, "File not found on disk: " + pptx);
    }
    return pptx;
  }

  @Override
  public Path getPreviewImage(String presentationId, int slideIndex) {
    List<Path> previews = getPresentation(presentationId).previewPaths();
    if (slideIndex < 0 || slideIndex >= previews.size()) {
      throw new PresentationNotFoundException(
          presentationId, "Slide preview not found: " + presentationId + "/" + slideIndex);
    }
    Path image = previews.get(slideIndex);
    if (!Files.exists(image)) {
      throw new PresentationNotFoundException(
          presentationId, "Preview image not found on disk: " + image);
    }
    return image;
  }

  @Override
  @Timed(value = "presentation.extractTokens", description = "Time to extract uploaded tokens")
  public DesignTokens extractDesignTokens(MultipartFile file) {
    Path upload = null;
    try {
      Files.createDirectories(Path.of(config.getOutputDir()));
      upload = Files.createTempFile(Path.of(config.getOutputDir()), "extract-", PPTX_EXTENSION);
      saveUpload(file, upload);
      return styleExtractor.extract(upload);
    } catch (IOException e) {
      throw new PresentationBuildException(
          upload, "Cannot stage uploaded file: " + e.getMessage(), e);
    } finally {
      if (upload != null) {
        deleteQuietly(upload);
      }
    }
  }

  /** Compiles, renders previews and stores; builds of the same id are serialized. */
  private StoredPresentation build(StoredPresentation target, Presentation presentation) {
    BuildLock buildLock = acquireBuildLock(target.id());
    try {
      Path pptx =
          documentCompiler.compile(presentation, target.pptxPath(), target.templatePath());
      List<Path> previews =
          previewRenderer.render(pptx, pptx.resolveSibling(PREVIEW_DIRECTORY));
      StoredPresentation stored =
          target.toBuilder()
              .presentation(presentation)
              .previewPaths(previews)
              .updatedAt(Instant.now())
              .build();
      presentationStore.save(stored);
      log.info(
          "Presentation {} built: {} slides, {} previews",
          target.id(),
          presentation.slides().size(),
          previews.size());
      return stored;
    } finally {
      releaseBuildLock(target.id(), buildLock);
    }
  }

  private BuildLock acquireBuildLock(String id) {
    BuildLock buildLock =
        buildLocks.compute(
            id,
            (key, existing) -> {
              BuildLock entry = existing == null ? new BuildLock() : existing;
              entry.holders++;
              return entry;
            });
    buildLock.lock.lock();
    return buildLock;
  }

  /** Unlocks and drops the entry once no build of this id holds or waits for it. */
  private void releaseBuildLock(String id, BuildLock buildLock) {
    buildLock.lock.unlock();
    buildLocks.computeIfPresent(id, (key, entry) -> --entry.holders == 0 ? null : entry);
  }

  int buildLockCount() {
    return buildLocks.size();
  }

  /** Per-id lock; {@code holders} is only touched inside the map's per-key compute. */
  private static final class BuildLock {
    private final ReentrantLock lock = new ReentrantLock();
    private int holders;
  }

  private Path saveUpload(MultipartFile file, Path destination) {
    validateUpload(file);
    try {
      Files.createDirectories(destination.getParent());
      try (InputStream in = file.getInputStream()) {
        Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
      }
      log.debug("Saved upload {} to {}", file.getOriginalFilename(), destination);
      return destination;
    } catch (IOException e) {
      throw new PresentationBuildException(
          destination, "Cannot save uploaded file: " + e.getMessage(), e);
    }
  }

  private static void validateUpload(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new PresentationValidationException(
          List.of(new FieldViolation("file", "a .pptx file is required for this mode")));
    }
    String name = file.getOriginalFilename();
    if (name == null || !name.toLowerCase(Locale.ROOT).endsWith(PPTX_EXTENSION)) {
      throw new PresentationValidationException(
          List.of(new FieldViolation("file", "must be a .pptx file")));
    }
  }

  private Path workDirectory(String presentationId) {
    return Path.of(config.getOutputDir()).resolve(presentationId);
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Could not delete staged upload {}: {}", file, e.getMessage());
    }
  }
}
