package com.flamingo.ai.slidedeck.api.rest;

import com.flamingo.ai.slidedeck.api.dto.request.GenerateRequest;
import com.flamingo.ai.slidedeck.api.dto.request.RefineRequest;
import com.flamingo.ai.slidedeck.api.dto.response.PresentationResponse;
import com.flamingo.ai.slidedeck.api.dto.response.RefineResponse;
import com.flamingo.ai.slidedeck.domain.enums.GenerationMode;
import com.flamingo.ai.slidedeck.domain.ir.DesignTokens;
import com.flamingo.ai.slidedeck.service.generation.GenerationService;
import com.flamingo.ai.slidedeck.service.generation.StoredPresentation;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Valid;
import jakarta.validation.Validator;
import java.nio.file.Path;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for generating, refining and downloading presentations. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PresentationController {

  static final MediaType PPTX_MEDIA_TYPE =
      MediaType.parseMediaType(
          "application/vnd.openxmlformats-officedocument.presentationml.presentation");

  private final GenerationService generationService;
  private final Validator validator;

  /** Generates a presentation from a prompt and an optional uploaded .pptx. */
  @PostMapping(value = "/generate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<PresentationResponse> generate(
      @RequestParam("prompt") String prompt,
      @RequestParam(value = "num_slides", required = false) Integer numSlides,
      @RequestParam(value = "generation_mode", required = false) String generationMode,
      @RequestParam(value = "file", required = false) MultipartFile file) {
    GenerateRequest request =
        GenerateRequest.builder()
            .prompt(prompt)
            .numSlides(numSlides)
            .generationMode(generationMode)
            .build();
    Set<ConstraintViolation<GenerateRequest>> violations = validator.validate(request);
    if (!violations.isEmpty()) {
      throw new ConstraintViolationException(violations);
    }

    StoredPresentation stored =
        generationService.generate(
            request.getPrompt(),
            request.getNumSlides(),
            GenerationMode.fromValue(request.getGenerationMode()),
            file);
    return ResponseEntity.ok(PresentationResponse.fromStored(stored));
  }

  /** Applies a natural-language instruction to an existing presentation. */
  @PostMapping("/refine/{presentationId}")
  public ResponseEntity<RefineResponse> refine(
      @PathVariable String presentationId, @Valid @RequestBody RefineRequest request) {
    StoredPresentation stored = generationService.refine(presentationId, request.getInstruction());
    return ResponseEntity.ok(RefineResponse.fromStored(stored));
  }

  /** Gets a stored presentation with its design tokens. */
  @GetMapping("/presentations/{presentationId}")
  public ResponseEntity<PresentationResponse> getPresentation(@PathVariable String presentationId) {
    return ResponseEntity.ok(
        PresentationResponse.fromStored(generationService.getPresentation(presentationId)));
  }

  /** Downloads the .pptx file. */
  @GetMapping("/download/{presentationId}")
  public ResponseEntity<Resource> download(@PathVariable String presentationId) {
    Path pptx = generationService.getPresentationFile(presentationId);
    String shortId = presentationId.substring(0, Math.min(8, presentationId.length()));
    String fileName = "presentation-" + shortId + ".pptx";
    return ResponseEntity.ok()
        .contentType(PPTX_MEDIA_TYPE)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(fileName).build().toString())
        .body(new FileSystemResource(pptx));
  }

  /** Serves the PNG preview of one slide (zero-based index). */
  @GetMapping("/preview/{presentationId}/{slideIndex}")
  public ResponseEntity<Resource> preview(
      @PathVariable String presentationId, @PathVariable int slideIndex) {
    Path image = generationService.getPreviewImage(presentationId, slideIndex);
    return ResponseEntity.ok()
        .contentType(MediaType.IMAGE_PNG)
        .body(new FileSystemResource(image));
  }

  /** Extracts design tokens from an uploaded .pptx. */
  @PostMapping(value = "/extract", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DesignTokens> extract(@RequestParam("file") MultipartFile file) {
    return ResponseEntity.ok(generationService.extractDesignTokens(file));
  }
}
