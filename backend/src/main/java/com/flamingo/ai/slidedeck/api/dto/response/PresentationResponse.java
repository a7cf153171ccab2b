package com.flamingo.ai.slidedeck.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.slidedeck.domain.enums.GenerationMode;
import com.flamingo.ai.slidedeck.domain.ir.DesignTokens;
import com.flamingo.ai.slidedeck.domain.ir.Presentation;
import com.flamingo.ai.slidedeck.service.generation.StoredPresentation;
import java.util.List;
import java.util.stream.IntStream;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a generated presentation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresentationResponse {

  @JsonProperty("presentation_id")
  private String presentationId;

  @JsonProperty("presentation")
  private Presentation presentation;

  @JsonProperty("download_url")
  private String downloadUrl;

  @JsonProperty("preview_urls")
  private List<String> previewUrls;

  @JsonProperty("generation_mode")
  private GenerationMode generationMode;

  @JsonProperty("design_tokens")
  private DesignTokens designTokens;

  /** Creates a PresentationResponse from a stored presentation. */
  public static PresentationResponse fromStored(StoredPresentation stored) {
    return PresentationResponse.builder()
        .presentationId(stored.id())
        .presentation(stored.presentation())
        .downloadUrl(downloadUrl(stored.id()))
        .previewUrls(previewUrls(stored))
        .generationMode(stored.generationMode())
        .designTokens(stored.designTokens())
        .build();
  }

  static String downloadUrl(String presentationId) {
    return "/api/download/" + presentationId;
  }

  static List<String> previewUrls(StoredPresentation stored) {
    return IntStream.range(0, stored.previewPaths().size())
        .mapToObj(index -> "/api/preview/" + stored.id() + "/" + index)
        .toList();
  }
}
