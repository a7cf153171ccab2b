package com.flamingo.ai.slidedeck.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.slidedeck.domain.ir.Presentation;
import com.flamingo.ai.slidedeck.service.generation.StoredPresentation;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a refined presentation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefineResponse {

  @JsonProperty("presentation_id")
  private String presentationId;

  @JsonProperty("presentation")
  private Presentation presentation;

  @JsonProperty("download_url")
  private String downloadUrl;

  @JsonProperty("preview_urls")
  private List<String> previewUrls;

  /** Creates a RefineResponse from a stored presentation. */
  public static RefineResponse fromStored(StoredPresentation stored) {
    return RefineResponse.builder()
        .presentationId(stored.id())
        .presentation(stored.presentation())
        .downloadUrl(PresentationResponse.downloadUrl(stored.id()))
        .previewUrls(PresentationResponse.previewUrls(stored))
        .build();
  }
}
