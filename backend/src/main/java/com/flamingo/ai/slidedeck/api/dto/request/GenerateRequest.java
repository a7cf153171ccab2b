package com.flamingo.ai.slidedeck.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for generating a presentation; bound from multipart form fields. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateRequest {

  @NotBlank(message = "Prompt is required")
  @Size(min = 3, max = 5000, message = "Prompt must be between 3 and 5000 characters")
  private String prompt;

  @Min(value = 1, message = "num_slides must be at least 1")
  @Max(value = 30, message = "num_slides must be at most 30")
  private Integer numSlides;

  @Pattern(
      regexp = "from_scratch|template|reference",
      message = "generation_mode must be one of: from_scratch, template, reference")
  private String generationMode;
}
