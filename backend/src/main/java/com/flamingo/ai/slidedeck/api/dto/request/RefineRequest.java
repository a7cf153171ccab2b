package com.flamingo.ai.slidedeck.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for refining a presentation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefineRequest {

  @NotBlank(message = "Instruction is required")
  @Size(min = 3, max = 2000, message = "Instruction must be between 3 and 2000 characters")
  private String instruction;
}
