package com.flamingo.ai.slidedeck.domain.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import lombok.Builder;

/**
 * Root of the intermediate representation. Immutable: refinement builds a new instance rather than
 * editing this one.
 */
@Builder(toBuilder = true)
public record Presentation(
    @JsonProperty("title") @NotBlank(message = "must not be blank") String title,
    @JsonProperty("subtitle") String subtitle,
    @JsonProperty("author") String author,
    @JsonProperty("theme") @Valid ThemeSettings theme,
    @JsonProperty("slides") @Valid List<Slide> slides) {

  public static final String DEFAULT_AUTHOR = "SlideDeck AI";

  public Presentation {
    subtitle = subtitle == null ? "" : subtitle;
    author = author == null ? DEFAULT_AUTHOR : author;
    theme = theme == null ? ThemeSettings.defaults() : theme;
    slides = slides == null ? List.of() : List.copyOf(slides);
  }
}
