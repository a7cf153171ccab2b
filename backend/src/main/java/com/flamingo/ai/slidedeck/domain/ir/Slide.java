package com.flamingo.ai.slidedeck.domain.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.slidedeck.domain.enums.LayoutType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import lombok.Builder;

/** A single slide: layout category, background, ordered elements and speaker notes. */
@Builder(toBuilder = true)
public record Slide(
    @JsonProperty("layout") LayoutType layout,
    @JsonProperty("background_color")
        @Pattern(regexp = HexColor.CANONICAL_REGEX, message = HexColor.INVALID_MESSAGE)
        String backgroundColor,
    @JsonProperty("elements") @Valid List<SlideElement> elements,
    @JsonProperty("speaker_notes") String speakerNotes) {

  public static final String DEFAULT_BACKGROUND_COLOR = "#ffffff";

  public Slide {
    layout = layout == null ? LayoutType.TITLE_CONTENT : layout;
    backgroundColor =
        backgroundColor == null ? DEFAULT_BACKGROUND_COLOR : HexColor.canonical(backgroundColor);
    elements = elements == null ? List.of() : List.copyOf(elements);
    speakerNotes = speakerNotes == null ? "" : speakerNotes;
  }

  public boolean hasSpeakerNotes() {
    return !speakerNotes.isEmpty();
  }
}
