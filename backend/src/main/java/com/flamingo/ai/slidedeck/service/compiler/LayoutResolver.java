package com.flamingo.ai.slidedeck.service.compiler;

import com.flamingo.ai.slidedeck.domain.enums.LayoutType;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps an IR {@link LayoutType} onto one of the base document's layouts.
 *
 * <p>Preferred names are tried in priority order, each against the layouts in document order.
 * Without a match the layout at {@link #FALLBACK_LAYOUT_INDEX} is used (the blank layout of the
 * stock Office template), and when the document has fewer layouts than that, the last one.
 */
@Component
@Slf4j
public class LayoutResolver {

  static final int FALLBACK_LAYOUT_INDEX = 6;

  /**
   * Resolves the layout index for a slide.
   *
   * @param layoutType requested layout category
   * @param layoutNames names of the available layouts in document order; entries may be null
   * @return index into {@code layoutNames}
   * @throws IllegalArgumentException if no layouts are available
   */
  public int resolve(LayoutType layoutType, List<String> layoutNames) {
    if (layoutNames.isEmpty()) {
      throw new IllegalArgumentException("Base document has no slide layouts");
    }
    for (String preferred : layoutType.getPreferredLayoutNames()) {
      int index = layoutNames.indexOf(preferred);
      if (index >= 0) {
        return index;
      }
    }
    int fallback =
        FALLBACK_LAYOUT_INDEX < layoutNames.size()
            ? FALLBACK_LAYOUT_INDEX
            : layoutNames.size() - 1;
    log.debug(
        "No layout named {} for '{}', falling back to index {}",
        layoutType.getPreferredLayoutNames(),
        layoutType.getValue(),
        fallback);
    return fallback;
  }
}
