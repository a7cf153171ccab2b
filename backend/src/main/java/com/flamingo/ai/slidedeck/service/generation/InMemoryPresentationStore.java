package com.flamingo.ai.slidedeck.service.generation;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Process-local store; contents are lost on restart. */
@Component
public class InMemoryPresentationStore implements PresentationStore {

  private final Map<String, StoredPresentation> presentations = new ConcurrentHashMap<>();

  @Override
  public void save(StoredPresentation presentation) {
    presentations.put(presentation.id(), presentation);
  }

  @Override
  public Optional<StoredPresentation> find(String presentationId) {
    return Optional.ofNullable(presentations.get(presentationId));
  }
}
