package com.flamingo.ai.slidedeck.service.generation;

import java.util.Optional;

/** Key-value store of generated presentations, keyed by presentation id. */
public interface PresentationStore {

  void save(StoredPresentation presentation);

  Optional<StoredPresentation> find(String presentationId);
}
