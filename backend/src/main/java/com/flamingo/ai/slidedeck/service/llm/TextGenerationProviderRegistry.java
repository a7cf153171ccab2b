package com.flamingo.ai.slidedeck.service.llm;

import com.flamingo.ai.slidedeck.config.SlideDeckConfig;
import com.flamingo.ai.slidedeck.domain.enums.LlmProvider;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resolves the configured provider and builds its model on first use. Configuration errors surface
 * on the first generation call, not at startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TextGenerationProviderRegistry {

  private final SlideDeckConfig config;
  private final ChatModelFactory chatModelFactory;
  private final Map<LlmProvider, TextGenerationProvider> providers = new ConcurrentHashMap<>();

  /** The provider named by {@code slidedeck.llm.provider}. */
  public TextGenerationProvider active() {
    return get(LlmProvider.fromConfig(config.getLlm().getProvider()));
  }

  public TextGenerationProvider get(LlmProvider provider) {
    return providers.computeIfAbsent(
        provider,
        key -> {
          log.info("Initializing {} chat model", key.getValue());
          return new AgentTextGenerationProvider(key, chatModelFactory.create(key));
        });
  }
}
