package com.flamingo.ai.slidedeck.service.llm;

import com.flamingo.ai.slidedeck.domain.enums.LlmProvider;
import dev.langchain4j.model.chat.ChatModel;

/** Builds the LangChain4j chat model for a provider. */
@FunctionalInterface
public interface ChatModelFactory {

  /**
   * @throws com.flamingo.ai.slidedeck.exception.LlmConfigurationException if the provider's API
   *     key is not configured
   */
  ChatModel create(LlmProvider provider);
}
