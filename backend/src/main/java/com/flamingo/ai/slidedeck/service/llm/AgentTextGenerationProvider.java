package com.flamingo.ai.slidedeck.service.llm;

import com.flamingo.ai.slidedeck.agent.TextGenerationAgent;
import com.flamingo.ai.slidedeck.domain.enums.LlmProvider;
import com.flamingo.ai.slidedeck.exception.LlmServiceException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.slf4j.Slf4j;

/** {@link TextGenerationProvider} backed by a LangChain4j AI service over one chat model. */
@Slf4j
class AgentTextGenerationProvider implements TextGenerationProvider {

  private static final int LOGGED_PREFIX_CHARS = 500;

  private final LlmProvider provider;
  private final TextGenerationAgent agent;

  AgentTextGenerationProvider(LlmProvider provider, ChatModel chatModel) {
    this(provider, AiServices.builder(TextGenerationAgent.class).chatModel(chatModel).build());
  }

  AgentTextGenerationProvider(LlmProvider provider, TextGenerationAgent agent) {
    this.provider = provider;
    this.agent = agent;
  }

  @Override
  public LlmProvider provider() {
    return provider;
  }

  @Override
  public String generate(String systemPrompt, String userMessage) {
    log.info("Calling {} with message ({} chars)", provider.getValue(), userMessage.length());
    String text = agent.generate(systemPrompt, userMessage);
    if (text == null || text.isBlank()) {
      throw new LlmServiceException("Empty response from " + provider.getValue());
    }
    log.debug(
        "Raw {} response: {}",
        provider.getValue(),
        text.substring(0, Math.min(text.length(), LOGGED_PREFIX_CHARS)));
    return text;
  }
}
