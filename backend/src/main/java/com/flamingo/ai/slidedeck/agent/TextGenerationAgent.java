package com.flamingo.ai.slidedeck.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent for single-turn text generation. The caller supplies both the system prompt and the
 * user message; the agent returns the raw model text.
 */
public interface TextGenerationAgent {

  @SystemMessage("{{systemPrompt}}")
  @UserMessage("{{userMessage}}")
  String generate(@V("systemPrompt") String systemPrompt, @V("userMessage") String userMessage);
}
