package com.flamingo.ai.slidedeck.service.llm;

import com.flamingo.ai.slidedeck.domain.enums.LlmProvider;

/** A text-generation backend: system prompt and user message in, raw model text out. */
public interface TextGenerationProvider {

  LlmProvider provider();

  String generate(String systemPrompt, String userMessage);
}
