package com.flamingo.ai.slidedeck.config;

import com.flamingo.ai.slidedeck.domain.enums.LlmProvider;
import com.flamingo.ai.slidedeck.exception.LlmConfigurationException;
import com.flamingo.ai.slidedeck.service.llm.ChatModelFactory;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for LangChain4j chat models, one per supported provider. */
@Configuration
@RequiredArgsConstructor
public class LangChain4jConfig {

  private final SlideDeckConfig config;

  @Bean
  public ChatModelFactory chatModelFactory() {
    return this::createChatModel;
  }

  ChatModel createChatModel(LlmProvider provider) {
    return switch (provider) {
      case GEMINI -> geminiChatModel(config.getLlm());
      case OPENAI -> openAiChatModel(config.getLlm());
      case CLAUDE -> anthropicChatModel(config.getLlm());
    };
  }

  private static ChatModel geminiChatModel(SlideDeckConfig.Llm llm) {
    SlideDeckConfig.Llm.Gemini gemini = llm.getGemini();
    validateApiKey(gemini.getApiKey(), "Gemini", "GEMINI_API_KEY");

    return GoogleAiGeminiChatModel.builder()
        .apiKey(gemini.getApiKey())
        .modelName(gemini.getModelName())
        .temperature(llm.getTemperature())
        .timeout(Duration.ofSeconds(gemini.getTimeoutSeconds()))
        .responseFormat(ResponseFormat.JSON)
        .build();
  }

  private static ChatModel openAiChatModel(SlideDeckConfig.Llm llm) {
    SlideDeckConfig.Llm.OpenAi openAi = llm.getOpenai();
    validateApiKey(openAi.getApiKey(), "OpenAI", "OPENAI_API_KEY");

    return OpenAiChatModel.builder()
        .apiKey(openAi.getApiKey())
        .modelName(openAi.getModelName())
        .temperature(llm.getTemperature())
        .timeout(Duration.ofSeconds(openAi.getTimeoutSeconds()))
        .responseFormat("json_object")
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private static ChatModel anthropicChatModel(SlideDeckConfig.Llm llm) {
    SlideDeckConfig.Llm.Anthropic anthropic = llm.getAnthropic();
    validateApiKey(anthropic.getApiKey(), "Anthropic", "ANTHROPIC_API_KEY");

    return AnthropicChatModel.builder()
        .apiKey(anthropic.getApiKey())
        .modelName(anthropic.getModelName())
        .temperature(llm.getTemperature())
        .maxTokens(anthropic.getMaxTokens())
        .timeout(Duration.ofSeconds(anthropic.getTimeoutSeconds()))
        .build();
  }

  private static void validateApiKey(String apiKey, String providerName, String envVariable) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new LlmConfigurationException(
          providerName + " API key is required. Set " + envVariable + " environment variable.");
    }
  }
}
