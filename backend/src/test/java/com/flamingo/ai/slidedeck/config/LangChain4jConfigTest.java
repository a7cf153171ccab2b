package com.flamingo.ai.slidedeck.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.slidedeck.domain.enums.LlmProvider;
import com.flamingo.ai.slidedeck.exception.LlmConfigurationException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LangChain4jConfigTest {

  private SlideDeckConfig config;
  private LangChain4jConfig langChain4jConfig;

  @BeforeEach
  void setUp() {
    config = new SlideDeckConfig();
    langChain4jConfig = new LangChain4jConfig(config);
  }

  @Test
  void shouldBuildGeminiModel() {
    config.getLlm().getGemini().setApiKey("gemini-key");

    assertThat(langChain4jConfig.chatModelFactory().create(LlmProvider.GEMINI))
        .isInstanceOf(GoogleAiGeminiChatModel.class);
  }

  @Test
  @DisplayName("Gemini is asked for JSON output")
  void shouldRequestJsonFromGemini() {
    config.getLlm().getGemini().setApiKey("gemini-key");

    ChatModel model = langChain4jConfig.createChatModel(LlmProvider.GEMINI);

    assertThat(model.defaultRequestParameters().responseFormat()).isEqualTo(ResponseFormat.JSON);
  }

  @Test
  void shouldBuildOpenAiModel() {
    config.getLlm().getOpenai().setApiKey("openai-key");

    assertThat(langChain4jConfig.createChatModel(LlmProvider.OPENAI))
        .isInstanceOf(OpenAiChatModel.class);
  }

  @Test
  void shouldBuildAnthropicModel() {
    config.getLlm().getAnthropic().setApiKey("anthropic-key");

    assertThat(langChain4jConfig.createChatModel(LlmProvider.CLAUDE))
        .isInstanceOf(AnthropicChatModel.class);
  }

  @Test
  @DisplayName("a missing key names the environment variable to set")
  void shouldRejectMissingApiKey() {
    config.getLlm().getGemini().setApiKey("  ");

    assertThatThrownBy(() -> langChain4jConfig.createChatModel(LlmProvider.GEMINI))
        .isInstanceOf(LlmConfigurationException.class)
        .hasMessage("Gemini API key is required. Set GEMINI_API_KEY environment variable.");
  }

  @Test
  void shouldOnlyValidateTheRequestedProvider() {
    config.getLlm().getAnthropic().setApiKey("anthropic-key");

    assertThat(langChain4jConfig.createChatModel(LlmProvider.CLAUDE)).isNotNull();
    assertThatThrownBy(() -> langChain4jConfig.createChatModel(LlmProvider.OPENAI))
        .isInstanceOf(LlmConfigurationException.class)
        .hasMessageContaining("OPENAI_API_KEY");
  }
}
