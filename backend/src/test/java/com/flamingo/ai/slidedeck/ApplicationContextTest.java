package com.flamingo.ai.slidedeck;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.slidedeck.service.compiler.DocumentCompiler;
import com.flamingo.ai.slidedeck.service.extractor.StyleExtractor;
import com.flamingo.ai.slidedeck.service.generation.GenerationService;
import com.flamingo.ai.slidedeck.service.llm.ChatModelFactory;
import com.flamingo.ai.slidedeck.service.llm.LlmGateway;
import com.flamingo.ai.slidedeck.service.preview.PreviewRenderer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Verifies the Spring application context loads. The chat model factory is mocked so no provider
 * is contacted.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ApplicationContextTest {

  @MockitoBean private ChatModelFactory chatModelFactory;

  @Autowired private ApplicationContext applicationContext;

  @Autowired private MockMvc mockMvc;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(GenerationService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentCompiler.class)).isNotNull();
    assertThat(applicationContext.getBean(StyleExtractor.class)).isNotNull();
    assertThat(applicationContext.getBean(PreviewRenderer.class)).isNotNull();
    assertThat(applicationContext.getBean(LlmGateway.class)).isNotNull();
  }

  @Test
  @DisplayName("Browser preflight requests to the API are allowed from any origin")
  void apiShouldAllowCrossOriginRequests() throws Exception {
    mockMvc
        .perform(
            options("/api/presentations/abc")
                .header(HttpHeaders.ORIGIN, "http://localhost:3000")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
        .andExpect(status().isOk())
        .andExpect(
            header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:3000"))
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true"));
  }
}
