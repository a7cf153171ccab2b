package com.flamingo.ai.slidedeck.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.slidedeck.api.rest.HealthController;
import com.flamingo.ai.slidedeck.api.rest.PresentationController;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests pinning the public endpoint paths:
 *
 * <ul>
 *   <li>POST /api/generate - Generate a presentation (multipart)
 *   <li>POST /api/refine/{id} - Refine a presentation
 *   <li>GET /api/presentations/{id} - Get a presentation
 *   <li>GET /api/download/{id} - Download the .pptx
 *   <li>GET /api/preview/{id}/{index} - Slide preview image
 *   <li>POST /api/extract - Extract design tokens
 *   <li>GET /health - Health check
 * </ul>
 */
class ApiContractTest {

  private static List<String> postPaths(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map(method -> method.getAnnotation(PostMapping.class))
        .filter(Objects::nonNull)
        .flatMap(mapping -> Arrays.stream(mapping.value()))
        .toList();
  }

  private static List<String> getPaths(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map(method -> method.getAnnotation(GetMapping.class))
        .filter(Objects::nonNull)
        .flatMap(mapping -> Arrays.stream(mapping.value()))
        .toList();
  }

  @Nested
  @DisplayName("PresentationController API contract")
  class PresentationControllerContract {

    @Test
    @DisplayName("should be mapped under /api prefix")
    void shouldBeMappedUnderApiPrefix() {
      RequestMapping mapping = PresentationController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
    }

    @Test
    @DisplayName("should expose generate, refine and extract as POST")
    void shouldExposePostEndpoints() {
      assertThat(postPaths(PresentationController.class))
          .containsExactlyInAnyOrder("/generate", "/refine/{presentationId}", "/extract");
    }

    @Test
    @DisplayName("should expose presentation, download and preview as GET")
    void shouldExposeGetEndpoints() {
      assertThat(getPaths(PresentationController.class))
          .containsExactlyInAnyOrder(
              "/presentations/{presentationId}",
              "/download/{presentationId}",
              "/preview/{presentationId}/{slideIndex}");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
