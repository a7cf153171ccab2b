package com.flamingo.ai.slidedeck.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Web MVC configuration: cross-origin access for the browser frontend. */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final SlideDeckConfig slideDeckConfig;

  /**
   * Opens the REST API to the configured origins.
   *
   * <p>Uses origin patterns: a plain {@code *} origin cannot be combined with credentials.
   */
  @Override
  public void addCorsMappings(CorsRegistry registry) {
    SlideDeckConfig.Cors cors = slideDeckConfig.getCors();
    registry
        .addMapping("/api/**")
        .allowedOriginPatterns(cors.getAllowedOriginPatterns().toArray(String[]::new))
        .allowedMethods("*")
        .allowedHeaders("*")
        .allowCredentials(true)
        .maxAge(cors.getMaxAgeSeconds());
  }
}
