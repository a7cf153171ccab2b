package com.flamingo.ai.slidedeck.service.llm;

import com.flamingo.ai.slidedeck.exception.LlmConfigurationException;
import com.flamingo.ai.slidedeck.exception.LlmServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Calls the active text-generation provider under retry and circuit-breaker protection. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmGateway {

  private final TextGenerationProviderRegistry providerRegistry;
  private final MeterRegistry meterRegistry;

  @CircuitBreaker(name = "llm", fallbackMethod = "generateFallback")
  @Retry(name = "llm")
  public String generate(String systemPrompt, String userMessage) {
    TextGenerationProvider provider = providerRegistry.active();
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      String text = provider.generate(systemPrompt, userMessage);
      meterRegistry
          .counter("llm.requests.success", "provider", provider.provider().getValue())
          .increment();
      return text;
    } finally {
      sample.stop(meterRegistry.timer("llm.duration"));
    }
  }

  @SuppressWarnings("unused")
  private String generateFallback(String systemPrompt, String userMessage, Throwable t) {
    if (t instanceof LlmConfigurationException configurationException) {
      throw configurationException;
    }
    meterRegistry.counter("llm.requests.failure").increment();
    if (t instanceof LlmServiceException serviceException) {
      throw serviceException;
    }
    boolean rateLimited = isRateLimited(t);
    log.error("Text generation failed (rate limited: {}): {}", rateLimited, t.getMessage());
    throw new LlmServiceException("Text generation failed: " + t.getMessage(), rateLimited, t);
  }

  static boolean isRateLimited(Throwable t) {
    for (Throwable current = t; current != null; current = current.getCause()) {
      String message = current.getMessage();
      if (message != null) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("429") || lower.contains("rate limit") || lower.contains("quota")) {
          return true;
        }
      }
    }
    return false;
  }
}
