package com.flamingo.ai.slidedeck.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for generation, compilation and previews. */
@Configuration
@ConfigurationProperties(prefix = "slidedeck")
@Getter
@Setter
public class SlideDeckConfig {

  /** Root directory for generated presentations; one sub-directory per presentation id. */
  private String outputDir = "/tmp/slidedeck-ai/output";

  private Llm llm = new Llm();
  private Preview preview = new Preview();
  private Images images = new Images();
  private Cors cors = new Cors();

  /** Text-generation provider selection and credentials. */
  @Getter
  @Setter
  public static class Llm {
    /** Provider name: "gemini" (default), "openai" or "claude". */
    private String provider = "gemini";

    private double temperature = 0.7;

    private Gemini gemini = new Gemini();
    private OpenAi openai = new OpenAi();
    private Anthropic anthropic = new Anthropic();

    @Getter
    @Setter
    public static class Gemini {
      private String apiKey = "";
      private String modelName = "gemini-2.0-flash";
      private int timeoutSeconds = 120;
    }

    @Getter
    @Setter
    public static class OpenAi {
      private String apiKey = "";
      private String modelName = "gpt-4o";
      private int timeoutSeconds = 120;
    }

    @Getter
    @Setter
    public static class Anthropic {
      private String apiKey = "";
      private String modelName = "claude-sonnet-4-20250514";
      private int maxTokens = 8192;
      private int timeoutSeconds = 120;
    }
  }

  /** Slide preview rendering through a headless office suite. */
  @Getter
  @Setter
  public static class Preview {
    private boolean enabled = true;

    /** Executable used for the .pptx to PDF conversion. */
    private String command = "libreoffice";

    private int timeoutSeconds = 60;

    /** Resolution of the rasterized slide images. */
    private float dpi = 200f;
  }

  /** Image download settings for image elements. */
  @Getter
  @Setter
  public static class Images {
    /** Largest image body accepted from a URL. */
    private int maxDownloadBytes = 20 * 1024 * 1024; // 20 MB
  }

  /** Cross-origin access to {@code /api/**}. */
  @Getter
  @Setter
  public static class Cors {
    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));

    private long maxAgeSeconds = 3600;
  }
}
