package com.flamingo.ai.slidedeck.service.compiler;

import com.flamingo.ai.slidedeck.config.SlideDeckConfig;
import com.flamingo.ai.slidedeck.domain.ir.ImageElement;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Loads the bytes of an image element: one blocking download when a URL is set, otherwise the
 * local file. No retries and no caching.
 */
@Component
@Slf4j
public class ImageLoader {

  private final WebClient webClient;

  public ImageLoader(SlideDeckConfig config) {
    int maxBytes = config.getImages().getMaxDownloadBytes();
    this.webClient =
        WebClient.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxBytes))
            .build();
  }

  /**
   * Reads the image bytes.
   *
   * @param image element with a URL or a path
   * @return raw image bytes
   * @throws IOException if neither source is set, the download fails or the file is unreadable
   */
  public byte[] load(ImageElement image) throws IOException {
    if (image.hasUrl()) {
      return download(image.url());
    }
    if (image.hasPath()) {
      return Files.readAllBytes(Path.of(image.path()));
    }
    throw new IOException("Image element has neither url nor path");
  }

  private byte[] download(String url) throws IOException {
    log.debug("Downloading image {}", url);
    try {
      byte[] body = webClient.get().uri(url).retrieve().bodyToMono(byte[].class).block();
      if (body == null || body.length == 0) {
        throw new IOException("Empty response body from " + url);
      }
      return body;
    } catch (RuntimeException e) {
      throw new IOException("Failed to download image from " + url + ": " + e.getMessage(), e);
    }
  }
}
