package com.flamingo.ai.slidedeck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the SlideDeck AI backend. */
@SpringBootApplication
public class SlideDeckApplication {

  public static void main(String[] args) {
    SpringApplication.run(SlideDeckApplication.class, args);
  }
}
