package com.flamingo.ai.visualchunker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/** Entry point of the visual-context document chunking service. */
@SpringBootApplication
@ConfigurationPropertiesScan
public class VisualChunkerApplication {

  public static void main(String[] args) {
    SpringApplication.run(VisualChunkerApplication.class, args);
  }
}
