package com.flamingo.ai.visualchunker.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

@DisplayName("ChunkingProperties validation Tests")
class ChunkingPropertiesValidationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(PropertiesOnly.class);

  @Test
  @DisplayName("should start with the built-in defaults")
  void shouldStart_withDefaults() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          assertThat(context.getBean(ChunkingProperties.class).getMaxChunkSize()).isEqualTo(1000);
        });
  }

  @Test
  @DisplayName("should reject a non-positive maximum chunk size at startup")
  void shouldReject_nonPositiveMaxChunkSize() {
    contextRunner
        .withPropertyValues("chunking.max-chunk-size=0")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  @DisplayName("should reject a negative overlap at startup")
  void shouldReject_negativeOverlap() {
    contextRunner
        .withPropertyValues("chunking.overlap-size=-5")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  @DisplayName("should reject a minimum chunk size above the maximum at startup")
  void shouldReject_minimumAboveMaximum() {
    contextRunner
        .withPropertyValues("chunking.max-chunk-size=400", "chunking.min-chunk-size=500")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(ChunkingProperties.class)
  static class PropertiesOnly {}
}
