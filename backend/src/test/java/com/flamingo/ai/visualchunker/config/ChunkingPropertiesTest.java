package com.flamingo.ai.visualchunker.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.visualchunker.service.rag.model.ChunkingOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {
      "chunking.max-chunk-size=500",
      "chunking.min-chunk-size=50",
      "chunking.overlap-size=25",
      "chunking.preserve-page-boundaries=false",
      "chunking.visual-proximity-threshold=42.5"
    })
@DisplayName("ChunkingProperties Tests")
class ChunkingPropertiesTest {

  @Autowired private ChunkingProperties chunkingProperties;

  @Test
  @DisplayName("should bind chunking properties and keep defaults for unset values")
  void shouldBindProperties_andKeepDefaults() {
    ChunkingOptions options = chunkingProperties.toOptions();

    assertThat(options.maxChunkSize()).isEqualTo(500);
    assertThat(options.minChunkSize()).isEqualTo(50);
    assertThat(options.overlapSize()).isEqualTo(25);
    assertThat(options.preservePageBoundaries()).isFalse();
    assertThat(options.visualProximityThreshold()).isEqualTo(42.5);
    assertThat(options.includeVisualContext()).isTrue();
    assertThat(options.semanticBoundaryDetection()).isTrue();
    assertThat(options.adaptiveChunkSizing()).isTrue();
  }
}
