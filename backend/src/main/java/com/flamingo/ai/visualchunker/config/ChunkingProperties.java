package com.flamingo.ai.visualchunker.config;

import com.flamingo.ai.visualchunker.service.rag.model.ChunkingOptions;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Default chunking configuration, bound from {@code chunking.*}.
 *
 * <p>The mutable bean only exists for property binding. The pipeline works on the immutable
 * snapshot returned by {@link #toOptions()}.
 */
@ConfigurationProperties(prefix = "chunking")
@Validated
@Getter
@Setter
public class ChunkingProperties {

  /** Upper bound in characters before a chunk is closed. */
  @Min(1)
  private int maxChunkSize = 1000;

  /** Lower bound in characters; also the floor of the sentence-search window. */
  @PositiveOrZero private int minChunkSize = 200;

  /** Characters shared by consecutive chunks. */
  @PositiveOrZero private int overlapSize = 150;

  private boolean preservePageBoundaries = true;
  private boolean includeVisualContext = true;
  private boolean semanticBoundaryDetection = true;
  private boolean adaptiveChunkSizing = true;

  /** Spatial distance cutoff in PDF coordinate units (~72 units per inch). */
  @PositiveOrZero private double visualProximityThreshold = 100.0;

  /** Rejects a minimum above the maximum at startup rather than on the first chunking call. */
  @AssertTrue(message = "chunking.min-chunk-size must not exceed chunking.max-chunk-size")
  public boolean isMinWithinMax() {
    return minChunkSize <= maxChunkSize;
  }

  /**
   * Snapshots the current values.
   *
   * @return immutable options
   * @throws IllegalArgumentException if the values are inconsistent (e.g. min above max)
   */
  public ChunkingOptions toOptions() {
    return ChunkingOptions.builder()
        .maxChunkSize(maxChunkSize)
        .minChunkSize(minChunkSize)
        .overlapSize(overlapSize)
        .preservePageBoundaries(preservePageBoundaries)
        .includeVisualContext(includeVisualContext)
        .semanticBoundaryDetection(semanticBoundaryDetection)
        .adaptiveChunkSizing(adaptiveChunkSizing)
        .visualProximityThreshold(visualProximityThreshold)
        .build();
  }
}
