package com.flamingo.ai.visualchunker.service.rag.model;

import lombok.Builder;

/**
 * Immutable per-call chunking configuration.
 *
 * <p>Built from {@link com.flamingo.ai.visualchunker.config.ChunkingProperties} or directly via
 * {@link #builder()}; start from {@link #defaults()} and override with {@code toBuilder()}.
 *
 * @param maxChunkSize upper bound in characters before a chunk is closed
 * @param minChunkSize lower bound in characters; also the floor of the sentence-search window
 * @param overlapSize characters shared by consecutive chunks and sub-chunks
 * @param preservePageBoundaries never let a chunk span two pages
 * @param includeVisualContext associate visuals with chunks
 * @param semanticBoundaryDetection merge chunks that end mid-sentence
 * @param adaptiveChunkSizing re-split dense or hard-to-read chunks
 * @param visualProximityThreshold spatial distance cutoff in page coordinate units
 */
@Builder(toBuilder = true)
public record ChunkingOptions(
    int maxChunkSize,
    int minChunkSize,
    int overlapSize,
    boolean preservePageBoundaries,
    boolean includeVisualContext,
    boolean semanticBoundaryDetection,
    boolean adaptiveChunkSizing,
    double visualProximityThreshold) {

  /** Merged chunks may exceed {@link #maxChunkSize()} by this factor. */
  public static final double MERGE_TOLERANCE = 1.2;

  public ChunkingOptions {
    if (maxChunkSize <= 0) {
      throw new IllegalArgumentException("maxChunkSize must be positive, was " + maxChunkSize);
    }
    if (minChunkSize < 0 || minChunkSize > maxChunkSize) {
      throw new IllegalArgumentException(
          "minChunkSize must be within [0, maxChunkSize], was " + minChunkSize);
    }
    if (overlapSize < 0) {
      throw new IllegalArgumentException("overlapSize must not be negative, was " + overlapSize);
    }
    if (!(visualProximityThreshold >= 0)) {
      throw new IllegalArgumentException(
          "visualProximityThreshold must not be negative, was " + visualProximityThreshold);
    }
  }

  public static ChunkingOptions defaults() {
    return new ChunkingOptions(1000, 200, 150, true, true, true, true, 100);
  }

  /** Longest content a semantic-boundary merge may produce. */
  public double maxMergedChunkSize() {
    return maxChunkSize * MERGE_TOLERANCE;
  }
}
