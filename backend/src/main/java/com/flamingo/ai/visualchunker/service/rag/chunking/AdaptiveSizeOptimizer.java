package com.flamingo.ai.visualchunker.service.rag.chunking;

import com.flamingo.ai.visualchunker.service.rag.model.ChunkingOptions;
import com.flamingo.ai.visualchunker.service.rag.model.FinalChunk;
import com.flamingo.ai.visualchunker.service.rag.model.TextWindow;
import com.flamingo.ai.visualchunker.service.rag.scoring.ChunkScoring;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Adapts chunk size to local content density.
 *
 * <p>The optimal size of a chunk starts at {@link ChunkingOptions#maxChunkSize()}, shrinks by 20%
 * for visual-dense chunks (density above 0.5) and by a further 30% for hard-to-read chunks
 * (readability below 0.3), and never drops below {@link ChunkingOptions#minChunkSize()}.
 *
 * <ul>
 *   <li>longer than 1.5× optimal → split into overlapping sub-chunks of at most the optimal size
 *   <li>shorter than 0.5× optimal → kept, importance capped at 0.5
 * </ul>
 *
 * <p>Splits re-cut the chunk's source span {@code [startIndex, endIndex)} of the document text, so
 * every sub-chunk's content is the stripped text between its own offsets.
 */
@Slf4j
@Component
public class AdaptiveSizeOptimizer {

  private static final double DENSE_VISUAL_THRESHOLD = 0.5;
  private static final double DENSE_VISUAL_FACTOR = 0.8;
  private static final double LOW_READABILITY_THRESHOLD = 0.3;
  private static final double LOW_READABILITY_FACTOR = 0.7;
  private static final double OVERSIZED_FACTOR = 1.5;
  private static final double UNDERSIZED_FACTOR = 0.5;
  private static final double UNDERSIZED_MAX_IMPORTANCE = 0.5;

  /**
   * Applies adaptive sizing.
   *
   * @param chunks chunks in document order
   * @param content full document text the chunk offsets point into
   * @param options per-call options
   * @return resized chunks, in document order
   */
  public List<FinalChunk> optimize(
      List<FinalChunk> chunks, String content, ChunkingOptions options) {
    if (!options.adaptiveChunkSizing()) {
      return chunks;
    }

    List<FinalChunk> optimized = new ArrayList<>(chunks.size());
    int splits = 0;
    for (FinalChunk chunk : chunks) {
      int optimalSize = optimalSize(chunk, options);
      if (chunk.length() > optimalSize * OVERSIZED_FACTOR) {
        optimized.addAll(split(chunk, content, optimalSize, options));
        splits++;
      } else if (chunk.length() < optimalSize * UNDERSIZED_FACTOR) {
        optimized.add(demote(chunk));
      } else {
        optimized.add(chunk);
      }
    }

    log.debug("Adaptive sizing split {} of {} chunks", splits, chunks.size());
    return optimized;
  }

  int optimalSize(FinalChunk chunk, ChunkingOptions options) {
    double size = options.maxChunkSize();
    if (chunk.context().visualDensity() > DENSE_VISUAL_THRESHOLD) {
      size *= DENSE_VISUAL_FACTOR;
    }
    if (chunk.context().readabilityScore() < LOW_READABILITY_THRESHOLD) {
      size *= LOW_READABILITY_FACTOR;
    }
    return (int) Math.max(Math.round(size), Math.max(options.minChunkSize(), 1));
  }

  private List<FinalChunk> split(
      FinalChunk chunk, String content, int optimalSize, ChunkingOptions options) {
    List<TextWindow> windows =
        TextWindowSplitter.split(
            content,
            chunk.startIndex(),
            chunk.endIndex(),
            optimalSize,
            Math.min(options.minChunkSize(), optimalSize),
            options.overlapSize());

    List<FinalChunk> subChunks = new ArrayList<>(windows.size());
    for (TextWindow window : windows) {
      String subContent = content.substring(window.start(), window.end()).strip();
      if (subContent.isEmpty()) {
        continue;
      }
      subChunks.add(
          chunk.toBuilder()
              .id(chunk.id() + "_" + subChunks.size())
              .content(subContent)
              .startIndex(window.start())
              .endIndex(window.end())
              .tokenCountEstimate(ChunkScoring.estimateTokenCount(subContent))
              .context(
                  chunk.context().toBuilder()
                      .semanticBoundaries(ChunkScoring.semanticBoundaries(subContent))
                      .readabilityScore(ChunkScoring.readabilityScore(subContent))
                      .build())
              .build());
    }
    return subChunks;
  }

  private FinalChunk demote(FinalChunk chunk) {
    double importance = Math.min(chunk.context().importance(), UNDERSIZED_MAX_IMPORTANCE);
    return chunk.toBuilder()
        .context(chunk.context().toBuilder().importance(importance).build())
        .build();
  }
}
