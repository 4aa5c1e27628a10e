package com.flamingo.ai.visualchunker.service.rag.chunking;

import com.flamingo.ai.visualchunker.service.rag.model.ChunkingMetadata;
import com.flamingo.ai.visualchunker.service.rag.model.FinalChunk;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/** Computes summary statistics over the final chunk list. */
@Component
public class MetadataAggregator {

  /**
   * Aggregates chunk statistics.
   *
   * @param chunks final chunks
   * @param processingTimeMs elapsed time of the chunking call
   * @return metadata for the caller
   */
  public ChunkingMetadata aggregate(List<FinalChunk> chunks, long processingTimeMs) {
    SortedMap<Integer, Integer> pageDistribution = new TreeMap<>();
    int visualContextChunks = 0;
    long totalSize = 0;

    for (FinalChunk chunk : chunks) {
      if (chunk.pageNumber() != null) {
        pageDistribution.merge(chunk.pageNumber(), 1, Integer::sum);
      }
      if (chunk.hasVisualContext()) {
        visualContextChunks++;
      }
      totalSize += chunk.length();
    }

    long averageChunkSize = chunks.isEmpty() ? 0 : Math.round((double) totalSize / chunks.size());
    return new ChunkingMetadata(
        chunks.size(),
        averageChunkSize,
        visualContextChunks,
        pageDistribution,
        processingTimeMs);
  }
}
