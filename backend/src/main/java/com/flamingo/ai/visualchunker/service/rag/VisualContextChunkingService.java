package com.flamingo.ai.visualchunker.service.rag;

import com.flamingo.ai.visualchunker.config.ChunkingProperties;
import com.flamingo.ai.visualchunker.exception.ChunkingPipelineException;
import com.flamingo.ai.visualchunker.service.rag.chunking.AdaptiveSizeOptimizer;
import com.flamingo.ai.visualchunker.service.rag.chunking.ChunkSplitter;
import com.flamingo.ai.visualchunker.service.rag.chunking.MetadataAggregator;
import com.flamingo.ai.visualchunker.service.rag.chunking.SemanticBoundaryOptimizer;
import com.flamingo.ai.visualchunker.service.rag.model.ChunkingMetadata;
import com.flamingo.ai.visualchunker.service.rag.model.ChunkingOptions;
import com.flamingo.ai.visualchunker.service.rag.model.ChunkingResult;
import com.flamingo.ai.visualchunker.service.rag.model.DocumentStructure;
import com.flamingo.ai.visualchunker.service.rag.model.FinalChunk;
import com.flamingo.ai.visualchunker.service.rag.model.RawChunk;
import com.flamingo.ai.visualchunker.service.rag.model.SourceDocument;
import com.flamingo.ai.visualchunker.service.rag.model.VisualElement;
import com.flamingo.ai.visualchunker.service.rag.parsing.StructureParserRouter;
import com.flamingo.ai.visualchunker.service.rag.visual.VisualContextEnhancer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Chunks extracted document text while preserving its visual context.
 *
 * <p>Pipeline, one linear pass per document:
 *
 * <ol>
 *   <li>{@link StructureParserRouter} → pages, sections or flat blocks
 *   <li>{@link ChunkSplitter} → bounded, overlapping raw chunks
 *   <li>{@link VisualContextEnhancer} → visual references, density and scores
 *   <li>{@link SemanticBoundaryOptimizer} → merge chunks cut mid-sentence
 *   <li>{@link AdaptiveSizeOptimizer} → re-split dense chunks, demote small ones
 *   <li>{@link MetadataAggregator} → summary statistics
 * </ol>
 *
 * <p>The service holds no per-call state and never mutates its inputs, so one instance serves
 * concurrent callers. Parse failures and malformed visuals degrade gracefully inside their stage;
 * any other failure aborts the call with a {@link ChunkingPipelineException} and no partial result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisualContextChunkingService {

  private final StructureParserRouter structureParserRouter;
  private final ChunkSplitter chunkSplitter;
  private final VisualContextEnhancer visualContextEnhancer;
  private final SemanticBoundaryOptimizer semanticBoundaryOptimizer;
  private final AdaptiveSizeOptimizer adaptiveSizeOptimizer;
  private final MetadataAggregator metadataAggregator;
  private final ChunkingProperties chunkingProperties;
  private final MeterRegistry meterRegistry;

  /**
   * Chunks a document with the configured default options.
   *
   * @param document extracted document
   * @param visuals visuals detected in the document; {@code null} means none
   * @return chunks and metadata
   * @throws ChunkingPipelineException if the document cannot be chunked
   */
  @Timed(value = "chunking.document", description = "Time to chunk one document")
  public ChunkingResult chunkDocument(SourceDocument document, List<VisualElement> visuals) {
    return chunkDocument(document, visuals, chunkingProperties.toOptions());
  }

  /**
   * Chunks a document.
   *
   * @param document extracted document
   * @param visuals visuals detected in the document; {@code null} means none
   * @param options per-call options
   * @return chunks in document order and their metadata
   * @throws ChunkingPipelineException if the document cannot be chunked
   */
  @Timed(value = "chunking.document", description = "Time to chunk one document")
  public ChunkingResult chunkDocument(
      SourceDocument document, List<VisualElement> visuals, ChunkingOptions options) {
    long startNanos = System.nanoTime();
    String documentName = document != null ? document.name() : null;

    if (document == null || document.content() == null) {
      meterRegistry.counter("chunking.failures").increment();
      throw new ChunkingPipelineException(documentName, "Document has no content to chunk");
    }
    if (options == null) {
      meterRegistry.counter("chunking.failures").increment();
      throw new ChunkingPipelineException(documentName, "Chunking options are required");
    }
    List<VisualElement> safeVisuals =
        visuals != null ? visuals.stream().filter(Objects::nonNull).toList() : List.of();

    log.debug(
        "Starting chunking for {} (type={}, {} chars, {} visuals)",
        documentName,
        document.type(),
        document.content().length(),
        safeVisuals.size());

    try {
      String content = document.content();

      DocumentStructure structure = structureParserRouter.parse(content, document.type());
      List<RawChunk> rawChunks = chunkSplitter.split(content, structure, options);
      List<FinalChunk> enhanced = visualContextEnhancer.enhance(rawChunks, safeVisuals, options);
      List<FinalChunk> merged = semanticBoundaryOptimizer.optimize(enhanced, content, options);
      List<FinalChunk> chunks =
          List.copyOf(adaptiveSizeOptimizer.optimize(merged, content, options));

      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      ChunkingMetadata metadata = metadataAggregator.aggregate(chunks, elapsedMs);

      meterRegistry.counter("chunking.documents", "type", String.valueOf(document.type()))
          .increment();
      meterRegistry.counter("chunking.chunks").increment(chunks.size());
      log.info(
          "Chunked {} into {} chunks ({} with visual context) in {}ms",
          documentName,
          metadata.totalChunks(),
          metadata.visualContextChunks(),
          elapsedMs);

      return new ChunkingResult(chunks, metadata);
    } catch (RuntimeException e) {
      meterRegistry.counter("chunking.failures").increment();
      log.error("Chunking failed for {}: {}", documentName, e.getMessage(), e);
      throw new ChunkingPipelineException(
          documentName, "Chunking failed for " + documentName + ": " + e.getMessage(), e);
    }
  }
}
