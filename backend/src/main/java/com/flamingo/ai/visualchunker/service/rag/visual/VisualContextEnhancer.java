package com.flamingo.ai.visualchunker.service.rag.visual;

import com.flamingo.ai.visualchunker.exception.VisualEnhancementException;
import com.flamingo.ai.visualchunker.service.rag.model.ChunkContext;
import com.flamingo.ai.visualchunker.service.rag.model.ChunkingOptions;
import com.flamingo.ai.visualchunker.service.rag.model.FinalChunk;
import com.flamingo.ai.visualchunker.service.rag.model.RawChunk;
import com.flamingo.ai.visualchunker.service.rag.model.SectionType;
import com.flamingo.ai.visualchunker.service.rag.model.VisualElement;
import com.flamingo.ai.visualchunker.service.rag.scoring.ChunkScoring;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Associates raw chunks with nearby visual elements and scores them.
 *
 * <p>A visual is associated with a chunk when any registered {@link VisualProximityMatcher}
 * accepts the pair. Matchers are injected in {@code @Order} order: page proximity, spatial
 * proximity, textual relevance.
 *
 * <p>A visual with malformed metadata is skipped for the chunk being evaluated and counted in
 * {@code chunking.visuals.skipped}; it never fails the pipeline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VisualContextEnhancer {

  private final List<VisualProximityMatcher> matchers;
  private final MeterRegistry meterRegistry;

  /**
   * Converts raw chunks into final chunks carrying visual references and scores.
   *
   * @param chunks raw chunks in document order
   * @param visuals visuals detected in the document; may be empty
   * @param options per-call options
   * @return one final chunk per raw chunk, in the same order
   */
  public List<FinalChunk> enhance(
      List<RawChunk> chunks, List<VisualElement> visuals, ChunkingOptions options) {
    List<FinalChunk> enhanced = new ArrayList<>(chunks.size());

    if (!options.includeVisualContext() || visuals.isEmpty()) {
      for (RawChunk chunk : chunks) {
        enhanced.add(toFinalChunk(chunk, List.of()));
      }
      return enhanced;
    }

    int skipped = 0;
    for (RawChunk chunk : chunks) {
      Map<String, VisualElement> nearby = new LinkedHashMap<>();
      for (VisualElement visual : visuals) {
        try {
          if (isNearby(chunk, visual, options)) {
            nearby.putIfAbsent(visual.id(), visual);
          }
        } catch (VisualEnhancementException e) {
          skipped++;
          meterRegistry.counter("chunking.visuals.skipped").increment();
          log.debug("Skipping visual {} for {}: {}", e.getVisualId(), chunk.id(), e.getMessage());
        }
      }
      enhanced.add(toFinalChunk(chunk, new ArrayList<>(nearby.values())));
    }

    if (skipped > 0) {
      log.warn("Skipped {} malformed visual/chunk pairs during enhancement", skipped);
    }
    log.debug(
        "Enhanced {} chunks against {} visuals using {} matchers",
        chunks.size(),
        visuals.size(),
        matchers.size());
    return enhanced;
  }

  private boolean isNearby(RawChunk chunk, VisualElement visual, ChunkingOptions options) {
    if (visual.id() == null || visual.id().isBlank()) {
      throw new VisualEnhancementException(visual.id(), "Visual element without id");
    }
    for (VisualProximityMatcher matcher : matchers) {
      if (matcher.matches(chunk, visual, options)) {
        log.trace("{} matched visual {} to {}", matcher.getMatcherName(), visual.id(), chunk.id());
        return true;
      }
    }
    return false;
  }

  private FinalChunk toFinalChunk(RawChunk chunk, List<VisualElement> nearbyVisuals) {
    double density = ChunkScoring.visualDensity(chunk.content().length(), nearbyVisuals);
    ChunkContext context =
        ChunkContext.builder()
            .nearbyVisuals(List.copyOf(nearbyVisuals))
            .semanticBoundaries(ChunkScoring.semanticBoundaries(chunk.content()))
            .importance(ChunkScoring.importance(chunk.content(), nearbyVisuals.size()))
            .readabilityScore(ChunkScoring.readabilityScore(chunk.content()))
            .visualDensity(density)
            .build();

    return FinalChunk.builder()
        .id(chunk.id())
        .content(chunk.content())
        .startIndex(chunk.startIndex())
        .endIndex(chunk.endIndex())
        .pageNumber(chunk.pageNumber())
        .sectionIndex(chunk.sectionIndex())
        .sectionTitle(chunk.sectionTitle())
        .position(chunk.position())
        .chunkIndex(chunk.chunkIndex())
        .tokenCountEstimate(chunk.tokenCountEstimate())
        .visualReferences(nearbyVisuals.stream().map(VisualElement::id).toList())
        .sectionType(SectionType.fromVisualDensity(density))
        .context(context)
        .build();
  }
}
