package com.flamingo.ai.visualchunker.service.rag.chunking;

import com.flamingo.ai.visualchunker.service.rag.model.ChunkingOptions;
import com.flamingo.ai.visualchunker.service.rag.model.FinalChunk;
import com.flamingo.ai.visualchunker.service.rag.model.SectionType;
import com.flamingo.ai.visualchunker.service.rag.model.VisualElement;
import com.flamingo.ai.visualchunker.service.rag.scoring.ChunkScoring;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Merges chunks that end mid-thought into their successor.
 *
 * <p>A chunk is at a poor boundary when its last character is not one of {@code . ! ? : ;}. The
 * scan is greedy and single-pass: left to right, each poor-boundary chunk absorbs at most the next
 * chunk, and the merged result is not evaluated again. A merge only happens when:
 *
 * <ul>
 *   <li>the merged content stays within {@link ChunkingOptions#maxMergedChunkSize()}
 *   <li>both chunks come from the same page, if page boundaries are preserved
 * </ul>
 *
 * <p>A merge may span a section break; the merged chunk keeps the first chunk's section.
 */
@Slf4j
@Component
public class SemanticBoundaryOptimizer {

  private static final String SENTENCE_ENDINGS = ".!?:;";

  /**
   * Applies boundary merging.
   *
   * @param chunks enhanced chunks in document order
   * @param content full document text, used to join overlapping chunks without repeating text
   * @param options per-call options
   * @return chunks after merging, in document order
   */
  public List<FinalChunk> optimize(
      List<FinalChunk> chunks, String content, ChunkingOptions options) {
    if (!options.semanticBoundaryDetection()) {
      return chunks;
    }

    List<FinalChunk> optimized = new ArrayList<>(chunks.size());
    int merges = 0;
    for (int i = 0; i < chunks.size(); i++) {
      FinalChunk chunk = chunks.get(i);
      if (i + 1 < chunks.size() && isAtPoorBoundary(chunk.content())) {
        FinalChunk next = chunks.get(i + 1);
        if (isSamePage(chunk, next, options)) {
          String mergedContent = joinContent(chunk, next, content);
          if (mergedContent.length() <= options.maxMergedChunkSize()) {
            optimized.add(merge(chunk, next, mergedContent));
            merges++;
            i++;
            continue;
          }
        }
      }
      optimized.add(chunk);
    }

    log.debug("Semantic boundary pass merged {} chunk pairs", merges);
    return optimized;
  }

  static boolean isAtPoorBoundary(String content) {
    String trimmed = content.strip();
    return trimmed.isEmpty()
        || SENTENCE_ENDINGS.indexOf(trimmed.charAt(trimmed.length() - 1)) < 0;
  }

  private boolean isSamePage(FinalChunk chunk, FinalChunk next, ChunkingOptions options) {
    return !options.preservePageBoundaries()
        || Objects.equals(chunk.pageNumber(), next.pageNumber());
  }

  /**
   * Joins with a single space. When {@code next} overlaps {@code chunk}, only the text past {@code
   * chunk}'s end is appended, and a word cut in half by a hard split is rejoined without a space.
   */
  private String joinContent(FinalChunk chunk, FinalChunk next, String content) {
    if (next.startIndex() > chunk.endIndex() || next.endIndex() <= chunk.endIndex()) {
      return chunk.content() + " " + next.content();
    }
    String tail = content.substring(chunk.endIndex(), next.endIndex()).strip();
    if (tail.isEmpty()) {
      return chunk.content();
    }
    boolean splitWord =
        chunk.endIndex() > 0
            && !Character.isWhitespace(content.charAt(chunk.endIndex() - 1))
            && !Character.isWhitespace(content.charAt(chunk.endIndex()));
    return chunk.content() + (splitWord ? "" : " ") + tail;
  }

  private FinalChunk merge(FinalChunk chunk, FinalChunk next, String mergedContent) {
    Set<String> references = new LinkedHashSet<>(chunk.visualReferences());
    references.addAll(next.visualReferences());

    Map<String, VisualElement> visuals = new LinkedHashMap<>();
    chunk.context().nearbyVisuals().forEach(v -> visuals.putIfAbsent(v.id(), v));
    next.context().nearbyVisuals().forEach(v -> visuals.putIfAbsent(v.id(), v));
    List<VisualElement> nearbyVisuals = List.copyOf(visuals.values());

    double density = ChunkScoring.visualDensity(mergedContent.length(), nearbyVisuals);
    return chunk.toBuilder()
        .content(mergedContent)
        .endIndex(next.endIndex())
        .tokenCountEstimate(ChunkScoring.estimateTokenCount(mergedContent))
        .visualReferences(List.copyOf(references))
        .sectionType(SectionType.fromVisualDensity(density))
        .context(
            chunk.context().toBuilder()
                .nearbyVisuals(nearbyVisuals)
                .semanticBoundaries(ChunkScoring.semanticBoundaries(mergedContent))
                .importance(Math.max(chunk.context().importance(), next.context().importance()))
                .readabilityScore(ChunkScoring.readabilityScore(mergedContent))
                .visualDensity(density)
                .build())
        .build();
  }
}
