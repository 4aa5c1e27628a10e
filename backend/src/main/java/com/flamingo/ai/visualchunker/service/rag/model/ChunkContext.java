package com.flamingo.ai.visualchunker.service.rag.model;

import java.util.List;
import lombok.Builder;

/**
 * Contextual scores attached to a chunk by the visual enhancement stage.
 *
 * @param nearbyVisuals visuals associated with the chunk (shared references, never copied)
 * @param semanticBoundaries one {@code sentence_<i>} marker per sentence in the chunk
 * @param importance retrieval weight in {@code [0,1]}
 * @param readabilityScore sentence-length based readability in {@code [0,1]}
 * @param visualDensity estimated share of the chunk's area taken by visuals, in {@code [0,1]}
 */
@Builder(toBuilder = true)
public record ChunkContext(
    List<VisualElement> nearbyVisuals,
    List<String> semanticBoundaries,
    double importance,
    double readabilityScore,
    double visualDensity) {}
