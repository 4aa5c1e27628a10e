package com.flamingo.ai.visualchunker.service.rag.model;

import lombok.Builder;

/**
 * A chunk cut by the {@link com.flamingo.ai.visualchunker.service.rag.chunking.ChunkSplitter},
 * before visual enrichment.
 *
 * @param id chunk identifier, {@code chunk_<n>} in document order
 * @param content window text with surrounding whitespace stripped
 * @param startIndex inclusive offset of the window in the full document text
 * @param endIndex exclusive offset of the window in the full document text
 * @param pageNumber 1-based page of origin; {@code null} for non-paginated documents
 * @param sectionIndex 0-based section of origin; {@code null} when the document has no sections
 * @param sectionTitle heading of the section of origin; {@code null} when not sectioned
 * @param position page region of origin; {@code null} when unknown
 * @param chunkIndex sequential position in the document (0-based)
 * @param tokenCountEstimate {@code ceil(words * 1.3)}
 */
@Builder(toBuilder = true)
public record RawChunk(
    String id,
    String content,
    int startIndex,
    int endIndex,
    Integer pageNumber,
    Integer sectionIndex,
    String sectionTitle,
    BoundingBox position,
    int chunkIndex,
    int tokenCountEstimate) {}
