package com.flamingo.ai.visualchunker.service.rag.model;

import java.util.List;
import lombok.Builder;

/**
 * A chunk ready for embedding: the raw chunk fields plus its visual context.
 *
 * <p>Consumed by the embedding/indexing component (one embedding unit per chunk) and by the
 * retrieval-result renderer, which resolves {@link #visualReferences()} to show the associated
 * visuals next to matched text.
 *
 * @param id chunk identifier; sub-chunks of an adaptive split append {@code _<i>}
 * @param content chunk text
 * @param startIndex inclusive offset in the full document text
 * @param endIndex exclusive offset in the full document text
 * @param pageNumber 1-based page; {@code null} for non-paginated documents
 * @param sectionIndex 0-based section; {@code null} when the document has no sections
 * @param sectionTitle heading of the section; {@code null} when not sectioned
 * @param position page region; {@code null} when unknown
 * @param chunkIndex sequential position assigned by the splitter
 * @param tokenCountEstimate {@code ceil(words * 1.3)}
 * @param visualReferences ids of associated {@link VisualElement}s, in input order
 * @param sectionType classification derived from the visual density
 * @param context scores and associated visuals
 */
@Builder(toBuilder = true)
public record FinalChunk(
    String id,
    String content,
    int startIndex,
    int endIndex,
    Integer pageNumber,
    Integer sectionIndex,
    String sectionTitle,
    BoundingBox position,
    int chunkIndex,
    int tokenCountEstimate,
    List<String> visualReferences,
    SectionType sectionType,
    ChunkContext context) {

  public int length() {
    return content.length();
  }

  public boolean hasVisualContext() {
    return !visualReferences.isEmpty();
  }
}
