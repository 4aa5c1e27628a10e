package com.flamingo.ai.visualchunker.service.rag.model;

/**
 * A chart, table or image detected by the visual-extraction collaborator.
 *
 * <p>Chunks reference visuals by {@link #id()} only; the chunker never copies or owns them.
 *
 * @param id unique identifier, referenced from {@link FinalChunk#visualReferences()}
 * @param type kind of visual
 * @param pageNumber 1-based page the visual sits on; {@code null} when unknown
 * @param boundingBox position on the page; {@code null} when unknown
 * @param title caption or title; may be {@code null}
 * @param description alt text or generated description; may be {@code null}
 * @param confidence detector confidence in {@code [0,1]}
 */
public record VisualElement(
    String id,
    VisualType type,
    Integer pageNumber,
    BoundingBox boundingBox,
    String title,
    String description,
    double confidence) {

  public boolean hasPageNumber() {
    return pageNumber != null;
  }

  public boolean hasBoundingBox() {
    return boundingBox != null;
  }
}
