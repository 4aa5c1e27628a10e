package com.flamingo.ai.visualchunker.service.rag.model;

/**
 * One page of a paginated document.
 *
 * @param number 1-based page number
 * @param content trimmed page text
 * @param startOffset offset of {@code content} in the full document text
 * @param position page region used for spatial proximity checks
 */
public record PageContent(int number, String content, int startOffset, BoundingBox position) {

  /** Exclusive end offset of this page's content in the full document text. */
  public int endOffset() {
    return startOffset + content.length();
  }
}
