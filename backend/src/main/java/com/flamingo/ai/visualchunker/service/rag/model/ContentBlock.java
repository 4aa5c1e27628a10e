package com.flamingo.ai.visualchunker.service.rag.model;

/**
 * A blank-line delimited paragraph of a flat document.
 *
 * @param content trimmed block text
 * @param startOffset offset of {@code content} in the full document text
 */
public record ContentBlock(String content, int startOffset) {

  public int endOffset() {
    return startOffset + content.length();
  }
}
