package com.flamingo.ai.visualchunker.service.rag.model;

/**
 * A half-open character range {@code [start, end)} relative to the text it was cut from.
 *
 * @param start inclusive start
 * @param end exclusive end
 */
public record TextWindow(int start, int end) {

  public int length() {
    return end - start;
  }
}
