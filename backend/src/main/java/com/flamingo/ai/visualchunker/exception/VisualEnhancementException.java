package com.flamingo.ai.visualchunker.exception;

/** Exception thrown when a single visual element's metadata cannot be evaluated. */
public class VisualEnhancementException extends RuntimeException {

  private final String visualId;

  public VisualEnhancementException(String visualId, String message) {
    super(message);
    this.visualId = visualId;
  }

  public String getVisualId() {
    return visualId;
  }
}
