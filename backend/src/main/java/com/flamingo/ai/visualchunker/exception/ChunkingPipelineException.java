package com.flamingo.ai.visualchunker.exception;

/**
 * Exception thrown when a {@code chunkDocument} call fails as a whole.
 *
 * <p>No partial chunk list is returned; callers may retry with adjusted options.
 */
public class ChunkingPipelineException extends RuntimeException {

  private final String documentName;
  private final String userMessage;

  public ChunkingPipelineException(String documentName, String message) {
    super(message);
    this.documentName = documentName;
    this.userMessage = "Failed to chunk document";
  }

  public ChunkingPipelineException(String documentName, String message, Throwable cause) {
    super(message, cause);
    this.documentName = documentName;
    this.userMessage = "Failed to chunk document";
  }

  public String getDocumentName() {
    return documentName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
