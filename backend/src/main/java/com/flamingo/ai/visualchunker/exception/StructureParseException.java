package com.flamingo.ai.visualchunker.exception;

import com.flamingo.ai.visualchunker.service.rag.model.DocumentType;

/**
 * Exception thrown by a format-specific structure parser.
 *
 * <p>Never leaves the parsing stage: the router recovers by falling back to flat paragraph
 * splitting.
 */
public class StructureParseException extends RuntimeException {

  private final DocumentType documentType;

  public StructureParseException(DocumentType documentType, String message) {
    super(message);
    this.documentType = documentType;
  }

  public DocumentType getDocumentType() {
    return documentType;
  }
}
