package com.flamingo.ai.visualchunker.service.rag.parsing;

import com.flamingo.ai.visualchunker.service.rag.model.DocumentStructure;
import com.flamingo.ai.visualchunker.service.rag.model.DocumentType;

/**
 * Classifies extracted document text into pages, sections or flat blocks.
 *
 * <p>Implementations are format-specific and must be stateless so a single instance can be shared
 * across concurrent chunking calls. Every offset they report indexes into the {@code content}
 * passed to {@link #parse(String)}.
 */
public interface StructureParser {

  /**
   * Parses the given content.
   *
   * @param content full extracted document text, never {@code null}
   * @return the detected structure
   * @throws com.flamingo.ai.visualchunker.exception.StructureParseException if the content does
   *     not follow the format this parser handles
   */
  DocumentStructure parse(String content);

  /**
   * Returns {@code true} if this parser handles the given document type.
   *
   * @param documentType declared document type
   * @return {@code true} if supported
   */
  boolean supports(DocumentType documentType);
}
