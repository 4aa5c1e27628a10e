package com.flamingo.ai.visualchunker.service.rag.model;

/**
 * Extracted document text handed to the chunker. The caller owns it; the chunker only reads it.
 *
 * @param name display name used in log lines and error messages
 * @param content full extracted text; chunk offsets index into this string
 * @param type declared layout of the content
 */
public record SourceDocument(String name, String content, DocumentType type) {

  /**
   * Convenience factory resolving the type from a file extension or MIME type.
   *
   * @param name document name
   * @param content extracted text
   * @param fileType extension or MIME type, see {@link DocumentType#fromFileType(String)}
   * @return new document
   */
  public static SourceDocument of(String name, String content, String fileType) {
    return new SourceDocument(name, content, DocumentType.fromFileType(fileType));
  }
}
