package com.flamingo.ai.visualchunker.service.rag.model;

import java.util.Locale;
import java.util.Set;

/**
 * Declared layout of a {@link SourceDocument}, used to pick a structure parser.
 *
 * <ul>
 *   <li>{@link #PAGINATED} → extracted PDF text carrying page-break markers
 *   <li>{@link #MARKUP} → HTML-like text with {@code <h1>}…{@code <h6>} headings
 *   <li>{@link #STRUCTURED} → office-document text (DOCX, ODT) laid out as paragraphs
 *   <li>{@link #FLAT} → plain text and anything unrecognised
 * </ul>
 */
public enum DocumentType {
  PAGINATED,
  MARKUP,
  STRUCTURED,
  FLAT;

  private static final Set<String> PAGINATED_TYPES = Set.of("pdf", "application/pdf");

  private static final Set<String> MARKUP_TYPES =
      Set.of("html", "htm", "xhtml", "text/html", "application/xhtml+xml");

  private static final Set<String> STRUCTURED_TYPES =
      Set.of(
          "docx",
          "doc",
          "odt",
          "application/msword",
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          "application/vnd.oasis.opendocument.text");

  /**
   * Resolves a file extension or MIME type reported by the text-extraction collaborator.
   *
   * @param fileType extension ({@code "pdf"}, {@code ".html"}) or MIME type; may be {@code null}
   * @return matching type, {@link #FLAT} when unknown
   */
  public static DocumentType fromFileType(String fileType) {
    if (fileType == null || fileType.isBlank()) {
      return FLAT;
    }
    String normalized = fileType.trim().toLowerCase(Locale.ROOT);
    if (normalized.startsWith(".")) {
      normalized = normalized.substring(1);
    }
    if (PAGINATED_TYPES.contains(normalized)) {
      return PAGINATED;
    }
    if (MARKUP_TYPES.contains(normalized)) {
      return MARKUP;
    }
    if (STRUCTURED_TYPES.contains(normalized)) {
      return STRUCTURED;
    }
    return FLAT;
  }
}
