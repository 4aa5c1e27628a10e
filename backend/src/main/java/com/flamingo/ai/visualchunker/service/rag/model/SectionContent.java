package com.flamingo.ai.visualchunker.service.rag.model;

/**
 * A section detected in a markup or structured document.
 *
 * @param title section heading text (inner tags stripped); empty for an implicit section
 * @param level heading depth (1 = H1 … 6 = H6), 0 for content preceding the first heading
 * @param content trimmed body text belonging to this section
 * @param startOffset offset of {@code content} in the full document text
 * @param endOffset exclusive end offset of {@code content}
 */
public record SectionContent(
    String title, int level, String content, int startOffset, int endOffset) {}
