package com.flamingo.ai.visualchunker.service.rag.model;

import java.util.List;

/**
 * Output of a {@link com.flamingo.ai.visualchunker.service.rag.parsing.StructureParser}.
 *
 * <p>Exactly one of the three lists is populated, depending on the parser that produced it. All
 * lists are empty only for a document without any non-blank text.
 *
 * @param pages pages of a paginated document
 * @param sections sections of a markup or structured document
 * @param contentBlocks paragraph blocks of a flat document
 */
public record DocumentStructure(
    List<PageContent> pages, List<SectionContent> sections, List<ContentBlock> contentBlocks) {

  public static DocumentStructure ofPages(List<PageContent> pages) {
    return new DocumentStructure(List.copyOf(pages), List.of(), List.of());
  }

  public static DocumentStructure ofSections(List<SectionContent> sections) {
    return new DocumentStructure(List.of(), List.copyOf(sections), List.of());
  }

  public static DocumentStructure ofBlocks(List<ContentBlock> contentBlocks) {
    return new DocumentStructure(List.of(), List.of(), List.copyOf(contentBlocks));
  }

  public boolean isEmpty() {
    return pages.isEmpty() && sections.isEmpty() && contentBlocks.isEmpty();
  }
}
