package com.flamingo.ai.visualchunker.service.rag.chunking;

import com.flamingo.ai.visualchunker.service.rag.model.ChunkingOptions;
import com.flamingo.ai.visualchunker.service.rag.model.ContentBlock;
import com.flamingo.ai.visualchunker.service.rag.model.DocumentStructure;
import com.flamingo.ai.visualchunker.service.rag.model.PageContent;
import com.flamingo.ai.visualchunker.service.rag.model.RawChunk;
import com.flamingo.ai.visualchunker.service.rag.model.SectionContent;
import com.flamingo.ai.visualchunker.service.rag.model.TextWindow;
import com.flamingo.ai.visualchunker.service.rag.scoring.ChunkScoring;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Walks a {@link DocumentStructure} and emits raw, unenhanced chunks.
 *
 * <p>The unit of splitting is a <em>region</em>:
 *
 * <ul>
 *   <li>paginated documents → one region per page, or a single region spanning every page when
 *       {@link ChunkingOptions#preservePageBoundaries()} is off
 *   <li>sectioned documents → one region per section
 *   <li>flat documents → one region from the first to the last content block
 * </ul>
 *
 * <p>Each region is cut by {@link TextWindowSplitter}; chunks never cross a region boundary. Chunk
 * offsets index into the full document text.
 */
@Slf4j
@Component
public class ChunkSplitter {

  /**
   * Splits the document into raw chunks.
   *
   * @param content full document text the structure was parsed from
   * @param structure parsed structure
   * @param options chunk size limits and page handling
   * @return chunks in document order
   */
  public List<RawChunk> split(
      String content, DocumentStructure structure, ChunkingOptions options) {
    List<RawChunk> chunks = new ArrayList<>();

    if (!structure.pages().isEmpty()) {
      if (options.preservePageBoundaries()) {
        for (PageContent page : structure.pages()) {
          splitPageRegion(
              content, page.startOffset(), page.endOffset(), structure.pages(), options, chunks);
        }
      } else {
        List<PageContent> pages = structure.pages();
        splitPageRegion(
            content,
            pages.get(0).startOffset(),
            pages.get(pages.size() - 1).endOffset(),
            pages,
            options,
            chunks);
      }
    } else if (!structure.sections().isEmpty()) {
      List<SectionContent> sections = structure.sections();
      for (int sectionIndex = 0; sectionIndex < sections.size(); sectionIndex++) {
        SectionContent section = sections.get(sectionIndex);
        List<TextWindow> sectionWindows =
            windows(content, section.startOffset(), section.endOffset(), options);
        for (TextWindow window : sectionWindows) {
          addChunk(content, window, chunks, sectionIndex, section.title(), null);
        }
      }
    } else if (!structure.contentBlocks().isEmpty()) {
      List<ContentBlock> blocks = structure.contentBlocks();
      int from = blocks.get(0).startOffset();
      int to = blocks.get(blocks.size() - 1).endOffset();
      for (TextWindow window : windows(content, from, to, options)) {
        addChunk(content, window, chunks, null, null, null);
      }
    }

    log.debug(
        "ChunkSplitter produced {} raw chunks ({} pages, {} sections, {} blocks)",
        chunks.size(),
        structure.pages().size(),
        structure.sections().size(),
        structure.contentBlocks().size());
    return chunks;
  }

  private void splitPageRegion(
      String content,
      int from,
      int to,
      List<PageContent> pages,
      ChunkingOptions options,
      List<RawChunk> chunks) {
    for (TextWindow window : windows(content, from, to, options)) {
      PageContent page = pageAt(pages, window.start());
      addChunk(content, window, chunks, null, null, page);
    }
  }

  private List<TextWindow> windows(String content, int from, int to, ChunkingOptions options) {
    return TextWindowSplitter.split(
        content,
        from,
        to,
        options.maxChunkSize(),
        options.minChunkSize(),
        options.overlapSize());
  }

  private void addChunk(
      String content,
      TextWindow window,
      List<RawChunk> chunks,
      Integer sectionIndex,
      String sectionTitle,
      PageContent page) {
    String text = content.substring(window.start(), window.end()).strip();
    if (text.isEmpty()) {
      return;
    }
    int chunkIndex = chunks.size();
    chunks.add(
        RawChunk.builder()
            .id("chunk_" + chunkIndex)
            .content(text)
            .startIndex(window.start())
            .endIndex(window.end())
            .pageNumber(page != null ? page.number() : null)
            .position(page != null ? page.position() : null)
            .sectionIndex(sectionIndex)
            .sectionTitle(sectionTitle)
            .chunkIndex(chunkIndex)
            .tokenCountEstimate(ChunkScoring.estimateTokenCount(text))
            .build());
  }

  /** Last page starting at or before {@code offset}; windows never start before the first page. */
  private PageContent pageAt(List<PageContent> pages, int offset) {
    PageContent match = pages.get(0);
    for (PageContent page : pages) {
      if (page.startOffset() <= offset) {
        match = page;
      } else {
        break;
      }
    }
    return match;
  }
}
