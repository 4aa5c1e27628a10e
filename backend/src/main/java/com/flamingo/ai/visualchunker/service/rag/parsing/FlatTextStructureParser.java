package com.flamingo.ai.visualchunker.service.rag.parsing;

import com.flamingo.ai.visualchunker.service.rag.model.ContentBlock;
import com.flamingo.ai.visualchunker.service.rag.model.DocumentStructure;
import com.flamingo.ai.visualchunker.service.rag.model.DocumentType;
import com.flamingo.ai.visualchunker.service.rag.model.TextWindow;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * {@link StructureParser} for plain text: blank-line delimited paragraph blocks, no pages or
 * sections.
 *
 * <p>Also the fallback used by {@link StructureParserRouter} when a format-specific parser fails,
 * so it must never throw.
 */
@Component
public class FlatTextStructureParser implements StructureParser {

  @Override
  public DocumentStructure parse(String content) {
    List<ContentBlock> blocks = new ArrayList<>();
    for (TextWindow paragraph : TextSpans.paragraphs(content, 0, content.length())) {
      blocks.add(
          new ContentBlock(
              content.substring(paragraph.start(), paragraph.end()), paragraph.start()));
    }
    return DocumentStructure.ofBlocks(blocks);
  }

  @Override
  public boolean supports(DocumentType documentType) {
    return documentType == DocumentType.FLAT;
  }
}
