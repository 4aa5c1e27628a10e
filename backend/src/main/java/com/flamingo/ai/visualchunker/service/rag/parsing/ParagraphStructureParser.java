package com.flamingo.ai.visualchunker.service.rag.parsing;

import com.flamingo.ai.visualchunker.service.rag.model.DocumentStructure;
import com.flamingo.ai.visualchunker.service.rag.model.DocumentType;
import com.flamingo.ai.visualchunker.service.rag.model.SectionContent;
import com.flamingo.ai.visualchunker.service.rag.model.TextWindow;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * {@link StructureParser} for office-document text (DOCX, ODT).
 *
 * <p>Each blank-line delimited paragraph becomes a pseudo-section titled {@code Section N}. Splits
 * on real line breaks, not on the two-character sequence backslash-n.
 */
@Component
public class ParagraphStructureParser implements StructureParser {

  @Override
  public DocumentStructure parse(String content) {
    List<SectionContent> sections = new ArrayList<>();
    for (TextWindow paragraph : TextSpans.paragraphs(content, 0, content.length())) {
      sections.add(
          new SectionContent(
              "Section " + (sections.size() + 1),
              1,
              content.substring(paragraph.start(), paragraph.end()),
              paragraph.start(),
              paragraph.end()));
    }
    return DocumentStructure.ofSections(sections);
  }

  @Override
  public boolean supports(DocumentType documentType) {
    return documentType == DocumentType.STRUCTURED;
  }
}
