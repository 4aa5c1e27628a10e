package com.flamingo.ai.visualchunker.service.rag.parsing;

import com.flamingo.ai.visualchunker.exception.StructureParseException;
import com.flamingo.ai.visualchunker.service.rag.model.DocumentStructure;
import com.flamingo.ai.visualchunker.service.rag.model.DocumentType;
import com.flamingo.ai.visualchunker.service.rag.model.SectionContent;
import com.flamingo.ai.visualchunker.service.rag.model.TextWindow;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link StructureParser} for HTML-like text, sectioned by {@code <h1>}…{@code <h6>} headings.
 *
 * <p>Section layout:
 *
 * <ul>
 *   <li>content before the first heading → implicit untitled section (level 0)
 *   <li>content after a heading, up to the next heading → that heading's section
 *   <li>content after the last heading → the final section
 * </ul>
 *
 * <p>Offsets point at the raw markup, so section content keeps its inline tags. Headings whose body
 * is blank produce no section.
 */
@Slf4j
@Component
public class MarkupStructureParser implements StructureParser {

  private static final Pattern HEADING =
      Pattern.compile(
          "<h([1-6])\\b[^>]*>(.*?)</h\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private static final Pattern OPENING_HEADING =
      Pattern.compile("<h[1-6]\\b[^>]*>", Pattern.CASE_INSENSITIVE);

  private static final Pattern TAG = Pattern.compile("<[^>]*>");

  @Override
  public DocumentStructure parse(String content) {
    List<SectionContent> sections = new ArrayList<>();
    Matcher matcher = HEADING.matcher(content);

    String title = "";
    int level = 0;
    int bodyStart = 0;
    while (matcher.find()) {
      addSection(sections, content, title, level, bodyStart, matcher.start());
      title = TAG.matcher(matcher.group(2)).replaceAll("").strip();
      level = Integer.parseInt(matcher.group(1));
      bodyStart = matcher.end();
    }
    addSection(sections, content, title, level, bodyStart, content.length());

    log.debug("Detected {} markup sections", sections.size());
    return DocumentStructure.ofSections(sections);
  }

  @Override
  public boolean supports(DocumentType documentType) {
    return documentType == DocumentType.MARKUP;
  }

  private void addSection(
      List<SectionContent> sections, String content, String title, int level, int from, int to) {
    Matcher unclosed = OPENING_HEADING.matcher(content).region(from, to);
    if (unclosed.find()) {
      throw new StructureParseException(
          DocumentType.MARKUP, "Unclosed heading tag at offset " + unclosed.start());
    }
    TextWindow body = TextSpans.trim(content, from, to);
    if (body != null) {
      sections.add(
          new SectionContent(
              title, level, content.substring(body.start(), body.end()), body.start(), body.end()));
    }
  }
}
