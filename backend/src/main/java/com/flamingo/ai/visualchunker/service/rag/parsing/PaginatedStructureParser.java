package com.flamingo.ai.visualchunker.service.rag.parsing;

import com.flamingo.ai.visualchunker.service.rag.model.BoundingBox;
import com.flamingo.ai.visualchunker.service.rag.model.DocumentStructure;
import com.flamingo.ai.visualchunker.service.rag.model.DocumentType;
import com.flamingo.ai.visualchunker.service.rag.model.PageContent;
import com.flamingo.ai.visualchunker.service.rag.model.TextWindow;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link StructureParser} for extracted PDF text.
 *
 * <p>Recognised page-break markers:
 *
 * <ul>
 *   <li>a form feed character ({@code \f})
 *   <li>a line holding only {@code \page}
 *   <li>a line holding only {@code Page N}, {@code Page N of M} or {@code --- Page N ---}
 * </ul>
 *
 * <p>Non-blank pages are numbered from 1 in document order; the whitespace between two adjacent
 * markers (e.g. a form feed followed by a {@code Page 2} header line) is not a page. Content
 * without any marker is a single page.
 */
@Slf4j
@Component
public class PaginatedStructureParser implements StructureParser {

  private static final Pattern PAGE_BREAK =
      Pattern.compile(
          "\\f|^[ \\t]*(?:\\\\page"
              + "|-*[ \\t]*page[ \\t]+\\d+(?:[ \\t]+of[ \\t]+\\d+)?[ \\t]*-*)[ \\t]*$",
          Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

  @Override
  public DocumentStructure parse(String content) {
    List<PageContent> pages = new ArrayList<>();
    Matcher matcher = PAGE_BREAK.matcher(content);
    int previous = 0;
    int markers = 0;

    while (matcher.find()) {
      markers++;
      TextWindow page = TextSpans.trim(content, previous, matcher.start());
      if (page != null) {
        pages.add(toPage(content, page, pages.size() + 1));
      }
      previous = matcher.end();
    }
    TextWindow lastPage = TextSpans.trim(content, previous, content.length());
    if (lastPage != null) {
      pages.add(toPage(content, lastPage, pages.size() + 1));
    }

    log.debug("Detected {} page-break markers, {} non-blank pages", markers, pages.size());
    return DocumentStructure.ofPages(pages);
  }

  @Override
  public boolean supports(DocumentType documentType) {
    return documentType == DocumentType.PAGINATED;
  }

  private PageContent toPage(String content, TextWindow window, int number) {
    return new PageContent(
        number,
        content.substring(window.start(), window.end()),
        window.start(),
        BoundingBox.A4_PAGE);
  }
}
