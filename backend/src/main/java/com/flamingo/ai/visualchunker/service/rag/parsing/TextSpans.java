package com.flamingo.ai.visualchunker.service.rag.parsing;

import com.flamingo.ai.visualchunker.service.rag.model.TextWindow;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Offset-preserving helpers shared by the structure parsers. */
final class TextSpans {

  /** A real blank line: newline, optional whitespace, newline. */
  static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");

  private TextSpans() {}

  /**
   * Narrows {@code [from, to)} to its non-whitespace core.
   *
   * @return the trimmed window, or {@code null} if the range is blank
   */
  static TextWindow trim(String content, int from, int to) {
    int start = from;
    int end = to;
    while (start < end && Character.isWhitespace(content.charAt(start))) {
      start++;
    }
    while (end > start && Character.isWhitespace(content.charAt(end - 1))) {
      end--;
    }
    return start < end ? new TextWindow(start, end) : null;
  }

  /**
   * Splits {@code [from, to)} on blank lines.
   *
   * @return trimmed, non-blank paragraph windows in document order
   */
  static List<TextWindow> paragraphs(String content, int from, int to) {
    List<TextWindow> paragraphs = new ArrayList<>();
    Matcher matcher = BLANK_LINE.matcher(content).region(from, to);
    int previous = from;
    while (matcher.find()) {
      addIfNotBlank(paragraphs, trim(content, previous, matcher.start()));
      previous = matcher.end();
    }
    addIfNotBlank(paragraphs, trim(content, previous, to));
    return paragraphs;
  }

  private static void addIfNotBlank(List<TextWindow> windows, TextWindow window) {
    if (window != null) {
      windows.add(window);
    }
  }
}
