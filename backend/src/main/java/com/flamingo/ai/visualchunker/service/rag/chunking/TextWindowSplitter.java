package com.flamingo.ai.visualchunker.service.rag.chunking;

import com.flamingo.ai.visualchunker.service.rag.model.TextWindow;
import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a contiguous text region into bounded, overlapping windows.
 *
 * <p>Each window is at most {@code maxSize} characters. A window that is not the last one of the
 * region ends, in order of preference:
 *
 * <ol>
 *   <li>right after the last {@code .} followed by whitespace, at or beyond {@code minSize}
 *   <li>at the last whitespace at or beyond {@code minSize} (word boundary)
 *   <li>at {@code maxSize} (hard cut)
 * </ol>
 *
 * <p>The next window starts {@code overlap} characters before the previous end. When that would not
 * move the cursor forward the overlap is dropped, so the walk always terminates.
 */
public final class TextWindowSplitter {

  private TextWindowSplitter() {}

  /**
   * Splits {@code [from, to)} of {@code text}.
   *
   * @param text text the region belongs to
   * @param from inclusive region start
   * @param to exclusive region end
   * @param maxSize maximum window length, positive
   * @param minSize minimum length of a non-final window
   * @param overlap characters shared by consecutive windows
   * @return windows in order, with offsets into {@code text}
   */
  public static List<TextWindow> split(
      String text, int from, int to, int maxSize, int minSize, int overlap) {
    List<TextWindow> windows = new ArrayList<>();
    int cursor = from;
    while (cursor < to && Character.isWhitespace(text.charAt(cursor))) {
      cursor++;
    }

    while (cursor < to) {
      int hardEnd = Math.min(cursor + maxSize, to);
      int end = hardEnd < to ? preferredEnd(text, cursor, hardEnd, minSize) : hardEnd;
      windows.add(new TextWindow(cursor, end));
      if (end >= to) {
        break;
      }
      int next = end - overlap;
      cursor = next > cursor ? next : end;
    }
    return windows;
  }

  private static int preferredEnd(String text, int cursor, int hardEnd, int minSize) {
    int floor = Math.max(cursor + minSize, cursor + 1);

    for (int i = hardEnd - 1; i >= floor - 1 && i > cursor; i--) {
      if (text.charAt(i) == '.' && Character.isWhitespace(text.charAt(i + 1))) {
        return i + 1;
      }
    }
    for (int i = hardEnd; i >= floor; i--) {
      if (Character.isWhitespace(text.charAt(i))) {
        return i;
      }
    }
    return hardEnd;
  }
}
