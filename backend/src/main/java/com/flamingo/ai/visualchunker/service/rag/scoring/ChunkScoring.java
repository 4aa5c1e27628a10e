package com.flamingo.ai.visualchunker.service.rag.scoring;

import com.flamingo.ai.visualchunker.service.rag.model.VisualElement;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Content heuristics shared by the enhancement and optimization stages.
 *
 * <p>All methods are pure functions of their arguments.
 */
public final class ChunkScoring {

  /** Area attributed to a visual without a usable bounding box, in square units. */
  public static final double DEFAULT_VISUAL_AREA = 1000.0;

  /** Area attributed to one character of text, in square units. */
  public static final double TEXT_AREA_PER_CHAR = 10.0;

  public static final double BASE_IMPORTANCE = 0.5;

  private static final double TOKENS_PER_WORD = 1.3;
  private static final double IMPORTANCE_PER_VISUAL = 0.1;
  private static final double KEYWORD_IMPORTANCE_BOOST = 0.2;
  private static final double READABLE_SENTENCE_WORDS = 15.0;
  private static final double READABILITY_SPAN_WORDS = 30.0;

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");
  private static final Pattern IMPORTANCE_KEYWORDS =
      Pattern.compile("\\b(important|key)\\b", Pattern.CASE_INSENSITIVE);

  private ChunkScoring() {}

  /**
   * Approximates language-model tokens as {@code ceil(words * 1.3)}.
   *
   * @param text chunk text
   * @return estimated token count, 0 for blank text
   */
  public static int estimateTokenCount(String text) {
    return (int) Math.ceil(countWords(text) * TOKENS_PER_WORD);
  }

  /**
   * Scores readability from the average sentence length: {@code clamp(1 - (avg - 15) / 30, 0,
   * 1)}.
   *
   * <p>Text without a sentence terminator counts as one sentence. Blank text scores 1.
   *
   * @param text chunk text
   * @return readability in {@code [0,1]}
   */
  public static double readabilityScore(String text) {
    int words = countWords(text);
    if (words == 0) {
      return 1.0;
    }
    int sentences = Math.max(1, sentences(text).size());
    double avgSentenceLength = (double) words / sentences;
    double score = 1 - (avgSentenceLength - READABLE_SENTENCE_WORDS) / READABILITY_SPAN_WORDS;
    return clamp(score);
  }

  /**
   * Produces one {@code sentence_<i>} marker per non-blank sentence, {@code i} being the position
   * of the sentence among all split pieces.
   *
   * @param text chunk text
   * @return boundary markers in order
   */
  public static List<String> semanticBoundaries(String text) {
    String[] pieces = SENTENCE_SPLIT.split(text);
    List<String> boundaries = new ArrayList<>();
    for (int i = 0; i < pieces.length; i++) {
      if (!pieces[i].isBlank()) {
        boundaries.add("sentence_" + i);
      }
    }
    return boundaries;
  }

  /**
   * Base importance 0.5, plus 0.1 per associated visual, plus 0.2 when the text mentions
   * "important" or "key"; capped at 1.
   *
   * @param text chunk text
   * @param visualCount number of associated visuals
   * @return importance in {@code [0,1]}
   */
  public static double importance(String text, int visualCount) {
    double importance = BASE_IMPORTANCE + visualCount * IMPORTANCE_PER_VISUAL;
    if (IMPORTANCE_KEYWORDS.matcher(text).find()) {
      importance += KEYWORD_IMPORTANCE_BOOST;
    }
    return Math.min(importance, 1.0);
  }

  /**
   * Estimates the share of a chunk's area occupied by its visuals: {@code visualArea / (visualArea
   * + length * 10)}.
   *
   * @param contentLength chunk length in characters
   * @param visuals associated visuals
   * @return density in {@code [0,1]}; 0 without visuals
   */
  public static double visualDensity(int contentLength, List<VisualElement> visuals) {
    if (visuals.isEmpty()) {
      return 0.0;
    }
    double visualArea = 0;
    for (VisualElement visual : visuals) {
      visualArea += visualArea(visual);
    }
    double textArea = contentLength * TEXT_AREA_PER_CHAR;
    if (visualArea + textArea <= 0) {
      return 0.0;
    }
    return clamp(visualArea / (visualArea + textArea));
  }

  private static double visualArea(VisualElement visual) {
    if (visual.hasBoundingBox() && visual.boundingBox().isWellFormed()) {
      return visual.boundingBox().area();
    }
    return DEFAULT_VISUAL_AREA;
  }

  private static List<String> sentences(String text) {
    List<String> sentences = new ArrayList<>();
    for (String piece : SENTENCE_SPLIT.split(text)) {
      if (!piece.isBlank()) {
        sentences.add(piece);
      }
    }
    return sentences;
  }

  private static int countWords(String text) {
    String trimmed = text.strip();
    if (trimmed.isEmpty()) {
      return 0;
    }
    return WHITESPACE.split(trimmed).length;
  }

  private static double clamp(double value) {
    return Math.min(Math.max(value, 0.0), 1.0);
  }
}
