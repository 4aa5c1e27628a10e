package com.flamingo.ai.visualchunker.service.rag.visual;

import com.flamingo.ai.visualchunker.service.rag.model.ChunkingOptions;
import com.flamingo.ai.visualchunker.service.rag.model.RawChunk;
import com.flamingo.ai.visualchunker.service.rag.model.VisualElement;
import java.util.Locale;
import java.util.stream.Stream;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Accepts visuals whose title or description is quoted in the chunk text (case-insensitive).
 *
 * <p>Fallback for visuals that carry neither a page number nor a bounding box.
 */
@Component
@Order(3)
public class TextualRelevanceMatcher implements VisualProximityMatcher {

  @Override
  public boolean matches(RawChunk chunk, VisualElement visual, ChunkingOptions options) {
    String text = chunk.content().toLowerCase(Locale.ROOT);
    return Stream.of(visual.title(), visual.description())
        .filter(term -> term != null && !term.isBlank())
        .anyMatch(term -> text.contains(term.strip().toLowerCase(Locale.ROOT)));
  }

  @Override
  public String getMatcherName() {
    return "TextualRelevanceMatcher";
  }
}
