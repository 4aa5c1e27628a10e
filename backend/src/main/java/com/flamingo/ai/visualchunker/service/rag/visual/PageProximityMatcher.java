package com.flamingo.ai.visualchunker.service.rag.visual;

import com.flamingo.ai.visualchunker.exception.VisualEnhancementException;
import com.flamingo.ai.visualchunker.service.rag.model.ChunkingOptions;
import com.flamingo.ai.visualchunker.service.rag.model.RawChunk;
import com.flamingo.ai.visualchunker.service.rag.model.VisualElement;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Accepts visuals on the chunk's own page or an adjacent one. */
@Component
@Order(1)
public class PageProximityMatcher implements VisualProximityMatcher {

  private static final int MAX_PAGE_DISTANCE = 1;

  @Override
  public boolean matches(RawChunk chunk, VisualElement visual, ChunkingOptions options) {
    if (chunk.pageNumber() == null || !visual.hasPageNumber()) {
      return false;
    }
    if (visual.pageNumber() < 1) {
      throw new VisualEnhancementException(
          visual.id(), "Page number must be 1-based, was " + visual.pageNumber());
    }
    return Math.abs(chunk.pageNumber() - visual.pageNumber()) <= MAX_PAGE_DISTANCE;
  }

  @Override
  public String getMatcherName() {
    return "PageProximityMatcher";
  }
}
