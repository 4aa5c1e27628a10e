package com.flamingo.ai.visualchunker.service.rag.visual;

import com.flamingo.ai.visualchunker.exception.VisualEnhancementException;
import com.flamingo.ai.visualchunker.service.rag.model.BoundingBox;
import com.flamingo.ai.visualchunker.service.rag.model.ChunkingOptions;
import com.flamingo.ai.visualchunker.service.rag.model.RawChunk;
import com.flamingo.ai.visualchunker.service.rag.model.VisualElement;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Accepts visuals whose bounding-box centre lies within {@link
 * ChunkingOptions#visualProximityThreshold()} of the centre of the chunk's position.
 *
 * <p>Distances are Euclidean, in page coordinate units (~72 units per inch). Positions are
 * page-local, so a visual is only compared when it sits on the chunk's page or an adjacent one;
 * when either page number is unknown the position alone decides.
 */
@Component
@Order(2)
public class SpatialProximityMatcher implements VisualProximityMatcher {

  private static final int MAX_PAGE_DISTANCE = 1;

  @Override
  public boolean matches(RawChunk chunk, VisualElement visual, ChunkingOptions options) {
    if (chunk.position() == null || !visual.hasBoundingBox()) {
      return false;
    }
    if (chunk.pageNumber() != null
        && visual.hasPageNumber()
        && Math.abs(chunk.pageNumber() - visual.pageNumber()) > MAX_PAGE_DISTANCE) {
      return false;
    }
    BoundingBox box = visual.boundingBox();
    if (!box.isWellFormed()) {
      throw new VisualEnhancementException(visual.id(), "Malformed bounding box " + box);
    }
    return chunk.position().centerDistanceTo(box) <= options.visualProximityThreshold();
  }

  @Override
  public String getMatcherName() {
    return "SpatialProximityMatcher";
  }
}
