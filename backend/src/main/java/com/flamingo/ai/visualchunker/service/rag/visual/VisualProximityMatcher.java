package com.flamingo.ai.visualchunker.service.rag.visual;

import com.flamingo.ai.visualchunker.service.rag.model.ChunkingOptions;
import com.flamingo.ai.visualchunker.service.rag.model.RawChunk;
import com.flamingo.ai.visualchunker.service.rag.model.VisualElement;

/**
 * Strategy deciding whether a visual element is "nearby" a text chunk.
 *
 * <p>{@link VisualContextEnhancer} combines all registered matchers with OR semantics: a visual is
 * associated with a chunk as soon as one matcher accepts it. A matcher whose inputs are missing
 * (e.g. no page number on either side) must return {@code false} rather than guess.
 */
public interface VisualProximityMatcher {

  /**
   * Tests a chunk/visual pair.
   *
   * @param chunk the text chunk
   * @param visual the candidate visual
   * @param options per-call options (proximity threshold)
   * @return {@code true} if the visual belongs with the chunk
   * @throws com.flamingo.ai.visualchunker.exception.VisualEnhancementException if the visual's
   *     metadata is malformed; the visual is then skipped for this chunk
   */
  boolean matches(RawChunk chunk, VisualElement visual, ChunkingOptions options);

  /**
   * Returns a human-readable name of this matcher for logging and debugging.
   *
   * @return matcher name
   */
  String getMatcherName();
}
