package com.flamingo.ai.visualchunker.service.rag.model;

/** Coarse classification of a chunk by the weight of its associated visuals. */
public enum SectionType {
  TEXT,
  MIXED,
  VISUAL_HEAVY;

  private static final double VISUAL_HEAVY_THRESHOLD = 0.6;
  private static final double MIXED_THRESHOLD = 0.2;

  /**
   * Classifies a chunk by its visual density.
   *
   * @param visualDensity density in {@code [0,1]}
   * @return {@link #VISUAL_HEAVY} above 0.6, {@link #MIXED} above 0.2, otherwise {@link #TEXT}
   */
  public static SectionType fromVisualDensity(double visualDensity) {
    if (visualDensity > VISUAL_HEAVY_THRESHOLD) {
      return VISUAL_HEAVY;
    }
    if (visualDensity > MIXED_THRESHOLD) {
      return MIXED;
    }
    return TEXT;
  }
}
