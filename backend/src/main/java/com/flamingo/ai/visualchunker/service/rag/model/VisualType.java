package com.flamingo.ai.visualchunker.service.rag.model;

/** Kind of visual element reported by the visual-extraction collaborator. */
public enum VisualType {
  CHART,
  TABLE,
  IMAGE,
  DIAGRAM,
  OTHER
}
