package com.flamingo.ai.visualchunker.service.rag.model;

import java.util.List;

/**
 * The result of a {@code chunkDocument} call: the chunks in document order and their statistics.
 *
 * @param chunks chunks ready for embedding
 * @param metadata summary statistics
 */
public record ChunkingResult(List<FinalChunk> chunks, ChunkingMetadata metadata) {}
