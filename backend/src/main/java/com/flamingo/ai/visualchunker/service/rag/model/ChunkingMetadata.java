package com.flamingo.ai.visualchunker.service.rag.model;

import java.util.SortedMap;

/**
 * Summary statistics over the chunks of one {@code chunkDocument} call.
 *
 * @param totalChunks number of chunks returned
 * @param averageChunkSize mean content length, rounded; 0 when there are no chunks
 * @param visualContextChunks chunks with at least one visual reference
 * @param pageDistribution page number to chunk count; chunks without a page are not counted
 * @param processingTimeMs wall-clock time of the call
 */
public record ChunkingMetadata(
    int totalChunks,
    long averageChunkSize,
    int visualContextChunks,
    SortedMap<Integer, Integer> pageDistribution,
    long processingTimeMs) {}
