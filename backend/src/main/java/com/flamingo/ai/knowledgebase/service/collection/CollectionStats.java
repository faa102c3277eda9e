package com.flamingo.ai.knowledgebase.service.collection;

/**
 * Summary of the collection for health and statistics output.
 *
 * @param compatible whether the collection was built with the active embedding model
 */
public record CollectionStats(
    String name,
    boolean exists,
    long chunkCount,
    long documentCount,
    long fallbackChunkCount,
    String embeddingModel,
    int dimension,
    String location,
    boolean compatible) {}
