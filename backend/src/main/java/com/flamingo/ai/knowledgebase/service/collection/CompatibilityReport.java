package com.flamingo.ai.knowledgebase.service.collection;

/**
 * Outcome of a compatibility check.
 *
 * @param storedDimension length of previously stored vectors, or {@code null} if none were stored
 */
public record CompatibilityReport(
    CompatibilityState state,
    String embeddingModel,
    int expectedDimension,
    Integer storedDimension,
    long discardedChunks) {}
