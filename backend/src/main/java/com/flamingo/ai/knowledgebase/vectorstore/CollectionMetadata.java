package com.flamingo.ai.knowledgebase.vectorstore;

import java.time.Instant;

/** Recorded when a collection is created; drives the compatibility check. */
public record CollectionMetadata(
    String name, String embeddingModel, int dimension, Instant createdAt) {}
