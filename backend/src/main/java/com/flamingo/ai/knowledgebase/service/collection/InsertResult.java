package com.flamingo.ai.knowledgebase.service.collection;

import com.flamingo.ai.knowledgebase.service.embedding.EmbeddingSource;

/** Rows written for one document. */
public record InsertResult(
    String documentId, int chunkCount, int dimension, EmbeddingSource embeddingSource) {}
