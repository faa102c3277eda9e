package com.flamingo.ai.knowledgebase.service.embedding;

/** Where a vector came from; stored with every chunk. */
public enum EmbeddingSource {
  /** Produced by the configured embedding model. */
  REMOTE,
  /** Hash-derived stand-in used while the embedding endpoint was unavailable. */
  FALLBACK
}
