package com.flamingo.ai.knowledgebase.service.indexing;

/** How an indexing run ended. */
public enum IndexingOutcome {
  SUCCEEDED,
  FAILED,
  CANCELLED
}
