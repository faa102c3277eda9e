package com.flamingo.ai.knowledgebase.exception;

import java.util.Map;

/** Exception thrown by search entry points when nothing clears the similarity threshold. */
public class NoRelevantDocumentsException extends KnowledgeBaseException {

  public NoRelevantDocumentsException(String query, double minSimilarity) {
    super(
        ErrorCode.NO_RELEVANT_DOCUMENTS,
        "No chunk reached similarity " + minSimilarity + " for query",
        Map.of("query", query, "minSimilarity", minSimilarity),
        null);
  }
}
