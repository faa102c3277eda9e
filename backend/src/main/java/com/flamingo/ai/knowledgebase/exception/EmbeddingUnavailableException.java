package com.flamingo.ai.knowledgebase.exception;

import java.util.Map;

/** Exception thrown when a model's vector length cannot be determined because it is unreachable. */
public class EmbeddingUnavailableException extends KnowledgeBaseException {

  public EmbeddingUnavailableException(String modelName, Throwable cause) {
    super(
        ErrorCode.EMBEDDING_UNAVAILABLE,
        "Embedding model '" + modelName + "' could not be reached",
        Map.of("modelName", modelName),
        cause);
  }
}
