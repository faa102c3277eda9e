package com.flamingo.ai.knowledgebase.exception;

import java.util.Map;

/** Exception thrown when the generation endpoint answers with a non-success status. */
public class GenerationFailedException extends KnowledgeBaseException {

  public GenerationFailedException(String modelName, int status, String body) {
    super(
        ErrorCode.GENERATION_FAILED,
        "Model '" + modelName + "' request failed with HTTP " + status,
        Map.of("modelName", modelName, "status", status, "body", body == null ? "" : body),
        null);
  }
}
