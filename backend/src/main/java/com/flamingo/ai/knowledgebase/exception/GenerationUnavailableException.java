package com.flamingo.ai.knowledgebase.exception;

import java.util.Map;

/** Exception thrown when the generation endpoint cannot be reached. */
public class GenerationUnavailableException extends KnowledgeBaseException {

  public GenerationUnavailableException(String baseUrl, Throwable cause) {
    super(
        ErrorCode.GENERATION_UNAVAILABLE,
        "Cannot connect to generation endpoint at " + baseUrl,
        Map.of("baseUrl", baseUrl),
        cause);
  }
}
