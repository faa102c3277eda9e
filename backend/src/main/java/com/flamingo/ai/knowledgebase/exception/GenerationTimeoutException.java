package com.flamingo.ai.knowledgebase.exception;

import java.time.Duration;
import java.util.Map;

/** Exception thrown when the generation endpoint does not answer within the configured time. */
public class GenerationTimeoutException extends KnowledgeBaseException {

  public GenerationTimeoutException(String modelName, Duration timeout, Throwable cause) {
    super(
        ErrorCode.GENERATION_TIMEOUT,
        "Model '" + modelName + "' did not answer within " + timeout.toSeconds() + "s",
        Map.of("modelName", modelName, "timeoutSeconds", timeout.toSeconds()),
        cause);
  }
}
