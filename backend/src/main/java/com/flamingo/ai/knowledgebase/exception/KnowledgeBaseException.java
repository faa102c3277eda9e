package com.flamingo.ai.knowledgebase.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for failures the knowledge base surfaces to callers.
 *
 * <p>Carries a stable {@link ErrorCode} plus structured details (file path, model name, expected
 * and actual dimension, ...) so that the presentation layer can render a precise message.
 */
public class KnowledgeBaseException extends RuntimeException {

  private final ErrorCode errorCode;
  private final Map<String, Object> details;

  public KnowledgeBaseException(ErrorCode errorCode, String message) {
    this(errorCode, message, Map.of(), null);
  }

  public KnowledgeBaseException(
      ErrorCode errorCode, String message, Map<String, ?> details, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
    this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public Map<String, Object> getDetails() {
    return details;
  }

  public String getUserMessage() {
    return errorCode.getUserMessage();
  }
}
