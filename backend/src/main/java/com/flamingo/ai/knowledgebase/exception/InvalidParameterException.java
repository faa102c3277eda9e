package com.flamingo.ai.knowledgebase.exception;

import java.util.Map;

/** Exception thrown when a request parameter is missing or outside its allowed range. */
public class InvalidParameterException extends KnowledgeBaseException {

  public InvalidParameterException(String parameter, Object value, String allowed) {
    super(
        ErrorCode.INVALID_PARAMETER,
        "Invalid value for '" + parameter + "': " + value + " (allowed: " + allowed + ")",
        Map.of("parameter", parameter, "value", String.valueOf(value), "allowed", allowed),
        null);
  }
}
