package com.flamingo.ai.knowledgebase.exception;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Structured details such as file path, model name or dimensions. */
  private final Map<String, Object> details;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
