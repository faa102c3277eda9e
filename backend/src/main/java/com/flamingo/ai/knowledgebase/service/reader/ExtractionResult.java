package com.flamingo.ai.knowledgebase.service.reader;

import com.flamingo.ai.knowledgebase.exception.ErrorCode;

/** Outcome of one extraction attempt; fallback chains stop at the first {@link Success}. */
public sealed interface ExtractionResult {

  static ExtractionResult success(String text, String strategy) {
    return new Success(text, strategy);
  }

  static ExtractionResult failure(ErrorCode errorCode, String message) {
    return new Failure(errorCode, message, null);
  }

  static ExtractionResult failure(ErrorCode errorCode, String message, Throwable cause) {
    return new Failure(errorCode, message, cause);
  }

  default boolean isSuccess() {
    return this instanceof Success;
  }

  /** Extracted text and the name of the strategy that produced it. */
  record Success(String text, String strategy) implements ExtractionResult {}

  record Failure(ErrorCode errorCode, String message, Throwable cause)
      implements ExtractionResult {}
}
