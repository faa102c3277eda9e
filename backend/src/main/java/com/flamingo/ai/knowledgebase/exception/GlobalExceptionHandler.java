package com.flamingo.ai.knowledgebase.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(KnowledgeBaseException.class)
  public ResponseEntity<ApiError> handleKnowledgeBase(
      KnowledgeBaseException ex, HttpServletRequest request) {

    ErrorCode errorCode = ex.getErrorCode();
    HttpStatus status = statusFor(errorCode);
    incrementErrorCounter(errorCode.name().toLowerCase());
    String errorId = generateErrorId();
    if (status.is5xxServerError()) {
      log.error("{} [{}]: {}", errorCode.getCode(), errorId, ex.getMessage(), ex);
    } else {
      log.warn("{} [{}]: {}", errorCode.getCode(), errorId, ex.getMessage());
    }

    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(errorCode.getCode())
                .message(ex.getUserMessage())
                .details(ex.getDetails())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
                .details(Map.of())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .details(Map.of())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  static HttpStatus statusFor(ErrorCode errorCode) {
    return switch (errorCode) {
      case UNSUPPORTED_FORMAT, EMPTY_CONTENT, CORRUPT_FILE, ENCODING_ERROR, CHUNK_SPLIT_FAILED ->
          HttpStatus.UNPROCESSABLE_ENTITY;
      case FILE_TOO_LARGE -> HttpStatus.PAYLOAD_TOO_LARGE;
      case INVALID_PARAMETER -> HttpStatus.BAD_REQUEST;
      case DOCUMENT_NOT_FOUND, NO_RELEVANT_DOCUMENTS -> HttpStatus.NOT_FOUND;
      case DIMENSION_INCOMPATIBLE, OPERATION_CANCELLED -> HttpStatus.CONFLICT;
      case GENERATION_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
      case GENERATION_UNAVAILABLE, STORE_FAILURE, EMBEDDING_UNAVAILABLE ->
          HttpStatus.SERVICE_UNAVAILABLE;
      case GENERATION_FAILED, MALFORMED_STREAM -> HttpStatus.BAD_GATEWAY;
    };
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
