package com.flamingo.ai.knowledgebase.exception;

import java.nio.file.Path;
import java.util.Map;

/** Exception thrown when text cannot be extracted from a source file. */
public class DocumentReadException extends KnowledgeBaseException {

  private final Path filePath;

  public DocumentReadException(ErrorCode errorCode, Path filePath, String message) {
    this(errorCode, filePath, message, null);
  }

  public DocumentReadException(
      ErrorCode errorCode, Path filePath, String message, Throwable cause) {
    super(errorCode, message, Map.of("filePath", String.valueOf(filePath)), cause);
    this.filePath = filePath;
  }

  public Path getFilePath() {
    return filePath;
  }
}
