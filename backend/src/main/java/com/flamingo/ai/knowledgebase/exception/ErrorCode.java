package com.flamingo.ai.knowledgebase.exception;

import lombok.Getter;

/** Stable error codes surfaced to callers, grouped by where the failure originated. */
@Getter
public enum ErrorCode {

  // Ingestion
  UNSUPPORTED_FORMAT("INGEST_001", Category.INGESTION, "This file format is not supported"),
  EMPTY_CONTENT("INGEST_002", Category.INGESTION, "The document contains no readable text"),
  CORRUPT_FILE("INGEST_003", Category.INGESTION, "The file is damaged or cannot be opened"),
  ENCODING_ERROR("INGEST_004", Category.INGESTION, "The text encoding could not be detected"),
  FILE_TOO_LARGE("INGEST_005", Category.INGESTION, "The file exceeds the maximum allowed size"),

  // Indexing
  DIMENSION_INCOMPATIBLE(
      "INDEX_001", Category.INDEXING, "The embedding model does not match the stored index"),
  CHUNK_SPLIT_FAILED("INDEX_002", Category.INDEXING, "The document could not be split into chunks"),
  STORE_FAILURE("INDEX_003", Category.INDEXING, "The vector collection is not available"),
  DOCUMENT_NOT_FOUND("INDEX_004", Category.INDEXING, "Document not found in the index"),
  EMBEDDING_UNAVAILABLE(
      "INDEX_005", Category.INDEXING, "The embedding model is not reachable"),

  // Retrieval and generation
  NO_RELEVANT_DOCUMENTS(
      "QA_001", Category.RETRIEVAL, "No relevant documents were found for the question"),
  GENERATION_UNAVAILABLE("QA_002", Category.GENERATION, "The language model is not reachable"),
  GENERATION_TIMEOUT("QA_003", Category.GENERATION, "The language model did not answer in time"),
  GENERATION_FAILED("QA_004", Category.GENERATION, "The language model returned an error"),
  INVALID_PARAMETER("QA_005", Category.GENERATION, "A request parameter is out of range"),
  MALFORMED_STREAM("QA_006", Category.GENERATION, "The streamed answer could not be read"),

  OPERATION_CANCELLED("OP_001", Category.OPERATION, "The operation was cancelled");

  /** Where a failure originated. */
  public enum Category {
    INGESTION,
    INDEXING,
    RETRIEVAL,
    GENERATION,
    OPERATION
  }

  private final String code;
  private final Category category;
  private final String userMessage;

  ErrorCode(String code, Category category, String userMessage) {
    this.code = code;
    this.category = category;
    this.userMessage = userMessage;
  }
}
