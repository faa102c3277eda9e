package com.flamingo.ai.knowledgebase.exception;

import java.util.Map;

/** Exception thrown when the backing vector store cannot be read or written. */
public class VectorStoreException extends KnowledgeBaseException {

  public VectorStoreException(String collectionName, String message, Throwable cause) {
    super(ErrorCode.STORE_FAILURE, message, Map.of("collection", collectionName), cause);
  }
}
