package com.flamingo.ai.knowledgebase.exception;

import java.util.Map;

/** Exception thrown when chunking parameters are invalid or a document yields no chunks. */
public class ChunkSplitException extends KnowledgeBaseException {

  public ChunkSplitException(String message, Map<String, ?> details) {
    super(ErrorCode.CHUNK_SPLIT_FAILED, message, details, null);
  }
}
