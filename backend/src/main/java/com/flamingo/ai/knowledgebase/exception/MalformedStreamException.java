package com.flamingo.ai.knowledgebase.exception;

import java.util.Map;

/** Exception thrown when a streamed answer ends without a single readable fragment. */
public class MalformedStreamException extends KnowledgeBaseException {

  public MalformedStreamException(String modelName, int skippedLines) {
    super(
        ErrorCode.MALFORMED_STREAM,
        "Stream from model '" + modelName + "' contained no readable fragment",
        Map.of("modelName", modelName, "skippedLines", skippedLines),
        null);
  }
}
