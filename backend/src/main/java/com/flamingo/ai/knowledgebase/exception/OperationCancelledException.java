package com.flamingo.ai.knowledgebase.exception;

import java.util.Map;

/** Exception raised at a cancellation checkpoint after the operation's token was cancelled. */
public class OperationCancelledException extends KnowledgeBaseException {

  private final String tokenId;

  public OperationCancelledException(String tokenId, String reason) {
    super(
        ErrorCode.OPERATION_CANCELLED,
        "Operation " + tokenId + " cancelled: " + reason,
        Map.of("tokenId", tokenId, "reason", reason == null ? "" : reason),
        null);
    this.tokenId = tokenId;
  }

  public String getTokenId() {
    return tokenId;
  }
}
