package com.flamingo.ai.knowledgebase.exception;

import java.util.Map;

/** Exception thrown when a document is not found in the collection. */
public class DocumentNotFoundException extends KnowledgeBaseException {

  private final String documentId;

  public DocumentNotFoundException(String documentId) {
    super(
        ErrorCode.DOCUMENT_NOT_FOUND,
        "Document not found: " + documentId,
        Map.of("documentId", documentId),
        null);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
