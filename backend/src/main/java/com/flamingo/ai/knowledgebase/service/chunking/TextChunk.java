package com.flamingo.ai.knowledgebase.service.chunking;

/** A slice of one document's text, addressed as {@code {documentId}_{index}}. */
public record TextChunk(String documentId, int index, String text) {

  public String id() {
    return idOf(documentId, index);
  }

  public static String idOf(String documentId, int index) {
    return documentId + "_" + index;
  }
}
