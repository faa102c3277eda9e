package com.flamingo.ai.knowledgebase.service.rag;

import com.flamingo.ai.knowledgebase.service.retrieval.RetrievedChunk;

/** A chunk the answer was grounded on. */
public record SourceAttribution(
    String filename, int chunkIndex, double distance, String contentPreview) {

  private static final int PREVIEW_LENGTH = 100;

  public static SourceAttribution of(RetrievedChunk chunk) {
    String content = chunk.content();
    String preview =
        content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) + "..." : content;
    return new SourceAttribution(chunk.filename(), chunk.chunkIndex(), chunk.distance(), preview);
  }
}
