package com.flamingo.ai.knowledgebase.service.retrieval;

import com.flamingo.ai.knowledgebase.vectorstore.StoredChunk;
import java.util.Map;

/** A chunk selected for a question, with its distance and derived similarity. */
public record RetrievedChunk(
    String id, String content, Map<String, Object> metadata, double distance) {

  /** {@code 1 - distance}; cosine distance makes this the cosine similarity. */
  public double similarity() {
    return 1.0 - distance;
  }

  public String filename() {
    Object filename = metadata.get(StoredChunk.FILENAME);
    return filename == null ? "unknown" : filename.toString();
  }

  public int chunkIndex() {
    Object index = metadata.get(StoredChunk.CHUNK_INDEX);
    return index instanceof Number number ? number.intValue() : -1;
  }
}
