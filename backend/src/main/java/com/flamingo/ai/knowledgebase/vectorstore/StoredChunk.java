package com.flamingo.ai.knowledgebase.vectorstore;

import java.util.Map;

/** One row of a collection: chunk text, its vector and descriptive metadata. */
public record StoredChunk(
    String id, String documentId, String content, float[] vector, Map<String, Object> metadata) {

  public static final String FILENAME = "filename";
  public static final String FILE_PATH = "file_path";
  public static final String FILE_TYPE = "file_type";
  public static final String FILE_SIZE = "file_size";
  public static final String CHUNK_INDEX = "chunk_index";
  public static final String DOCUMENT_ID = "document_id";
  public static final String CREATED_AT = "created_at";
  public static final String EMBEDDING_SOURCE = "embedding_source";
  public static final String EMBEDDING_MODEL = "embedding_model";

  public StoredChunk {
    metadata = Map.copyOf(metadata);
  }

  public int dimension() {
    return vector.length;
  }
}
