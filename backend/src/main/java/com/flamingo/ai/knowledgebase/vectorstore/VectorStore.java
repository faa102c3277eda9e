package com.flamingo.ai.knowledgebase.vectorstore;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Persistence port for named vector collections.
 *
 * <p>Implementations throw {@link com.flamingo.ai.knowledgebase.exception.VectorStoreException}
 * when the backing store cannot be read or written. Distances are cosine distances, returned in
 * ascending order.
 */
public interface VectorStore {

  boolean exists(String collection);

  void create(CollectionMetadata metadata);

  /** Removes the collection and all its rows; no-op when absent. */
  void drop(String collection);

  Optional<CollectionMetadata> metadata(String collection);

  /** Length of the vector of any one stored row, empty when the collection has no rows. */
  OptionalInt sampleStoredDimension(String collection);

  /** Inserts or replaces rows by id. */
  void upsert(String collection, List<StoredChunk> chunks);

  List<String> findIdsByDocumentId(String collection, String documentId);

  List<String> listIds(String collection);

  void deleteByIds(String collection, List<String> ids);

  List<NearestMatch> nearest(String collection, float[] query, int limit);

  long count(String collection);

  long distinctDocumentCount(String collection);

  /** Rows whose {@value StoredChunk#EMBEDDING_SOURCE} metadata equals the given value. */
  long countByEmbeddingSource(String collection, String source);

  /** Human readable location of the store, for statistics and health output. */
  String location();
}
