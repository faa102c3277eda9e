package com.flamingo.ai.knowledgebase.service.collection;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.domain.Document;
import com.flamingo.ai.knowledgebase.exception.DimensionIncompatibleException;
import com.flamingo.ai.knowledgebase.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledgebase.exception.EmbeddingUnavailableException;
import com.flamingo.ai.knowledgebase.exception.VectorStoreException;
import com.flamingo.ai.knowledgebase.service.chunking.RecursiveTextChunker;
import com.flamingo.ai.knowledgebase.service.chunking.TextChunk;
import com.flamingo.ai.knowledgebase.service.embedding.EmbeddingBatch;
import com.flamingo.ai.knowledgebase.service.embedding.EmbeddingProvider;
import com.flamingo.ai.knowledgebase.service.embedding.EmbeddingSource;
import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import com.flamingo.ai.knowledgebase.vectorstore.CollectionMetadata;
import com.flamingo.ai.knowledgebase.vectorstore.NearestMatch;
import com.flamingo.ai.knowledgebase.vectorstore.StoredChunk;
import com.flamingo.ai.knowledgebase.vectorstore.VectorStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns the named vector collection and keeps its vector length consistent with the active
 * embedding model.
 *
 * <p>Before the first operation, and again whenever the configured embedding model changes, the
 * expected dimension of the active model is compared with a sampled stored vector. A mismatch
 * drops the collection and creates it again, discarding every stored row, since vectors of
 * different length cannot be mixed.
 *
 * <p>Writes are not transactional: an insert that fails half way leaves the rows already written,
 * and an update is a delete followed by an insert.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorCollectionManager {

  /** Rows per store write during one insert; cancellation is checked between writes. */
  static final int WRITE_BATCH_SIZE = 100;

  private final VectorStore vectorStore;
  private final EmbeddingProvider embeddingProvider;
  private final RecursiveTextChunker chunker;
  private final KnowledgeBaseProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  private String checkedModel;

  public String collectionName() {
    return properties.getCollection().getName();
  }

  /** Creates the collection or recreates it when its vectors do not fit the active model. */
  public synchronized CompatibilityReport checkCompatibility() {
    String collection = collectionName();
    String model = embeddingProvider.activeModel();
    int expected;
    try {
      expected = embeddingProvider.expectedDimension(model);
    } catch (EmbeddingUnavailableException e) {
      log.warn(
          "Skipping compatibility check for '{}': model '{}' unavailable", collection, model);
      return new CompatibilityReport(CompatibilityState.UNKNOWN, model, 0, null, 0);
    }

    if (!vectorStore.exists(collection)) {
      createCollection(model, expected);
      checkedModel = model;
      return new CompatibilityReport(CompatibilityState.CREATED, model, expected, null, 0);
    }

    OptionalInt sampled = vectorStore.sampleStoredDimension(collection);
    Integer stored =
        sampled.isPresent()
            ? Integer.valueOf(sampled.getAsInt())
            : vectorStore.metadata(collection).map(CollectionMetadata::dimension).orElse(null);
    if (stored != null && stored != expected) {
      long discarded = vectorStore.count(collection);
      log.warn(
          "Collection '{}' holds {}-dimensional vectors but '{}' produces {}; "
              + "recreating and discarding {} chunk(s)",
          collection,
          stored,
          model,
          expected,
          discarded);
      recreate(model, expected);
      checkedModel = model;
      return new CompatibilityReport(
          CompatibilityState.RECREATED, model, expected, stored, discarded);
    }
    checkedModel = model;
    return new CompatibilityReport(CompatibilityState.COMPATIBLE, model, expected, stored, 0);
  }

  /**
   * Chunks, embeds and stores a document.
   *
   * @throws DimensionIncompatibleException if the vectors do not fit a non-empty collection
   */
  public synchronized InsertResult insert(Document document, CancellationToken token) {
    ensureChecked();
    String collection = collectionName();

    List<TextChunk> chunks = chunker.chunk(document);
    token.throwIfCancelled();
    EmbeddingBatch embeddings =
        embeddingProvider.embed(chunks.stream().map(TextChunk::text).toList(), token);
    token.throwIfCancelled();
    alignDimension(collection, embeddings);

    List<StoredChunk> rows = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      rows.add(toRow(document, chunks.get(i), embeddings));
    }
    for (int from = 0; from < rows.size(); from += WRITE_BATCH_SIZE) {
      if (from > 0) {
        token.throwIfCancelled();
      }
      int to = Math.min(from + WRITE_BATCH_SIZE, rows.size());
      vectorStore.upsert(collection, rows.subList(from, to));
    }

    meterRegistry
        .counter("collection.chunks.inserted", "source", embeddings.source().name())
        .increment(rows.size());
    log.info(
        "Indexed document {} ({}) as {} chunk(s), {} embeddings",
        document.getId(),
        document.fileName(),
        rows.size(),
        embeddings.source());
    return new InsertResult(
        document.getId(), rows.size(), embeddings.dimension(), embeddings.source());
  }

  /**
   * Removes every chunk of a document.
   *
   * @throws DocumentNotFoundException if no chunk references the document
   */
  public synchronized int delete(String documentId) {
    String collection = collectionName();
    if (!vectorStore.exists(collection)) {
      throw new DocumentNotFoundException(documentId);
    }
    List<String> ids = vectorStore.findIdsByDocumentId(collection, documentId);
    if (ids.isEmpty()) {
      throw new DocumentNotFoundException(documentId);
    }
    vectorStore.deleteByIds(collection, ids);
    log.info("Deleted document {} ({} chunk(s))", documentId, ids.size());
    return ids.size();
  }

  /** Replaces a document's chunks; the document is absent between the two steps. */
  public synchronized InsertResult update(
      String documentId, Document replacement, CancellationToken token) {
    delete(documentId);
    return insert(Document.replacing(documentId, replacement), token);
  }

  /**
   * Removes every row. Tries an id-enumerated bulk delete first and falls back to dropping and
   * creating the collection under the same metadata.
   */
  public synchronized void clear() {
    String collection = collectionName();
    if (!vectorStore.exists(collection)) {
      log.debug("Clear requested but collection '{}' does not exist", collection);
      return;
    }
    try {
      List<String> ids = vectorStore.listIds(collection);
      if (ids.isEmpty()) {
        return;
      }
      vectorStore.deleteByIds(collection, ids);
      long remaining = vectorStore.count(collection);
      if (remaining > 0) {
        throw new VectorStoreException(
            collection, remaining + " row(s) left after bulk delete", null);
      }
      log.info("Cleared collection '{}' ({} chunk(s))", collection, ids.size());
    } catch (RuntimeException e) {
      log.warn(
          "Bulk delete of '{}' failed, dropping and recreating it: {}",
          collection,
          e.getMessage());
      CollectionMetadata metadata =
          vectorStore
              .metadata(collection)
              .orElseGet(() -> metadataFor(embeddingProvider.activeModel(), expectedOrZero()));
      vectorStore.drop(collection);
      vectorStore.create(metadataFor(metadata.embeddingModel(), metadata.dimension()));
      meterRegistry.counter("collection.recreated", "reason", "clear").increment();
    }
  }

  /** Nearest chunks to the query, ascending by distance. */
  public synchronized List<NearestMatch> search(String query, int topK) {
    ensureChecked();
    String collection = collectionName();
    if (vectorStore.count(collection) == 0) {
      return List.of();
    }
    EmbeddingBatch queryEmbedding =
        embeddingProvider.embed(List.of(query), CancellationToken.detached());
    int stored = collectionDimension(collection);
    if (queryEmbedding.dimension() != stored
        && queryEmbedding.source() == EmbeddingSource.REMOTE) {
      replaceStale(collection, stored, queryEmbedding);
      return List.of();
    }
    if (queryEmbedding.dimension() != stored) {
      log.warn(
          "Query vector has dimension {} ({}) but collection '{}' stores {}; no results",
          queryEmbedding.dimension(),
          queryEmbedding.source(),
          collection,
          stored);
      return List.of();
    }
    return vectorStore.nearest(collection, queryEmbedding.get(0), topK);
  }

  public synchronized long count() {
    String collection = collectionName();
    return vectorStore.exists(collection) ? vectorStore.count(collection) : 0;
  }

  public synchronized CollectionStats stats() {
    String collection = collectionName();
    if (!vectorStore.exists(collection)) {
      return new CollectionStats(
          collection,
          false,
          0,
          0,
          0,
          embeddingProvider.activeModel(),
          0,
          vectorStore.location(),
          true);
    }
    CollectionMetadata metadata =
        vectorStore
            .metadata(collection)
            .orElseGet(() -> metadataFor(embeddingProvider.activeModel(), 0));
    return new CollectionStats(
        collection,
        true,
        vectorStore.count(collection),
        vectorStore.distinctDocumentCount(collection),
        vectorStore.countByEmbeddingSource(collection, EmbeddingSource.FALLBACK.name()),
        metadata.embeddingModel(),
        collectionDimension(collection),
        vectorStore.location(),
        metadata.embeddingModel().equals(embeddingProvider.activeModel()));
  }

  private void ensureChecked() {
    String collection = collectionName();
    if (!embeddingProvider.activeModel().equals(checkedModel) || !vectorStore.exists(collection)) {
      checkCompatibility();
    }
  }

  /**
   * Adopts the batch's vector length when nothing is stored yet. Remote vectors of another length
   * replace the stored ones, since the live model defines the collection's dimension; fallback
   * vectors must match a populated collection.
   */
  private void alignDimension(String collection, EmbeddingBatch embeddings) {
    if (!vectorStore.exists(collection)) {
      createCollection(embeddings.modelName(), embeddings.dimension());
      return;
    }
    int stored = collectionDimension(collection);
    if (stored == embeddings.dimension()) {
      return;
    }
    if (embeddings.source() == EmbeddingSource.REMOTE) {
      replaceStale(collection, stored, embeddings);
      return;
    }
    if (vectorStore.count(collection) == 0) {
      log.info(
          "Collection '{}' is empty; recreating for {}-dimensional vectors from '{}'",
          collection,
          embeddings.dimension(),
          embeddings.modelName());
      recreate(embeddings.modelName(), embeddings.dimension());
      return;
    }
    throw new DimensionIncompatibleException(
        collection, embeddings.modelName(), stored, embeddings.dimension());
  }

  /** Recreates a collection whose vectors no longer fit the live model, e.g. after an outage. */
  private void replaceStale(String collection, int stored, EmbeddingBatch remote) {
    long discarded = vectorStore.count(collection);
    log.warn(
        "Collection '{}' holds {}-dimensional vectors but '{}' now produces {}; "
            + "recreating and discarding {} chunk(s)",
        collection,
        stored,
        remote.modelName(),
        remote.dimension(),
        discarded);
    recreate(remote.modelName(), remote.dimension());
    checkedModel = embeddingProvider.activeModel();
  }

  private int collectionDimension(String collection) {
    OptionalInt sampled = vectorStore.sampleStoredDimension(collection);
    if (sampled.isPresent()) {
      return sampled.getAsInt();
    }
    return vectorStore.metadata(collection).map(CollectionMetadata::dimension).orElse(0);
  }

  private StoredChunk toRow(Document document, TextChunk chunk, EmbeddingBatch embeddings) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(StoredChunk.FILENAME, document.fileName());
    metadata.put(
        StoredChunk.FILE_PATH,
        document.getFilePath() == null ? "" : document.getFilePath().toString());
    metadata.put(StoredChunk.FILE_TYPE, document.getFileType().tag());
    metadata.put(StoredChunk.FILE_SIZE, document.getFileSize());
    metadata.put(StoredChunk.CHUNK_INDEX, chunk.index());
    metadata.put(StoredChunk.DOCUMENT_ID, document.getId());
    metadata.put(StoredChunk.CREATED_AT, clock.instant().toString());
    metadata.put(StoredChunk.EMBEDDING_SOURCE, embeddings.source().name());
    metadata.put(StoredChunk.EMBEDDING_MODEL, embeddings.modelName());
    return new StoredChunk(
        chunk.id(), document.getId(), chunk.text(), embeddings.get(chunk.index()), metadata);
  }

  private void recreate(String model, int dimension) {
    String collection = collectionName();
    vectorStore.drop(collection);
    createCollection(model, dimension);
    meterRegistry.counter("collection.recreated", "reason", "dimension").increment();
  }

  private void createCollection(String model, int dimension) {
    vectorStore.create(metadataFor(model, dimension));
    log.info("Created collection '{}' for '{}' (dimension {})", collectionName(), model, dimension);
  }

  private CollectionMetadata metadataFor(String model, int dimension) {
    return new CollectionMetadata(collectionName(), model, dimension, clock.instant());
  }

  private int expectedOrZero() {
    try {
      return embeddingProvider.expectedDimension(embeddingProvider.activeModel());
    } catch (EmbeddingUnavailableException e) {
      return 0;
    }
  }
}
