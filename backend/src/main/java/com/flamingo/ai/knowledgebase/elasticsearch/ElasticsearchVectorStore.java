package com.flamingo.ai.knowledgebase.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.json.JsonData;
import com.flamingo.ai.knowledgebase.exception.VectorStoreException;
import com.flamingo.ai.knowledgebase.vectorstore.CollectionMetadata;
import com.flamingo.ai.knowledgebase.vectorstore.NearestMatch;
import com.flamingo.ai.knowledgebase.vectorstore.StoredChunk;
import com.flamingo.ai.knowledgebase.vectorstore.VectorStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link VectorStore} with one Elasticsearch index per collection.
 *
 * <p>The embedding model and dimension are kept in the index mapping's {@code _meta}. Vectors use
 * a cosine {@code dense_vector} field; kNN scores ({@code (1 + cos) / 2}) are converted back to
 * cosine distance.
 */
@Slf4j
public class ElasticsearchVectorStore implements VectorStore {

  static final String EMBEDDING_FIELD = "embedding";
  static final String CONTENT_FIELD = "content";
  static final String CHUNK_ID_FIELD = "chunk_id";

  /** Upper bound of ids returned by one id listing. */
  private static final int MAX_IDS = 10_000;

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String location;

  public ElasticsearchVectorStore(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, String location) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.location = location;
  }

  @Override
  public boolean exists(String collection) {
    try {
      return elasticsearchClient.indices().exists(e -> e.index(indexName(collection))).value();
    } catch (IOException e) {
      throw failure(collection, "check index", e);
    }
  }

  @Override
  public void create(CollectionMetadata metadata) {
    String index = indexName(metadata.name());
    Map<String, JsonData> meta = new HashMap<>();
    meta.put("embedding_model", JsonData.of(metadata.embeddingModel()));
    meta.put("dimension", JsonData.of(metadata.dimension()));
    meta.put("created_at", JsonData.of(metadata.createdAt().toString()));
    Map<String, Property> properties = defineIndexProperties(metadata.dimension());
    try {
      // dynamic=false keeps undeclared metadata out of the mapping
      elasticsearchClient
          .indices()
          .create(
              c ->
                  c.index(index)
                      .mappings(
                          m -> m.dynamic(DynamicMapping.False).meta(meta).properties(properties)));
      log.info(
          "Created Elasticsearch index '{}' ({}, dimension {})",
          index,
          metadata.embeddingModel(),
          metadata.dimension());
    } catch (IOException e) {
      throw failure(metadata.name(), "create index", e);
    }
  }

  @Override
  public void drop(String collection) {
    try {
      if (exists(collection)) {
        elasticsearchClient.indices().delete(d -> d.index(indexName(collection)));
        log.info("Deleted Elasticsearch index '{}'", indexName(collection));
      }
    } catch (IOException e) {
      throw failure(collection, "delete index", e);
    }
  }

  @Override
  public Optional<CollectionMetadata> metadata(String collection) {
    if (!exists(collection)) {
      return Optional.empty();
    }
    String index = indexName(collection);
    try {
      var mapping = elasticsearchClient.indices().getMapping(g -> g.index(index)).get(index);
      if (mapping == null || mapping.mappings().meta() == null) {
        return Optional.empty();
      }
      Map<String, JsonData> meta = mapping.mappings().meta();
      if (!meta.containsKey("embedding_model") || !meta.containsKey("dimension")) {
        return Optional.empty();
      }
      Instant createdAt =
          meta.containsKey("created_at")
              ? Instant.parse(meta.get("created_at").to(String.class))
              : Instant.EPOCH;
      return Optional.of(
          new CollectionMetadata(
              collection,
              meta.get("embedding_model").to(String.class),
              meta.get("dimension").to(Integer.class),
              createdAt));
    } catch (IOException e) {
      throw failure(collection, "read mapping", e);
    }
  }

  @Override
  @SuppressWarnings({"rawtypes", "unchecked"})
  public OptionalInt sampleStoredDimension(String collection) {
    try {
      SearchResponse<Map> response =
          elasticsearchClient.search(
              s -> s.index(indexName(collection)).size(1), Map.class);
      for (Hit<Map> hit : response.hits().hits()) {
        Object vector = hit.source() == null ? null : hit.source().get(EMBEDDING_FIELD);
        if (vector instanceof List<?> values) {
          return OptionalInt.of(values.size());
        }
      }
      return OptionalInt.empty();
    } catch (IOException e) {
      throw failure(collection, "sample vector", e);
    }
  }

  @Override
  public void upsert(String collection, List<StoredChunk> chunks) {
    if (chunks.isEmpty()) {
      return;
    }
    String index = indexName(collection);
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (StoredChunk chunk : chunks) {
        Map<String, Object> docMap = convertToDocument(chunk);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(index).id(chunk.id()).document(docMap)));
      }
      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        meterRegistry.counter("vector_store.index.errors").increment();
        throw new VectorStoreException(
            collection, "Bulk indexing reported errors: " + response.items(), null);
      }
      refresh(index);
      meterRegistry.counter("vector_store.indexed").increment(chunks.size());
      log.debug("Indexed {} chunk(s) to {}", chunks.size(), index);
    } catch (IOException e) {
      throw failure(collection, "index chunks", e);
    }
  }

  @Override
  public List<String> findIdsByDocumentId(String collection, String documentId) {
    try {
      SearchResponse<Void> response =
          elasticsearchClient.search(
              s ->
                  s.index(indexName(collection))
                      .size(MAX_IDS)
                      .source(src -> src.fetch(false))
                      .query(
                          q -> q.term(t -> t.field(StoredChunk.DOCUMENT_ID).value(documentId))),
              Void.class);
      return response.hits().hits().stream().map(Hit::id).toList();
    } catch (IOException e) {
      throw failure(collection, "find document chunks", e);
    }
  }

  @Override
  public List<String> listIds(String collection) {
    try {
      SearchResponse<Void> response =
          elasticsearchClient.search(
              s -> s.index(indexName(collection)).size(MAX_IDS).source(src -> src.fetch(false)),
              Void.class);
      return response.hits().hits().stream().map(Hit::id).toList();
    } catch (IOException e) {
      throw failure(collection, "list ids", e);
    }
  }

  @Override
  public void deleteByIds(String collection, List<String> ids) {
    if (ids.isEmpty()) {
      return;
    }
    String index = indexName(collection);
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (String id : ids) {
        bulkBuilder.operations(op -> op.delete(d -> d.index(index).id(id)));
      }
      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        throw new VectorStoreException(
            collection, "Bulk delete reported errors: " + response.items(), null);
      }
      refresh(index);
      log.info("Deleted {} chunk(s) from {}", ids.size(), index);
    } catch (IOException e) {
      throw failure(collection, "delete chunks", e);
    }
  }

  @Override
  @SuppressWarnings({"rawtypes", "unchecked"})
  public List<NearestMatch> nearest(String collection, float[] query, int limit) {
    List<Float> queryVector = new ArrayList<>(query.length);
    for (float v : query) {
      queryVector.add(v);
    }
    try {
      SearchResponse<Map> response =
          elasticsearchClient.search(
              s ->
                  s.index(indexName(collection))
                      .knn(
                          k ->
                              k.field(EMBEDDING_FIELD)
                                  .queryVector(queryVector)
                                  .k(limit)
                                  .numCandidates(Math.max(limit * 2, 10)))
                      .source(src -> src.filter(f -> f.excludes(EMBEDDING_FIELD)))
                      .size(limit),
              Map.class);
      List<NearestMatch> matches = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        Map<String, Object> source = hit.source() == null ? Map.of() : hit.source();
        double score = hit.score() == null ? 0.0 : hit.score();
        Object content = source.get(CONTENT_FIELD);
        matches.add(
            new NearestMatch(
                hit.id(),
                content == null ? "" : content.toString(),
                metadataOf(source),
                Math.max(0.0, 2.0 - 2.0 * score)));
      }
      meterRegistry.counter("vector_store.vector_search").increment();
      return matches;
    } catch (IOException e) {
      throw failure(collection, "vector search", e);
    }
  }

  @Override
  public long count(String collection) {
    if (!exists(collection)) {
      return 0;
    }
    try {
      return elasticsearchClient.count(c -> c.index(indexName(collection))).count();
    } catch (IOException e) {
      throw failure(collection, "count", e);
    }
  }

  @Override
  public long distinctDocumentCount(String collection) {
    if (!exists(collection)) {
      return 0;
    }
    try {
      SearchResponse<Void> response =
          elasticsearchClient.search(
              s ->
                  s.index(indexName(collection))
                      .size(0)
                      .aggregations(
                          "documents", a -> a.cardinality(c -> c.field(StoredChunk.DOCUMENT_ID))),
              Void.class);
      return response.aggregations().get("documents").cardinality().value();
    } catch (IOException e) {
      throw failure(collection, "count documents", e);
    }
  }

  @Override
  public long countByEmbeddingSource(String collection, String source) {
    if (!exists(collection)) {
      return 0;
    }
    try {
      return elasticsearchClient
          .count(
              c ->
                  c.index(indexName(collection))
                      .query(
                          q -> q.term(t -> t.field(StoredChunk.EMBEDDING_SOURCE).value(source))))
          .count();
    } catch (IOException e) {
      throw failure(collection, "count by source", e);
    }
  }

  @Override
  public String location() {
    return location;
  }

  static String indexName(String collection) {
    return collection.toLowerCase(Locale.ROOT);
  }

  private Map<String, Property> defineIndexProperties(int dimension) {
    Map<String, Property> properties = new HashMap<>();
    properties.put(CHUNK_ID_FIELD, Property.of(p -> p.keyword(k -> k)));
    properties.put(StoredChunk.DOCUMENT_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(CONTENT_FIELD, Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(StoredChunk.FILENAME, Property.of(p -> p.keyword(k -> k)));
    properties.put(StoredChunk.FILE_PATH, Property.of(p -> p.keyword(k -> k)));
    properties.put(StoredChunk.FILE_TYPE, Property.of(p -> p.keyword(k -> k)));
    properties.put(StoredChunk.FILE_SIZE, Property.of(p -> p.long_(l -> l)));
    properties.put(StoredChunk.CHUNK_INDEX, Property.of(p -> p.integer(i -> i)));
    properties.put(StoredChunk.CREATED_AT, Property.of(p -> p.keyword(k -> k)));
    properties.put(StoredChunk.EMBEDDING_SOURCE, Property.of(p -> p.keyword(k -> k)));
    properties.put(StoredChunk.EMBEDDING_MODEL, Property.of(p -> p.keyword(k -> k)));
    properties.put(
        EMBEDDING_FIELD,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(dimension)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  private Map<String, Object> convertToDocument(StoredChunk chunk) {
    Map<String, Object> document = new LinkedHashMap<>(chunk.metadata());
    document.put(CHUNK_ID_FIELD, chunk.id());
    document.put(StoredChunk.DOCUMENT_ID, chunk.documentId());
    document.put(CONTENT_FIELD, chunk.content());
    document.put(EMBEDDING_FIELD, chunk.vector());
    return document;
  }

  private static Map<String, Object> metadataOf(Map<String, Object> source) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    source.forEach(
        (key, value) -> {
          if (value != null
              && !CONTENT_FIELD.equals(key)
              && !EMBEDDING_FIELD.equals(key)
              && !CHUNK_ID_FIELD.equals(key)) {
            metadata.put(key, value);
          }
        });
    return metadata;
  }

  private void refresh(String index) {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(index));
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", index, e.getMessage());
    }
  }

  private VectorStoreException failure(String collection, String action, IOException e) {
    log.error("Elasticsearch {} failed for '{}': {}", action, collection, e.getMessage(), e);
    return new VectorStoreException(collection, "Elasticsearch " + action + " failed", e);
  }
}
