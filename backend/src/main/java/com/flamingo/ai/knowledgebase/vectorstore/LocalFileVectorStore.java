package com.flamingo.ai.knowledgebase.vectorstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flamingo.ai.knowledgebase.exception.VectorStoreException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link VectorStore} kept as one JSON file per collection under a storage directory.
 *
 * <p>Collections are loaded lazily and held in memory; every mutation rewrites the file through a
 * temporary file and a move. Nearest-neighbour queries scan all rows.
 */
@Slf4j
public class LocalFileVectorStore implements VectorStore {

  private static final String SUFFIX = ".collection.json";

  private final Path storagePath;
  private final ObjectMapper objectMapper;
  private final Map<String, CollectionFile> loaded = new HashMap<>();

  public LocalFileVectorStore(Path storagePath) {
    this.storagePath = storagePath;
    this.objectMapper =
        new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  public synchronized boolean exists(String collection) {
    return loaded.containsKey(collection) || Files.exists(fileOf(collection));
  }

  @Override
  public synchronized void create(CollectionMetadata metadata) {
    CollectionFile file = new CollectionFile(metadata, new ArrayList<>());
    write(metadata.name(), file);
    loaded.put(metadata.name(), file);
    log.info(
        "Created local collection '{}' ({}, dimension {}) at {}",
        metadata.name(),
        metadata.embeddingModel(),
        metadata.dimension(),
        fileOf(metadata.name()));
  }

  @Override
  public synchronized void drop(String collection) {
    loaded.remove(collection);
    try {
      Files.deleteIfExists(fileOf(collection));
    } catch (IOException e) {
      throw new VectorStoreException(collection, "Cannot delete collection file", e);
    }
  }

  @Override
  public synchronized Optional<CollectionMetadata> metadata(String collection) {
    return find(collection).map(CollectionFile::metadata);
  }

  @Override
  public synchronized OptionalInt sampleStoredDimension(String collection) {
    return find(collection)
        .flatMap(file -> file.chunks().stream().findFirst())
        .map(chunk -> OptionalInt.of(chunk.dimension()))
        .orElse(OptionalInt.empty());
  }

  @Override
  public synchronized void upsert(String collection, List<StoredChunk> chunks) {
    CollectionFile file = require(collection);
    Map<String, StoredChunk> byId = new LinkedHashMap<>();
    for (StoredChunk existing : file.chunks()) {
      byId.put(existing.id(), existing);
    }
    for (StoredChunk chunk : chunks) {
      byId.put(chunk.id(), chunk);
    }
    replaceRows(collection, file, new ArrayList<>(byId.values()));
  }

  @Override
  public synchronized List<String> findIdsByDocumentId(String collection, String documentId) {
    return require(collection).chunks().stream()
        .filter(chunk -> Objects.equals(chunk.documentId(), documentId))
        .map(StoredChunk::id)
        .toList();
  }

  @Override
  public synchronized List<String> listIds(String collection) {
    return require(collection).chunks().stream().map(StoredChunk::id).toList();
  }

  @Override
  public synchronized void deleteByIds(String collection, List<String> ids) {
    if (ids.isEmpty()) {
      return;
    }
    CollectionFile file = require(collection);
    Set<String> doomed = new HashSet<>(ids);
    List<StoredChunk> kept =
        file.chunks().stream().filter(chunk -> !doomed.contains(chunk.id())).toList();
    replaceRows(collection, file, new ArrayList<>(kept));
  }

  @Override
  public synchronized List<NearestMatch> nearest(String collection, float[] query, int limit) {
    return require(collection).chunks().stream()
        .filter(chunk -> chunk.dimension() == query.length)
        .map(
            chunk ->
                new NearestMatch(
                    chunk.id(),
                    chunk.content(),
                    chunk.metadata(),
                    cosineDistance(query, chunk.vector())))
        .sorted(
            Comparator.comparingDouble(NearestMatch::distance).thenComparing(NearestMatch::id))
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized long count(String collection) {
    return find(collection).map(file -> (long) file.chunks().size()).orElse(0L);
  }

  @Override
  public synchronized long distinctDocumentCount(String collection) {
    return find(collection)
        .map(file -> file.chunks().stream().map(StoredChunk::documentId).distinct().count())
        .orElse(0L);
  }

  @Override
  public synchronized long countByEmbeddingSource(String collection, String source) {
    return find(collection)
        .map(
            file ->
                file.chunks().stream()
                    .filter(
                        chunk ->
                            source.equals(chunk.metadata().get(StoredChunk.EMBEDDING_SOURCE)))
                    .count())
        .orElse(0L);
  }

  @Override
  public String location() {
    return storagePath.toAbsolutePath().toString();
  }

  static double cosineDistance(float[] a, float[] b) {
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 1.0;
    }
    return 1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  private void replaceRows(String collection, CollectionFile file, List<StoredChunk> rows) {
    CollectionFile updated = new CollectionFile(file.metadata(), rows);
    write(collection, updated);
    loaded.put(collection, updated);
  }

  private CollectionFile require(String collection) {
    return find(collection)
        .orElseThrow(
            () -> new VectorStoreException(collection, "Collection does not exist", null));
  }

  private Optional<CollectionFile> find(String collection) {
    CollectionFile file = loaded.get(collection);
    if (file != null) {
      return Optional.of(file);
    }
    Path path = fileOf(collection);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try {
      file = objectMapper.readValue(path.toFile(), CollectionFile.class);
      loaded.put(collection, file);
      log.debug("Loaded collection '{}' with {} row(s)", collection, file.chunks().size());
      return Optional.of(file);
    } catch (IOException e) {
      throw new VectorStoreException(collection, "Cannot read collection file " + path, e);
    }
  }

  private void write(String collection, CollectionFile file) {
    Path target = fileOf(collection);
    Path temp = null;
    try {
      Files.createDirectories(storagePath);
      temp = Files.createTempFile(storagePath, collection, ".tmp");
      objectMapper.writeValue(temp.toFile(), file);
      try {
        Files.move(
            temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      deleteQuietly(temp, e);
      throw new VectorStoreException(collection, "Cannot write collection file " + target, e);
    }
  }

  private static void deleteQuietly(Path temp, IOException cause) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      cause.addSuppressed(e);
    }
  }

  private Path fileOf(String collection) {
    return storagePath.resolve(collection + SUFFIX);
  }

  /** On-disk layout of one collection. */
  record CollectionFile(CollectionMetadata metadata, List<StoredChunk> chunks) {}
}
