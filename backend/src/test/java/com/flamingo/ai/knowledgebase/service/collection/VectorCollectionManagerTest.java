package com.flamingo.ai.knowledgebase.service.collection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.domain.Document;
import com.flamingo.ai.knowledgebase.domain.FileType;
import com.flamingo.ai.knowledgebase.exception.DimensionIncompatibleException;
import com.flamingo.ai.knowledgebase.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledgebase.exception.OperationCancelledException;
import com.flamingo.ai.knowledgebase.exception.VectorStoreException;
import com.flamingo.ai.knowledgebase.service.chunking.RecursiveTextChunker;
import com.flamingo.ai.knowledgebase.service.embedding.EmbeddingSource;
import com.flamingo.ai.knowledgebase.service.embedding.HashEmbeddingFallback;
import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import com.flamingo.ai.knowledgebase.support.FakeEmbeddingProvider;
import com.flamingo.ai.knowledgebase.support.MutableClock;
import com.flamingo.ai.knowledgebase.vectorstore.LocalFileVectorStore;
import com.flamingo.ai.knowledgebase.vectorstore.NearestMatch;
import com.flamingo.ai.knowledgebase.vectorstore.StoredChunk;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("VectorCollectionManager Tests")
class VectorCollectionManagerTest {

  private static final String TRAVEL =
      "The quarterly travel budget is 5000 EUR per person and must be approved in advance.";
  private static final String RUNBOOK =
      "Kubernetes cluster upgrades start with draining each node before the control plane.";

  @TempDir Path tempDir;

  private KnowledgeBaseProperties properties;
  private MutableClock clock;
  private LocalFileVectorStore vectorStore;
  private FakeEmbeddingProvider embeddingProvider;
  private SimpleMeterRegistry meterRegistry;
  private VectorCollectionManager manager;

  @BeforeEach
  void setUp() {
    properties = new KnowledgeBaseProperties();
    properties.getCollection().setName("kb_test");
    clock = MutableClock.startingAtEpoch();
    vectorStore = spy(new LocalFileVectorStore(tempDir));
    embeddingProvider = FakeEmbeddingProvider.withDefaultModels(properties);
    meterRegistry = new SimpleMeterRegistry();
    manager = newManager();
  }

  private VectorCollectionManager newManager() {
    return new VectorCollectionManager(
        vectorStore,
        embeddingProvider,
        new RecursiveTextChunker(properties),
        properties,
        clock,
        meterRegistry);
  }

  @Test
  @DisplayName("should find an inserted document by a query sharing its words")
  void shouldRoundTripInsertAndSearch() {
    Document travel = document("travel-policy.txt", TRAVEL);
    manager.insert(travel, CancellationToken.detached());
    manager.insert(document("upgrade-runbook.txt", RUNBOOK), CancellationToken.detached());

    List<NearestMatch> matches = manager.search("quarterly travel budget", 1);

    assertThat(matches).hasSize(1);
    assertThat(matches.get(0).content()).isEqualTo(TRAVEL);
    assertThat(matches.get(0).metadata())
        .containsEntry(StoredChunk.FILENAME, "travel-policy.txt")
        .containsEntry(StoredChunk.DOCUMENT_ID, travel.getId())
        .containsEntry(StoredChunk.CHUNK_INDEX, 0)
        .containsEntry(StoredChunk.EMBEDDING_SOURCE, "REMOTE");
  }

  @Test
  @DisplayName("should create the collection on first insert with the model's dimension")
  void shouldCreateCollectionOnFirstInsert() {
    InsertResult result =
        manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());

    CollectionStats stats = manager.stats();
    assertThat(result.dimension()).isEqualTo(768);
    assertThat(stats.exists()).isTrue();
    assertThat(stats.dimension()).isEqualTo(768);
    assertThat(stats.embeddingModel()).isEqualTo("nomic-embed-text");
    assertThat(stats.chunkCount()).isEqualTo(result.chunkCount());
    assertThat(stats.compatible()).isTrue();
  }

  @Test
  @DisplayName("should store every vector with the collection's dimension")
  void shouldKeepOneDimension() {
    properties.getChunking().setSize(40);
    properties.getChunking().setOverlap(10);

    manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());
    manager.insert(document("upgrade-runbook.txt", RUNBOOK), CancellationToken.detached());

    long stored = vectorStore.count("kb_test");
    assertThat(stored).isGreaterThan(2);
    assertThat(vectorStore.sampleStoredDimension("kb_test")).hasValue(768);
    assertThat(manager.search("upgrade", 100)).hasSize((int) stored);
  }

  @Test
  @DisplayName("should recreate the collection when switching to a model of another dimension")
  void shouldRecreateOnModelSwitch() {
    manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());
    manager.insert(document("upgrade-runbook.txt", RUNBOOK), CancellationToken.detached());

    properties.getOllama().setEmbeddingModel("mxbai-embed-large");
    Document after = document("after-switch.txt", "Holiday calendar for the new year.");
    manager.insert(after, CancellationToken.detached());

    CollectionStats stats = manager.stats();
    assertThat(stats.dimension()).isEqualTo(1024);
    assertThat(stats.documentCount()).isEqualTo(1);
    assertThat(stats.embeddingModel()).isEqualTo("mxbai-embed-large");
    assertThat(meterRegistry.counter("collection.recreated", "reason", "dimension").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should report the discarded chunks on an explicit check")
  void shouldReportRecreation() {
    manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());
    long before = manager.count();
    properties.getOllama().setEmbeddingModel("mxbai-embed-large");

    CompatibilityReport report = manager.checkCompatibility();

    assertThat(report.state()).isEqualTo(CompatibilityState.RECREATED);
    assertThat(report.storedDimension()).isEqualTo(768);
    assertThat(report.expectedDimension()).isEqualTo(1024);
    assertThat(report.discardedChunks()).isEqualTo(before);
    assertThat(manager.count()).isZero();
  }

  @Test
  @DisplayName("should leave a compatible collection untouched")
  void shouldKeepCompatibleCollection() {
    manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());

    CompatibilityReport report = newManager().checkCompatibility();

    assertThat(report.state()).isEqualTo(CompatibilityState.COMPATIBLE);
    assertThat(manager.count()).isPositive();
  }

  @Test
  @DisplayName("should not drop anything when the model cannot be probed")
  void shouldSkipCheckWhenModelUnavailable() {
    manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());
    long before = manager.count();
    embeddingProvider.setUnavailable(true);

    CompatibilityReport report = newManager().checkCompatibility();

    assertThat(report.state()).isEqualTo(CompatibilityState.UNKNOWN);
    assertThat(manager.count()).isEqualTo(before);
  }

  @Test
  @DisplayName("should flag fallback vectors and adopt their dimension in an empty collection")
  void shouldStoreFallbackVectorsInEmptyCollection() {
    manager.checkCompatibility();
    embeddingProvider.setUnavailable(true);

    InsertResult result =
        manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());

    assertThat(result.embeddingSource()).isEqualTo(EmbeddingSource.FALLBACK);
    CollectionStats stats = manager.stats();
    assertThat(stats.dimension()).isEqualTo(HashEmbeddingFallback.DIMENSION);
    assertThat(stats.fallbackChunkCount()).isEqualTo(stats.chunkCount());
  }

  @Test
  @DisplayName("should refuse fallback vectors that do not fit a populated collection")
  void shouldRejectMismatchedFallbackVectors() {
    manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());
    embeddingProvider.setUnavailable(true);

    assertThatThrownBy(
            () ->
                manager.insert(
                    document("upgrade-runbook.txt", RUNBOOK), CancellationToken.detached()))
        .isInstanceOf(DimensionIncompatibleException.class);
    assertThat(manager.stats().documentCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("should go back to the model's dimension on insert once Ollama recovers")
  void shouldReplaceFallbackCollectionOnInsertAfterRecovery() {
    manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());
    manager.clear();
    embeddingProvider.setUnavailable(true);
    manager.insert(document("upgrade-runbook.txt", RUNBOOK), CancellationToken.detached());
    assertThat(manager.stats().dimension()).isEqualTo(HashEmbeddingFallback.DIMENSION);

    embeddingProvider.setUnavailable(false);
    InsertResult result =
        manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());

    CollectionStats stats = manager.stats();
    assertThat(result.embeddingSource()).isEqualTo(EmbeddingSource.REMOTE);
    assertThat(stats.dimension()).isEqualTo(768);
    assertThat(stats.embeddingModel()).isEqualTo("nomic-embed-text");
    assertThat(stats.documentCount()).isEqualTo(1);
    assertThat(stats.fallbackChunkCount()).isZero();
    assertThat(manager.search("quarterly travel budget", 1))
        .extracting(NearestMatch::content)
        .containsExactly(TRAVEL);
  }

  @Test
  @DisplayName("should drop stale fallback vectors when a search runs after recovery")
  void shouldReplaceFallbackCollectionOnSearchAfterRecovery() {
    manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());
    manager.clear();
    embeddingProvider.setUnavailable(true);
    manager.insert(document("upgrade-runbook.txt", RUNBOOK), CancellationToken.detached());

    embeddingProvider.setUnavailable(false);
    List<NearestMatch> matches = manager.search("node upgrades", 5);

    assertThat(matches).isEmpty();
    assertThat(manager.stats().dimension()).isEqualTo(768);
    assertThat(manager.count()).isZero();
    manager.insert(document("upgrade-runbook.txt", RUNBOOK), CancellationToken.detached());
    assertThat(manager.search("node upgrades", 5)).hasSize(1);
  }

  @Test
  @DisplayName("should delete only the chunks of the given document")
  void shouldDeleteDocument() {
    Document travel = document("travel-policy.txt", TRAVEL);
    manager.insert(travel, CancellationToken.detached());
    manager.insert(document("upgrade-runbook.txt", RUNBOOK), CancellationToken.detached());

    int removed = manager.delete(travel.getId());

    assertThat(removed).isEqualTo(1);
    assertThat(manager.stats().documentCount()).isEqualTo(1);
    assertThat(manager.search("quarterly travel budget", 5))
        .noneMatch(m -> m.content().equals(TRAVEL));
  }

  @Test
  @DisplayName("should report deletion of an unknown document")
  void shouldRejectUnknownDelete() {
    assertThatThrownBy(() -> manager.delete("missing"))
        .isInstanceOf(DocumentNotFoundException.class);

    manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());

    assertThatThrownBy(() -> manager.delete("missing"))
        .isInstanceOf(DocumentNotFoundException.class);
  }

  @Test
  @DisplayName("should replace a document's chunks under the same id")
  void shouldUpdateDocument() {
    Document travel = document("travel-policy.txt", TRAVEL);
    manager.insert(travel, CancellationToken.detached());

    manager.update(
        travel.getId(),
        document("travel-policy.txt", "The travel budget was raised to 6000 EUR."),
        CancellationToken.detached());

    List<NearestMatch> matches = manager.search("travel budget", 5);
    assertThat(matches).hasSize(1);
    assertThat(matches.get(0).metadata()).containsEntry(StoredChunk.DOCUMENT_ID, travel.getId());
    assertThat(matches.get(0).content()).contains("6000");
  }

  @Test
  @DisplayName("should clear idempotently and keep the collection")
  void shouldClearIdempotently() {
    manager.clear();
    manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());

    manager.clear();
    manager.clear();

    assertThat(manager.count()).isZero();
    assertThat(manager.stats().exists()).isTrue();
  }

  @Test
  @DisplayName("should drop and recreate the collection when bulk deletion fails")
  void shouldRecreateWhenBulkDeleteFails() {
    manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());
    doThrow(new VectorStoreException("kb_test", "bulk delete failed", null))
        .when(vectorStore)
        .deleteByIds(anyString(), anyList());

    manager.clear();

    CollectionStats stats = manager.stats();
    assertThat(stats.chunkCount()).isZero();
    assertThat(stats.exists()).isTrue();
    assertThat(stats.embeddingModel()).isEqualTo("nomic-embed-text");
    assertThat(stats.dimension()).isEqualTo(768);
  }

  @Test
  @DisplayName("should return nothing for an empty collection")
  void shouldSearchEmptyCollection() {
    assertThat(manager.search("anything", 5)).isEmpty();
  }

  @Test
  @DisplayName("should return nothing when the query vector does not fit the collection")
  void shouldSearchWithMismatchedQueryVector() {
    manager.insert(document("travel-policy.txt", TRAVEL), CancellationToken.detached());
    embeddingProvider.setUnavailable(true);

    assertThat(manager.search("quarterly travel budget", 5)).isEmpty();
  }

  @Test
  @DisplayName("should not write anything for a cancelled insert")
  void shouldStopCancelledInsert() {
    CancellationToken token = CancellationToken.detached();
    token.cancel("user");

    assertThatThrownBy(() -> manager.insert(document("travel-policy.txt", TRAVEL), token))
        .isInstanceOf(OperationCancelledException.class);
    assertThat(manager.count()).isZero();
  }

  private Document document(String fileName, String content) {
    return Document.fromFile(
        tempDir.resolve(fileName), FileType.TEXT, content, content.length(), clock);
  }
}
