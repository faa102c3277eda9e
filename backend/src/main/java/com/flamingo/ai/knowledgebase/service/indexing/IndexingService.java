package com.flamingo.ai.knowledgebase.service.indexing;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.domain.Document;
import com.flamingo.ai.knowledgebase.domain.FileType;
import com.flamingo.ai.knowledgebase.domain.IndexStatus;
import com.flamingo.ai.knowledgebase.exception.DocumentReadException;
import com.flamingo.ai.knowledgebase.exception.OperationCancelledException;
import com.flamingo.ai.knowledgebase.service.collection.InsertResult;
import com.flamingo.ai.knowledgebase.service.collection.VectorCollectionManager;
import com.flamingo.ai.knowledgebase.service.operation.CancellationRegistry;
import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import com.flamingo.ai.knowledgebase.service.operation.ProgressListener;
import com.flamingo.ai.knowledgebase.service.operation.ProgressTracker;
import com.flamingo.ai.knowledgebase.service.reader.DocumentReader;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Rebuilds the index from the configured folders.
 *
 * <p>A rebuild clears the collection, then reads and inserts one document at a time, checking
 * for cancellation between documents. Files that cannot be read are reported and skipped; any
 * other failure ends the run. The configuration's index status follows the run.
 */
@Service
@Slf4j
public class IndexingService {

  private final DocumentReader documentReader;
  private final VectorCollectionManager collectionManager;
  private final CancellationRegistry cancellationRegistry;
  private final KnowledgeBaseProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final Executor indexingExecutor;
  private final Map<String, IndexingJob> jobs = new ConcurrentHashMap<>();

  public IndexingService(
      DocumentReader documentReader,
      VectorCollectionManager collectionManager,
      CancellationRegistry cancellationRegistry,
      KnowledgeBaseProperties properties,
      Clock clock,
      MeterRegistry meterRegistry,
      @Qualifier("indexingExecutor") Executor indexingExecutor) {
    this.documentReader = documentReader;
    this.collectionManager = collectionManager;
    this.cancellationRegistry = cancellationRegistry;
    this.properties = properties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.indexingExecutor = indexingExecutor;
  }

  /** Starts a rebuild in the background; the job id doubles as the cancellation token id. */
  public IndexingJob startRebuild() {
    CancellationToken token = cancellationRegistry.create();
    IndexingJob job = new IndexingJob(token.getId(), clock.instant());
    jobs.put(job.getOperationId(), job);
    indexingExecutor.execute(
        () -> {
          IndexingReport report;
          try {
            report = rebuildIndex(job::setProgress, token);
          } catch (RuntimeException e) {
            log.error("Background rebuild {} failed: {}", job.getOperationId(), e.getMessage(), e);
            report =
                new IndexingReport(
                    IndexingOutcome.FAILED,
                    List.of(),
                    List.of(),
                    0,
                    Duration.between(job.getStartedAt(), clock.instant()),
                    e.getMessage());
          } finally {
            cancellationRegistry.release(token.getId());
          }
          job.finish(report, clock.instant());
        });
    return job;
  }

  public Optional<IndexingJob> findJob(String operationId) {
    return Optional.ofNullable(jobs.get(operationId));
  }

  /** Forgets background runs that finished longer ago than the configured retention. */
  @Scheduled(
      fixedDelayString = "${knowledge-base.cancellation.sweep-interval:PT5M}",
      initialDelayString = "${knowledge-base.cancellation.sweep-interval:PT5M}")
  public int sweepFinishedJobs() {
    Instant cutoff = clock.instant().minus(properties.getIndexing().getJobRetention());
    int removed = 0;
    for (IndexingJob job : jobs.values()) {
      if (job.isFinished()
          && job.getFinishedAt().isBefore(cutoff)
          && jobs.remove(job.getOperationId(), job)) {
        removed++;
      }
    }
    if (removed > 0) {
      log.info("Swept {} finished indexing job(s)", removed);
    }
    return removed;
  }

  /** Rebuilds from every configured folder. */
  public IndexingReport rebuildIndex(ProgressListener listener, CancellationToken token) {
    return rebuildIndex(properties.getIndexing().getFolders(), listener, token);
  }

  public IndexingReport rebuildIndex(
      List<Path> folders, ProgressListener listener, CancellationToken token) {
    Instant started = clock.instant();
    IndexStatus previousStatus = properties.getIndexStatus();
    properties.setIndexStatus(IndexStatus.CREATING);

    List<String> indexed = new ArrayList<>();
    List<IndexingReport.SkippedFile> skipped = new ArrayList<>();
    int chunks = 0;
    ProgressTracker tracker = null;
    try {
      token.throwIfCancelled();
      List<Path> files = collectFiles(folders);
      log.info("Rebuilding index from {} file(s) in {} folder(s)", files.size(), folders.size());
      collectionManager.clear();

      tracker = newTracker(files.size(), listener);
      for (Path file : files) {
        token.throwIfCancelled();
        Document document;
        try {
          document = documentReader.read(file);
        } catch (DocumentReadException e) {
          log.warn("Skipping {}: {}", file, e.getMessage());
          skipped.add(
              new IndexingReport.SkippedFile(file, e.getErrorCode().getCode(), e.getMessage()));
          meterRegistry.counter("indexing.documents", "outcome", "skipped").increment();
          tracker.update(1, "Skipped " + file.getFileName());
          continue;
        }
        InsertResult result = collectionManager.insert(document, token);
        indexed.add(document.getId());
        chunks += result.chunkCount();
        meterRegistry.counter("indexing.documents", "outcome", "indexed").increment();
        tracker.update(1, "Indexed " + file.getFileName());
      }

      tracker.finish("Indexed " + indexed.size() + " document(s)");
      properties.setIndexStatus(IndexStatus.CREATED);
      return report(IndexingOutcome.SUCCEEDED, indexed, skipped, chunks, started, null);
    } catch (OperationCancelledException e) {
      if (tracker != null) {
        tracker.cancel();
      }
      properties.setIndexStatus(
          previousStatus == IndexStatus.CREATING ? IndexStatus.NOT_CREATED : previousStatus);
      log.info("Index rebuild cancelled after {} document(s)", indexed.size());
      return report(IndexingOutcome.CANCELLED, indexed, skipped, chunks, started, e.getMessage());
    } catch (RuntimeException e) {
      // store, reader and listing failures alike end the run
      properties.setIndexStatus(IndexStatus.ERROR);
      log.error("Index rebuild failed after {} document(s): {}", indexed.size(), e.getMessage(), e);
      return report(IndexingOutcome.FAILED, indexed, skipped, chunks, started, e.getMessage());
    }
  }

  /** Regular files below the folders whose extension is supported, in path order. */
  List<Path> collectFiles(List<Path> folders) {
    Set<String> extensions =
        properties.getIndexing().getSupportedExtensions().stream()
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    List<Path> files = new ArrayList<>();
    for (Path folder : folders) {
      if (!Files.isDirectory(folder)) {
        log.warn("Skipping {}: not a folder", folder);
        continue;
      }
      try (Stream<Path> walk = Files.walk(folder)) {
        walk.filter(Files::isRegularFile)
            .filter(
                path ->
                    FileType.extensionOf(path).map(extensions::contains).orElse(false)
                        && FileType.fromPath(path).isPresent())
            .sorted()
            .forEach(files::add);
      } catch (IOException e) {
        throw new UncheckedIOException("Cannot list folder " + folder, e);
      }
    }
    return files;
  }

  private ProgressTracker newTracker(int total, ProgressListener listener) {
    var indexing = properties.getIndexing();
    Duration estimate =
        Duration.ofMillis(Math.round(total * indexing.getSecondsPerDocumentEstimate() * 1000));
    ProgressListener effective =
        ProgressTracker.shouldShowProgress(estimate, indexing.getProgressThreshold())
            ? listener
            : ProgressListener.NONE;
    return new ProgressTracker(
        total, "Index rebuild", clock, indexing.getProgressMinInterval(), effective);
  }

  private IndexingReport report(
      IndexingOutcome outcome,
      List<String> indexed,
      List<IndexingReport.SkippedFile> skipped,
      int chunks,
      Instant started,
      String message) {
    return new IndexingReport(
        outcome, indexed, skipped, chunks, Duration.between(started, clock.instant()), message);
  }
}
