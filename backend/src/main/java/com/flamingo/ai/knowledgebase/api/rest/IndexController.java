package com.flamingo.ai.knowledgebase.api.rest;

import com.flamingo.ai.knowledgebase.api.dto.request.EmbeddingModelRequest;
import com.flamingo.ai.knowledgebase.api.dto.response.IndexingJobResponse;
import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.service.collection.CollectionStats;
import com.flamingo.ai.knowledgebase.service.collection.CompatibilityReport;
import com.flamingo.ai.knowledgebase.service.document.DocumentService;
import com.flamingo.ai.knowledgebase.service.indexing.IndexingJob;
import com.flamingo.ai.knowledgebase.service.indexing.IndexingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the index as a whole. */
@RestController
@RequestMapping("/api/index")
@RequiredArgsConstructor
@Slf4j
public class IndexController {

  private final IndexingService indexingService;
  private final DocumentService documentService;
  private final KnowledgeBaseProperties properties;

  /** Starts a rebuild from the configured folders; poll the returned operation for progress. */
  @PostMapping("/rebuild")
  public ResponseEntity<IndexingJobResponse> rebuild() {
    IndexingJob job = indexingService.startRebuild();
    log.info("Index rebuild {} started", job.getOperationId());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(IndexingJobResponse.from(job, properties.getIndexStatus()));
  }

  /** Gets the state of a rebuild. */
  @GetMapping("/operations/{operationId}")
  public ResponseEntity<IndexingJobResponse> getRebuild(@PathVariable String operationId) {
    return indexingService
        .findJob(operationId)
        .map(job -> ResponseEntity.ok(IndexingJobResponse.from(job, properties.getIndexStatus())))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  /** Removes every document from the index. */
  @DeleteMapping
  public ResponseEntity<Void> clear() {
    documentService.clearIndex();
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/stats")
  public ResponseEntity<CollectionStats> stats() {
    return ResponseEntity.ok(documentService.stats());
  }

  /** Switches the embedding model; an incompatible collection is recreated empty. */
  @PutMapping("/embedding-model")
  public ResponseEntity<CompatibilityReport> switchEmbeddingModel(
      @Valid @RequestBody EmbeddingModelRequest request) {
    return ResponseEntity.ok(documentService.switchEmbeddingModel(request.getModel()));
  }
}
