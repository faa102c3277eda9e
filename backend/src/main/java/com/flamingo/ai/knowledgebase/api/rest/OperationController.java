package com.flamingo.ai.knowledgebase.api.rest;

import com.flamingo.ai.knowledgebase.api.dto.request.CancelRequest;
import com.flamingo.ai.knowledgebase.service.operation.CancellationRegistry;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for cancelling running operations. */
@RestController
@RequestMapping("/api/operations")
@RequiredArgsConstructor
public class OperationController {

  private static final String DEFAULT_REASON = "Cancelled by user";

  private final CancellationRegistry cancellationRegistry;

  /** Cancels one operation; 404 if no such operation is running. */
  @PostMapping("/{operationId}/cancel")
  public ResponseEntity<Map<String, Object>> cancel(
      @PathVariable String operationId, @RequestBody(required = false) CancelRequest request) {
    if (cancellationRegistry.get(operationId).isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    boolean cancelled = cancellationRegistry.cancel(operationId, reasonOf(request));
    return ResponseEntity.ok(Map.of("operationId", operationId, "cancelled", cancelled));
  }

  @PostMapping("/cancel-all")
  public ResponseEntity<Map<String, Object>> cancelAll(
      @RequestBody(required = false) CancelRequest request) {
    int cancelled = cancellationRegistry.cancelAll(reasonOf(request));
    return ResponseEntity.ok(Map.of("cancelled", cancelled));
  }

  @GetMapping("/stats")
  public ResponseEntity<CancellationRegistry.Stats> stats() {
    return ResponseEntity.ok(cancellationRegistry.stats());
  }

  private static String reasonOf(CancelRequest request) {
    if (request == null || request.getReason() == null || request.getReason().isBlank()) {
      return DEFAULT_REASON;
    }
    return request.getReason();
  }
}
