package com.flamingo.ai.knowledgebase.api.rest;

import com.flamingo.ai.knowledgebase.api.dto.request.DocumentPathRequest;
import com.flamingo.ai.knowledgebase.api.dto.response.DocumentResponse;
import com.flamingo.ai.knowledgebase.service.collection.InsertResult;
import com.flamingo.ai.knowledgebase.service.document.DocumentService;
import com.flamingo.ai.knowledgebase.service.operation.CancellationRegistry;
import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for single-document indexing. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;
  private final CancellationRegistry cancellationRegistry;

  /** Indexes a file from the local disk. */
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<DocumentResponse> addDocument(
      @Valid @RequestBody DocumentPathRequest request) {
    CancellationToken token = cancellationRegistry.create();
    try {
      InsertResult result = documentService.addDocument(Path.of(request.getPath()), token);
      return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.from(result));
    } finally {
      cancellationRegistry.release(token.getId());
    }
  }

  /** Indexes an uploaded file. */
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentResponse> uploadDocument(
      @RequestParam("file") MultipartFile file) {
    CancellationToken token = cancellationRegistry.create();
    try {
      InsertResult result = documentService.addUploadedDocument(file, token);
      return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.from(result));
    } finally {
      cancellationRegistry.release(token.getId());
    }
  }

  /** Replaces a document with the current content of a file. */
  @PutMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> updateDocument(
      @PathVariable String documentId, @Valid @RequestBody DocumentPathRequest request) {
    CancellationToken token = cancellationRegistry.create();
    try {
      InsertResult result =
          documentService.updateDocument(documentId, Path.of(request.getPath()), token);
      return ResponseEntity.ok(DocumentResponse.from(result));
    } finally {
      cancellationRegistry.release(token.getId());
    }
  }

  /** Deletes a document's chunks. */
  @DeleteMapping("/{documentId}")
  public ResponseEntity<Map<String, Object>> deleteDocument(@PathVariable String documentId) {
    int removed = documentService.deleteDocument(documentId);
    return ResponseEntity.ok(Map.of("documentId", documentId, "removedChunks", removed));
  }
}
