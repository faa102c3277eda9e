package com.flamingo.ai.knowledgebase.service.document;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.domain.Document;
import com.flamingo.ai.knowledgebase.domain.IndexStatus;
import com.flamingo.ai.knowledgebase.exception.InvalidParameterException;
import com.flamingo.ai.knowledgebase.service.collection.CollectionStats;
import com.flamingo.ai.knowledgebase.service.collection.CompatibilityReport;
import com.flamingo.ai.knowledgebase.service.collection.InsertResult;
import com.flamingo.ai.knowledgebase.service.collection.VectorCollectionManager;
import com.flamingo.ai.knowledgebase.service.operation.CancellationToken;
import com.flamingo.ai.knowledgebase.service.reader.DocumentReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Single-document entry points: add, update, delete, plus collection maintenance. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentService {

  private final DocumentReader documentReader;
  private final VectorCollectionManager collectionManager;
  private final KnowledgeBaseProperties properties;

  /** Reads and indexes a file; the returned result carries the new document id. */
  public InsertResult addDocument(Path file, CancellationToken token) {
    Document document = documentReader.read(file);
    InsertResult result = collectionManager.insert(document, token);
    markCreated();
    return result;
  }

  /**
   * Indexes an uploaded file. The upload is written under its original name to a temporary folder
   * so that the stored file name and type match the upload, and removed afterwards.
   */
  public InsertResult addUploadedDocument(MultipartFile file, CancellationToken token) {
    String fileName =
        Path.of(Objects.requireNonNullElse(file.getOriginalFilename(), "upload"))
            .getFileName()
            .toString();
    Path folder = null;
    Path target = null;
    try {
      folder = Files.createTempDirectory("kb-upload-");
      target = folder.resolve(fileName);
      file.transferTo(target);
      return addDocument(target, token);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot store upload " + fileName, e);
    } finally {
      deleteQuietly(target);
      deleteQuietly(folder);
    }
  }

  /** Re-reads a file and replaces the chunks of an existing document with it. */
  public InsertResult updateDocument(String documentId, Path file, CancellationToken token) {
    Document replacement = documentReader.read(file);
    InsertResult result = collectionManager.update(documentId, replacement, token);
    markCreated();
    return result;
  }

  /** Returns the number of chunks removed. */
  public int deleteDocument(String documentId) {
    return collectionManager.delete(documentId);
  }

  public void clearIndex() {
    collectionManager.clear();
    properties.setIndexStatus(IndexStatus.NOT_CREATED);
    log.info("Index cleared");
  }

  /**
   * Makes {@code modelName} the active embedding model and reconciles the collection with it.
   * A collection built with a different dimension is recreated empty.
   */
  public CompatibilityReport switchEmbeddingModel(String modelName) {
    if (modelName == null || modelName.isBlank()) {
      throw new InvalidParameterException("embeddingModel", modelName, "a non-blank model name");
    }
    String previous = properties.getOllama().getEmbeddingModel();
    properties.getOllama().setEmbeddingModel(modelName.trim());
    CompatibilityReport report = collectionManager.checkCompatibility();
    log.info(
        "Embedding model switched from {} to {}: {}", previous, modelName, report.state());
    return report;
  }

  public CollectionStats stats() {
    return collectionManager.stats();
  }

  private void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not remove temporary upload {}: {}", path, e.getMessage());
    }
  }

  private void markCreated() {
    if (properties.getIndexStatus() != IndexStatus.CREATING) {
      properties.setIndexStatus(IndexStatus.CREATED);
    }
  }
}
