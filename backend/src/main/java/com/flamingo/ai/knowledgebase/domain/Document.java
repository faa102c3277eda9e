package com.flamingo.ai.knowledgebase.domain;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.Getter;

/** A source file whose text has been extracted and can be indexed. */
@Getter
public class Document {

  private static final int PREVIEW_LENGTH = 100;
  private static final Pattern KANA = Pattern.compile("[\\u3040-\\u30ff]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final String id;
  private final String title;
  private final Path filePath;
  private final FileType fileType;
  private final Instant createdAt;
  private String content;
  private long fileSize;
  private Instant updatedAt;

  public Document(
      String id,
      String title,
      String content,
      Path filePath,
      FileType fileType,
      long fileSize,
      Instant createdAt) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Document id must not be blank");
    }
    if (content == null || content.isBlank()) {
      throw new IllegalArgumentException("Document content must not be empty: " + filePath);
    }
    this.id = id;
    this.title = title;
    this.content = content;
    this.filePath = filePath;
    this.fileType = Objects.requireNonNull(fileType, "fileType");
    this.fileSize = fileSize;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  /** Builds a document for freshly extracted text; the title is the file name without extension. */
  public static Document fromFile(
      Path filePath, FileType fileType, String content, long fileSize, Clock clock) {
    return new Document(
        UUID.randomUUID().toString(),
        titleOf(filePath),
        content,
        filePath,
        fileType,
        fileSize,
        clock.instant());
  }

  /** Same document identity, new content. */
  public static Document replacing(String documentId, Document source) {
    return new Document(
        documentId,
        source.title,
        source.content,
        source.filePath,
        source.fileType,
        source.fileSize,
        source.createdAt);
  }

  public void updateContent(String newContent, Clock clock) {
    if (newContent == null || newContent.isBlank()) {
      throw new IllegalArgumentException("Document content must not be empty: " + filePath);
    }
    this.content = newContent;
    this.fileSize = newContent.getBytes(StandardCharsets.UTF_8).length;
    this.updatedAt = clock.instant();
  }

  public String fileName() {
    return filePath == null || filePath.getFileName() == null
        ? title
        : filePath.getFileName().toString();
  }

  public String preview() {
    return content.length() > PREVIEW_LENGTH
        ? content.substring(0, PREVIEW_LENGTH) + "..."
        : content;
  }

  /** Characters for text containing kana, whitespace-separated words otherwise. */
  public int wordCount() {
    if (KANA.matcher(content).find()) {
      return WHITESPACE.matcher(content).replaceAll("").length();
    }
    String trimmed = content.trim();
    return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
  }

  private static String titleOf(Path filePath) {
    String name = filePath.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
