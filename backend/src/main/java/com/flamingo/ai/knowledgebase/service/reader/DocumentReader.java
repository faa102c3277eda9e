package com.flamingo.ai.knowledgebase.service.reader;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.domain.Document;
import com.flamingo.ai.knowledgebase.domain.FileType;
import com.flamingo.ai.knowledgebase.exception.DocumentReadException;
import com.flamingo.ai.knowledgebase.exception.ErrorCode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a file on disk into a {@link Document}.
 *
 * <p>The format is resolved from the extension; each {@link FileType} maps to exactly one
 * extractor. The reader only reads files and never touches the index.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentReader {

  private static final long BYTES_PER_MB = 1024L * 1024L;

  private final PdfTextExtractor pdfTextExtractor;
  private final PlainTextExtractor plainTextExtractor;
  private final MarkdownTextExtractor markdownTextExtractor;
  private final RichTextExtractor richTextExtractor;
  private final KnowledgeBaseProperties properties;
  private final Clock clock;

  public boolean supports(Path path) {
    return FileType.fromPath(path).isPresent();
  }

  /**
   * Reads and extracts a file.
   *
   * @throws DocumentReadException with the code of the first unrecoverable failure
   */
  public Document read(Path path) {
    FileType fileType =
        FileType.fromPath(path)
            .orElseThrow(
                () ->
                    new DocumentReadException(
                        ErrorCode.UNSUPPORTED_FORMAT, path, "Unsupported file format: " + path));
    long size = validateFile(path);

    ExtractionResult result = extractorFor(fileType).extract(path);
    if (result instanceof ExtractionResult.Failure failure) {
      throw new DocumentReadException(
          failure.errorCode(), path, failure.message(), failure.cause());
    }
    ExtractionResult.Success success = (ExtractionResult.Success) result;
    if (success.text().isBlank()) {
      throw new DocumentReadException(ErrorCode.EMPTY_CONTENT, path, "No text in " + path);
    }
    log.info(
        "Read {} ({}, {} chars via {})",
        path.getFileName(),
        fileType.tag(),
        success.text().length(),
        success.strategy());
    return Document.fromFile(path, fileType, success.text(), size, clock);
  }

  TextExtractor extractorFor(FileType fileType) {
    return switch (fileType) {
      case PDF -> pdfTextExtractor;
      case TEXT -> plainTextExtractor;
      case MARKDOWN -> markdownTextExtractor;
      case RICH_TEXT -> richTextExtractor;
    };
  }

  private long validateFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new DocumentReadException(ErrorCode.CORRUPT_FILE, path, "Not a readable file: " + path);
    }
    try {
      long size = Files.size(path);
      long limit = properties.getIndexing().getMaxFileSizeMb() * BYTES_PER_MB;
      if (size > limit) {
        throw new DocumentReadException(
            ErrorCode.FILE_TOO_LARGE,
            path,
            "File is " + size + " bytes, limit is " + limit + " bytes: " + path);
      }
      return size;
    } catch (IOException e) {
      throw new DocumentReadException(
          ErrorCode.CORRUPT_FILE, path, "Cannot stat " + path + ": " + e.getMessage(), e);
    }
  }
}
