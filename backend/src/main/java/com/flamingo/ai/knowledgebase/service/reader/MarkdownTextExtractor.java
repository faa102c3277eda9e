package com.flamingo.ai.knowledgebase.service.reader;

import com.flamingo.ai.knowledgebase.domain.FileType;
import com.flamingo.ai.knowledgebase.exception.ErrorCode;
import com.google.common.annotations.VisibleForTesting;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Extracts Markdown by trying an ordered list of strategies: structure-aware parsing, then syntax
 * stripping, then the decoded source as plain text. The first success wins.
 */
@Component
@Slf4j
public class MarkdownTextExtractor implements TextExtractor {

  private final PlainTextExtractor plainTextExtractor;
  private final List<MarkdownStrategy> strategies;

  @Autowired
  public MarkdownTextExtractor(PlainTextExtractor plainTextExtractor) {
    this(
        plainTextExtractor,
        List.of(new StructuredMarkdownStrategy(), new SyntaxStrippingMarkdownStrategy()));
  }

  @VisibleForTesting
  MarkdownTextExtractor(PlainTextExtractor plainTextExtractor, List<MarkdownStrategy> strategies) {
    this.plainTextExtractor = plainTextExtractor;
    this.strategies = strategies;
  }

  @Override
  public FileType fileType() {
    return FileType.MARKDOWN;
  }

  @Override
  public ExtractionResult extract(Path path) {
    ExtractionResult decoded = plainTextExtractor.decode(path);
    if (!(decoded instanceof ExtractionResult.Success source)) {
      return decoded;
    }
    if (source.text().isBlank()) {
      return ExtractionResult.failure(ErrorCode.EMPTY_CONTENT, "Markdown file is empty: " + path);
    }

    for (MarkdownStrategy strategy : strategies) {
      ExtractionResult result = attempt(strategy, source.text());
      if (result.isSuccess()) {
        return result;
      }
      log.warn(
          "Markdown strategy '{}' failed for {}, trying next: {}",
          strategy.name(),
          path,
          ((ExtractionResult.Failure) result).message());
    }
    return ExtractionResult.success(source.text(), "plain-text");
  }

  private ExtractionResult attempt(MarkdownStrategy strategy, String markdown) {
    try {
      return strategy.apply(markdown);
    } catch (RuntimeException e) {
      return ExtractionResult.failure(ErrorCode.CORRUPT_FILE, e.getMessage(), e);
    }
  }
}
