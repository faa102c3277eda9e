package com.flamingo.ai.knowledgebase.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.knowledgebase.support.MutableClock;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Document Tests")
class DocumentTest {

  private final MutableClock clock = MutableClock.startingAtEpoch();

  @Test
  @DisplayName("should derive the title from the file name without extension")
  void shouldDeriveTitle() {
    Document document =
        Document.fromFile(Path.of("/docs/annual.report.pdf"), FileType.PDF, "text", 4, clock);

    assertThat(document.getTitle()).isEqualTo("annual.report");
    assertThat(document.fileName()).isEqualTo("annual.report.pdf");
    assertThat(document.getCreatedAt()).isEqualTo(clock.instant());
  }

  @Test
  @DisplayName("should reject blank content")
  void shouldRejectBlankContent() {
    assertThatThrownBy(
            () -> Document.fromFile(Path.of("a.txt"), FileType.TEXT, "  ", 2, clock))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should truncate the preview to 100 characters")
  void shouldTruncatePreview() {
    Document document =
        Document.fromFile(Path.of("a.txt"), FileType.TEXT, "x".repeat(150), 150, clock);

    assertThat(document.preview()).hasSize(103).endsWith("...");
  }

  @Test
  @DisplayName("should count words, or characters for kana text")
  void shouldCountWords() {
    Document english =
        Document.fromFile(Path.of("a.txt"), FileType.TEXT, " one two\nthree ", 15, clock);
    Document japanese =
        Document.fromFile(Path.of("b.txt"), FileType.TEXT, "これは テスト", 20, clock);

    assertThat(english.wordCount()).isEqualTo(3);
    assertThat(japanese.wordCount()).isEqualTo(6);
  }

  @Test
  @DisplayName("should refresh size and timestamp on content update")
  void shouldUpdateContent() {
    Document document = Document.fromFile(Path.of("a.txt"), FileType.TEXT, "old", 3, clock);
    clock.advance(Duration.ofMinutes(1));

    document.updateContent("newer text", clock);

    assertThat(document.getContent()).isEqualTo("newer text");
    assertThat(document.getFileSize()).isEqualTo(10);
    assertThat(document.getUpdatedAt()).isAfter(document.getCreatedAt());
  }

  @Test
  @DisplayName("should keep the id when replacing content")
  void shouldKeepIdWhenReplacing() {
    Document replacement =
        Document.fromFile(Path.of("a.txt"), FileType.TEXT, "replacement", 11, clock);

    Document replaced = Document.replacing("doc-1", replacement);

    assertThat(replaced.getId()).isEqualTo("doc-1");
    assertThat(replaced.getContent()).isEqualTo("replacement");
  }
}
