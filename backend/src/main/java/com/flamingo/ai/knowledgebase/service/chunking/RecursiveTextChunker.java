package com.flamingo.ai.knowledgebase.service.chunking;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.domain.Document;
import com.flamingo.ai.knowledgebase.exception.ChunkSplitException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Splits text into overlapping windows, preferring paragraph, then line, then word boundaries
 * before cutting inside a word.
 *
 * <p>Pieces shorter than the window are merged greedily; when a window is emitted, leading pieces
 * are dropped until at most {@code overlap} characters remain to seed the next window. Output is
 * a pure function of the input and parameters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecursiveTextChunker {

  static final List<String> SEPARATORS = List.of("\n\n", "\n", " ", "");

  private final KnowledgeBaseProperties properties;

  /** Chunks a document with the configured window size and overlap. */
  public List<TextChunk> chunk(Document document) {
    var config = properties.getChunking();
    List<String> windows = split(document.getContent(), config.getSize(), config.getOverlap());
    List<TextChunk> chunks = new ArrayList<>(windows.size());
    for (int i = 0; i < windows.size(); i++) {
      chunks.add(new TextChunk(document.getId(), i, windows.get(i)));
    }
    log.debug("Document {} split into {} chunk(s)", document.getId(), chunks.size());
    return chunks;
  }

  /**
   * Splits text into windows of at most {@code windowSize} characters.
   *
   * @throws ChunkSplitException if the parameters are invalid or the text is blank
   */
  public List<String> split(String text, int windowSize, int overlap) {
    if (windowSize <= 0 || overlap < 0 || overlap >= windowSize) {
      throw new ChunkSplitException(
          "Chunk overlap must be in [0, window size)",
          Map.of("windowSize", windowSize, "overlap", overlap));
    }
    if (text == null || text.isBlank()) {
      throw new ChunkSplitException("Cannot split blank text", Map.of("windowSize", windowSize));
    }
    List<String> chunks = splitRecursive(text, SEPARATORS, windowSize, overlap);
    if (chunks.isEmpty()) {
      throw new ChunkSplitException(
          "Text produced no chunks", Map.of("length", text.length(), "windowSize", windowSize));
    }
    return chunks;
  }

  private List<String> splitRecursive(
      String text, List<String> separators, int windowSize, int overlap) {
    String separator = separators.get(separators.size() - 1);
    List<String> remaining = List.of();
    for (int i = 0; i < separators.size(); i++) {
      String candidate = separators.get(i);
      if (candidate.isEmpty() || text.contains(candidate)) {
        separator = candidate;
        remaining = separators.subList(i + 1, separators.size());
        break;
      }
    }

    List<String> result = new ArrayList<>();
    List<String> fitting = new ArrayList<>();
    for (String piece : splitKeepingSeparator(text, separator)) {
      if (piece.length() < windowSize) {
        fitting.add(piece);
        continue;
      }
      if (!fitting.isEmpty()) {
        result.addAll(merge(fitting, windowSize, overlap));
        fitting = new ArrayList<>();
      }
      if (remaining.isEmpty()) {
        result.add(piece);
      } else {
        result.addAll(splitRecursive(piece, remaining, windowSize, overlap));
      }
    }
    if (!fitting.isEmpty()) {
      result.addAll(merge(fitting, windowSize, overlap));
    }
    return result;
  }

  /** Each separator stays attached to the start of the piece that follows it. */
  private static List<String> splitKeepingSeparator(String text, String separator) {
    List<String> pieces = new ArrayList<>();
    if (separator.isEmpty()) {
      text.codePoints().forEach(cp -> pieces.add(new String(Character.toChars(cp))));
      return pieces;
    }
    int start = 0;
    int next = text.indexOf(separator);
    while (next >= 0) {
      if (next > start) {
        pieces.add(text.substring(start, next));
      }
      start = next;
      next = text.indexOf(separator, next + separator.length());
    }
    if (start < text.length()) {
      pieces.add(text.substring(start));
    }
    return pieces;
  }

  private static List<String> merge(List<String> pieces, int windowSize, int overlap) {
    List<String> windows = new ArrayList<>();
    Deque<String> current = new ArrayDeque<>();
    int total = 0;
    for (String piece : pieces) {
      if (total + piece.length() > windowSize) {
        if (!current.isEmpty()) {
          addWindow(windows, current);
          while (total > overlap || (total > 0 && total + piece.length() > windowSize)) {
            total -= current.removeFirst().length();
          }
        }
      }
      current.addLast(piece);
      total += piece.length();
    }
    addWindow(windows, current);
    return windows;
  }

  private static void addWindow(List<String> windows, Deque<String> pieces) {
    String window = String.join("", pieces).strip();
    if (!window.isEmpty()) {
      windows.add(window);
    }
  }
}
