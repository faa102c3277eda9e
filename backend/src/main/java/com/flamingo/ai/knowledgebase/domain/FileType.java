package com.flamingo.ai.knowledgebase.domain;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Supported source formats, resolved from the file extension. */
public enum FileType {
  PDF("pdf", Set.of(".pdf")),
  TEXT("text", Set.of(".txt")),
  MARKDOWN("markdown", Set.of(".md", ".markdown")),
  RICH_TEXT("rich-text", Set.of(".docx"));

  private final String tag;
  private final Set<String> extensions;

  FileType(String tag, Set<String> extensions) {
    this.tag = tag;
    this.extensions = extensions;
  }

  public String tag() {
    return tag;
  }

  public Set<String> extensions() {
    return extensions;
  }

  public static Optional<FileType> fromPath(Path path) {
    return extensionOf(path).flatMap(FileType::fromExtension);
  }

  public static Optional<FileType> fromExtension(String extension) {
    String normalized = extension.toLowerCase(Locale.ROOT);
    if (!normalized.startsWith(".")) {
      normalized = "." + normalized;
    }
    for (FileType type : values()) {
      if (type.extensions.contains(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  public static Optional<String> extensionOf(Path path) {
    Path fileName = path.getFileName();
    if (fileName == null) {
      return Optional.empty();
    }
    String name = fileName.toString();
    int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) {
      return Optional.empty();
    }
    return Optional.of(name.substring(dot).toLowerCase(Locale.ROOT));
  }
}
