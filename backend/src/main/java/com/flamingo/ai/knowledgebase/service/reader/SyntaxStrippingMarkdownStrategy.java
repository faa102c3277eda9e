package com.flamingo.ai.knowledgebase.service.reader;

import com.flamingo.ai.knowledgebase.exception.ErrorCode;
import java.util.regex.Pattern;

/** Removes Markdown syntax with pattern substitution. */
class SyntaxStrippingMarkdownStrategy implements MarkdownStrategy {

  private static final Pattern CODE_FENCE = Pattern.compile("(?m)^```.*$");
  private static final Pattern HEADING = Pattern.compile("(?m)^#{1,6}\\s*");
  private static final Pattern EMPHASIS = Pattern.compile("(\\*\\*|__|\\*|_)(.+?)\\1");
  private static final Pattern INLINE_CODE = Pattern.compile("`([^`]*)`");
  private static final Pattern IMAGE = Pattern.compile("!\\[([^\\]]*)]\\([^)]*\\)");
  private static final Pattern LINK = Pattern.compile("\\[([^\\]]*)]\\([^)]*\\)");
  private static final Pattern LIST_MARKER = Pattern.compile("(?m)^\\s*([-*+]|\\d+\\.)\\s+");
  private static final Pattern BLOCKQUOTE = Pattern.compile("(?m)^>\\s?");
  private static final Pattern BLANK_RUNS = Pattern.compile("\\n{3,}");

  @Override
  public String name() {
    return "syntax-stripping";
  }

  @Override
  public ExtractionResult apply(String markdown) {
    String text = CODE_FENCE.matcher(markdown).replaceAll("");
    text = HEADING.matcher(text).replaceAll("");
    text = IMAGE.matcher(text).replaceAll("$1");
    text = LINK.matcher(text).replaceAll("$1");
    text = EMPHASIS.matcher(text).replaceAll("$2");
    text = INLINE_CODE.matcher(text).replaceAll("$1");
    text = LIST_MARKER.matcher(text).replaceAll("");
    text = BLOCKQUOTE.matcher(text).replaceAll("");
    text = BLANK_RUNS.matcher(text).replaceAll("\n\n").trim();
    if (text.isBlank()) {
      return ExtractionResult.failure(ErrorCode.EMPTY_CONTENT, "Markdown produced no text");
    }
    return ExtractionResult.success(text, name());
  }
}
