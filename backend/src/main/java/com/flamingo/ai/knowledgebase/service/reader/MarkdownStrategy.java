package com.flamingo.ai.knowledgebase.service.reader;

/** One way of turning Markdown source into plain text. */
public interface MarkdownStrategy {

  String name();

  ExtractionResult apply(String markdown);
}
