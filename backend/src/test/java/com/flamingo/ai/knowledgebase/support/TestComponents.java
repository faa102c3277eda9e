package com.flamingo.ai.knowledgebase.support;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.service.chunking.RecursiveTextChunker;
import com.flamingo.ai.knowledgebase.service.collection.VectorCollectionManager;
import com.flamingo.ai.knowledgebase.service.embedding.EmbeddingProvider;
import com.flamingo.ai.knowledgebase.service.reader.DocumentReader;
import com.flamingo.ai.knowledgebase.service.reader.MarkdownTextExtractor;
import com.flamingo.ai.knowledgebase.service.reader.PdfTextExtractor;
import com.flamingo.ai.knowledgebase.service.reader.PlainTextExtractor;
import com.flamingo.ai.knowledgebase.service.reader.RichTextExtractor;
import com.flamingo.ai.knowledgebase.vectorstore.VectorStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;

/** Real components wired by hand for service tests. */
public final class TestComponents {

  private TestComponents() {}

  public static DocumentReader documentReader(KnowledgeBaseProperties properties, Clock clock) {
    PlainTextExtractor plainText = new PlainTextExtractor();
    return new DocumentReader(
        new PdfTextExtractor(),
        plainText,
        new MarkdownTextExtractor(plainText),
        new RichTextExtractor(),
        properties,
        clock);
  }

  public static VectorCollectionManager collectionManager(
      VectorStore vectorStore,
      EmbeddingProvider embeddingProvider,
      KnowledgeBaseProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new VectorCollectionManager(
        vectorStore,
        embeddingProvider,
        new RecursiveTextChunker(properties),
        properties,
        clock,
        meterRegistry);
  }
}
