package com.flamingo.ai.knowledgebase.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.knowledgebase.elasticsearch.ElasticsearchVectorStore;
import com.flamingo.ai.knowledgebase.vectorstore.LocalFileVectorStore;
import com.flamingo.ai.knowledgebase.vectorstore.VectorStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the collection backend from {@code knowledge-base.collection.store}. */
@Configuration
@Slf4j
public class VectorStoreConfig {

  @Bean
  @ConditionalOnProperty(
      prefix = "knowledge-base.collection",
      name = "store",
      havingValue = "local",
      matchIfMissing = true)
  public VectorStore localFileVectorStore(KnowledgeBaseProperties properties) {
    log.info("Using local vector store at {}", properties.getCollection().getStoragePath());
    return new LocalFileVectorStore(properties.getCollection().getStoragePath());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "knowledge-base.collection",
      name = "store",
      havingValue = "elasticsearch")
  public VectorStore elasticsearchVectorStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      ElasticsearchConfig elasticsearchConfig) {
    log.info("Using Elasticsearch vector store at {}", elasticsearchConfig.location());
    return new ElasticsearchVectorStore(
        elasticsearchClient, meterRegistry, elasticsearchConfig.location());
  }
}
