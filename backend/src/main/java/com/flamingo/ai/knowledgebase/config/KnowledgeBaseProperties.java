package com.flamingo.ai.knowledgebase.config;

import com.flamingo.ai.knowledgebase.domain.IndexStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the local knowledge base. */
@Configuration
@ConfigurationProperties(prefix = "knowledge-base")
@Validated
@Getter
@Setter
public class KnowledgeBaseProperties {

  @Valid private Ollama ollama = new Ollama();
  @Valid private Collection collection = new Collection();
  @Valid private Indexing indexing = new Indexing();
  @Valid private Chunking chunking = new Chunking();
  @Valid private Retrieval retrieval = new Retrieval();
  @Valid private Generation generation = new Generation();
  @Valid private Cancellation cancellation = new Cancellation();

  /** Updated by indexing entry points; not meant to be set from configuration files. */
  private volatile IndexStatus indexStatus = IndexStatus.NOT_CREATED;

  @Getter
  @Setter
  public static class Ollama {
    @NotBlank private String baseUrl = "http://localhost:11434";
    @NotBlank private String generationModel = "llama3:8b";
    @NotBlank private String embeddingModel = "nomic-embed-text";
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration generateTimeout = Duration.ofSeconds(30);
    private Duration streamTimeout = Duration.ofSeconds(60);
    private Duration embeddingTimeout = Duration.ofSeconds(60);
    private Duration tagsTimeout = Duration.ofSeconds(5);

    /** Offered when the model list cannot be fetched. */
    private List<String> fallbackEmbeddingModels =
        new ArrayList<>(
            List.of(
                "nomic-embed-text", "mxbai-embed-large", "all-minilm", "snowflake-arctic-embed"));
  }

  /** Which backend persists the collection. */
  public enum StoreType {
    LOCAL,
    ELASTICSEARCH
  }

  @Getter
  @Setter
  public static class Collection {
    @NotBlank private String name = "knowledge_base";
    private Path storagePath = Path.of("./data/vector_store");
    private StoreType store = StoreType.LOCAL;
  }

  @Getter
  @Setter
  public static class Indexing {
    private List<Path> folders = new ArrayList<>();
    private List<String> supportedExtensions =
        new ArrayList<>(List.of(".pdf", ".txt", ".md", ".docx"));

    @Min(1)
    private int maxFileSizeMb = 50;

    private Duration progressMinInterval = Duration.ofMillis(100);
    private Duration progressThreshold = Duration.ofSeconds(3);
    private double secondsPerDocumentEstimate = 2.0;

    /** How long a finished background run stays observable by its operation id. */
    private Duration jobRetention = Duration.ofHours(1);
  }

  @Getter
  @Setter
  public static class Chunking {
    @Min(1)
    private int size = 1000;

    @Min(0)
    private int overlap = 200;

    @AssertTrue(message = "chunk overlap must be smaller than chunk size")
    public boolean isOverlapSmallerThanSize() {
      return overlap < size;
    }
  }

  @Getter
  @Setter
  public static class Retrieval {
    @Min(1)
    private int topK = 5;

    private double minSimilarity = 0.0;
    private int maxContextLength = 4000;
    private int historyTurns = 5;
  }

  @Getter
  @Setter
  public static class Generation {
    private double temperature = 0.7;
    private double topP = 0.9;
    private int topK = 40;
    private int maxTokens = 2000;
    private List<String> stop = new ArrayList<>(List.of("[DONE]", "<|im_end|>"));
  }

  @Getter
  @Setter
  public static class Cancellation {
    private Duration tokenMaxAge = Duration.ofHours(1);
    private Duration sweepInterval = Duration.ofMinutes(5);
  }
}
