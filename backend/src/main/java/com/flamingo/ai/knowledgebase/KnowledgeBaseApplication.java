package com.flamingo.ai.knowledgebase;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Local document knowledge base with retrieval-augmented question answering. */
@SpringBootApplication
public class KnowledgeBaseApplication {

  public static void main(String[] args) {
    SpringApplication.run(KnowledgeBaseApplication.class, args);
  }
}
