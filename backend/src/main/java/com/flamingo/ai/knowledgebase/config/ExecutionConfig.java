package com.flamingo.ai.knowledgebase.config;

import java.time.Clock;
import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for background indexing, scheduled sweeps and the system clock. */
@Configuration
@EnableAsync
@EnableScheduling
public class ExecutionConfig {

  /** Single worker: rebuilds share one collection and must not overlap. */
  @Bean(name = "indexingExecutor")
  public Executor indexingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(10);
    executor.setThreadNamePrefix("indexing-");
    executor.initialize();
    return executor;
  }

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
