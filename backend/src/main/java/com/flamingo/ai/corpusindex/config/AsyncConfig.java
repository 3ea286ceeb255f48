package com.flamingo.ai.corpusindex.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for the side-effect-free parallel stages of the batch pipelines.
 *
 * <p>Work submitted here must complete (or fail) before a pipeline writes shared state.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "embeddingExecutor")
  public Executor embeddingExecutor(CorpusIndexConfig config) {
    int parallelism = Math.max(1, config.getEmbedding().getParallelism());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism);
    executor.setMaxPoolSize(parallelism);
    executor.setQueueCapacity(Math.max(1, config.getEmbedding().getSubmitWindow()));
    executor.setThreadNamePrefix("embed-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "labelingExecutor")
  public Executor labelingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("label-");
    executor.initialize();
    return executor;
  }
}
