package com.flamingo.ai.corpusindex.service.index;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Exposes the one {@link ChunkIndex} of this process as a bean. */
@Configuration
public class ChunkIndexConfig {

  @Bean
  public ChunkIndex chunkIndex(ChunkIndexFactory chunkIndexFactory) {
    return chunkIndexFactory.create();
  }
}
