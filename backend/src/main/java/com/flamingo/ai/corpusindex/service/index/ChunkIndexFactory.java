package com.flamingo.ai.corpusindex.service.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the {@link ChunkIndex} selected by {@code corpus.index.backend}.
 *
 * <p>Called once per process from {@link ChunkIndexConfig}; callers receive the interface through
 * injection and never learn which backend serves it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChunkIndexFactory {

  private final CorpusIndexConfig config;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final ObjectProvider<JdbcTemplate> jdbcTemplateProvider;

  public ChunkIndex create() {
    CorpusIndexConfig.Index index = config.getIndex();
    IndexBackend backend = IndexBackend.fromConfigValue(index.getBackend());
    AbstractChunkIndex chunkIndex =
        switch (backend) {
          case LOCAL -> new LocalFileChunkIndex(
              Path.of(index.getLocal().getPath()),
              objectMapper,
              meterRegistry,
              index.getUpsertBatchSize(),
              index.getMinScore());
          case PGVECTOR -> new PgVectorChunkIndex(
              jdbcTemplateProvider.getObject(),
              objectMapper,
              meterRegistry,
              index.getPgvector().getTable(),
              index.getPgvector().getMatchFunction(),
              config.getEmbedding().getDimensions(),
              index.getPgvector().isInitializeSchema(),
              index.getUpsertBatchSize(),
              index.getMinScore());
        };
    chunkIndex.initialize();
    log.info("Vector index backend: {}", backend.configValue());
    return chunkIndex;
  }
}
