package com.flamingo.ai.corpusindex.service.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.corpusindex.exception.EmbeddingDimensionMismatchException;
import com.flamingo.ai.corpusindex.service.chunking.model.Chunk;
import com.flamingo.ai.corpusindex.service.index.model.ChunkSearchResult;
import com.flamingo.ai.corpusindex.service.index.model.EmbeddedChunk;
import com.flamingo.ai.corpusindex.service.index.model.IndexStats;
import com.flamingo.ai.corpusindex.service.index.model.IndexWriteResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for vector index backends.
 *
 * <p>Owns the parts of the contract that must behave identically across backends: vector
 * consistency checks, upsert batching, top-k and min-score handling, metrics and result logging.
 * Subclasses only move data.
 */
@Slf4j
public abstract class AbstractChunkIndex implements ChunkIndex {

  private static final ObjectMapper FILTER_MAPPER = new ObjectMapper();

  protected final MeterRegistry meterRegistry;
  private final int upsertBatchSize;
  private final double minScore;

  protected AbstractChunkIndex(MeterRegistry meterRegistry, int upsertBatchSize, double minScore) {
    this.meterRegistry = meterRegistry;
    this.upsertBatchSize = Math.max(1, upsertBatchSize);
    this.minScore = minScore;
  }

  /**
   * Inserts or replaces one batch of already validated chunks.
   *
   * @param batch chunks sharing the index's dimensionality and version
   */
  protected abstract void writeBatch(List<EmbeddedChunk> batch);

  /**
   * Backend-specific nearest-neighbour search.
   *
   * @param queryEmbedding validated query vector
   * @param topK maximum number of hits, positive
   * @param minScore minimum normalized score
   * @param filterCriteria equality constraints, never null
   * @return hits ordered by descending score
   */
  protected abstract List<ChunkSearchResult> doSearch(
      float[] queryEmbedding, int topK, double minScore, Map<String, Object> filterCriteria);

  /** Creates tables or loads files. Called once by the factory before first use. */
  protected void initialize() {}

  /** Makes the batches written by one upsert durable. */
  protected void flush() {}

  /**
   * Returns the metric prefix for this backend (e.g. "index.local").
   *
   * @return the metric prefix
   */
  protected String getMetricPrefix() {
    return "index." + backend().configValue();
  }

  @Override
  public IndexWriteResult upsert(List<EmbeddedChunk> chunks) {
    if (chunks.isEmpty()) {
      return IndexWriteResult.empty();
    }

    IndexStats current = stats();
    int dimensionality = current.isEmpty() ? 0 : current.dimensionality();
    String version = current.isEmpty() ? null : current.embeddingVersion();

    List<EmbeddedChunk> accepted = new ArrayList<>(chunks.size());
    int skipped = 0;
    for (EmbeddedChunk item : chunks) {
      try {
        validate(item, dimensionality, version);
        if (dimensionality == 0) {
          dimensionality = item.embedding().length;
          version = item.embeddingVersion();
        }
        accepted.add(item);
      } catch (EmbeddingDimensionMismatchException e) {
        log.warn("Skipping chunk: {}", e.getMessage());
        skipped++;
      }
    }

    for (int from = 0; from < accepted.size(); from += upsertBatchSize) {
      List<EmbeddedChunk> batch =
          accepted.subList(from, Math.min(from + upsertBatchSize, accepted.size()));
      writeBatch(batch);
      log.debug("Upserted batch of {} chunks into {} index", batch.size(), backend());
    }
    if (!accepted.isEmpty()) {
      flush();
    }

    meterRegistry.counter(getMetricPrefix() + ".upserted").increment(accepted.size());
    if (skipped > 0) {
      meterRegistry.counter(getMetricPrefix() + ".skipped").increment(skipped);
    }
    return new IndexWriteResult(accepted.size(), skipped);
  }

  @Override
  public List<ChunkSearchResult> search(
      float[] queryEmbedding, int topK, Map<String, Object> filterCriteria) {
    if (topK <= 0) {
      return List.of();
    }
    IndexStats current = stats();
    if (current.isEmpty()) {
      return List.of();
    }
    if (queryEmbedding.length != current.dimensionality()) {
      throw new EmbeddingDimensionMismatchException(
          "query",
          "expected " + current.dimensionality() + " dimensions but got " + queryEmbedding.length);
    }
    Map<String, Object> filter = filterCriteria == null ? Map.of() : filterCriteria;
    List<ChunkSearchResult> results = doSearch(queryEmbedding, topK, minScore, filter);
    meterRegistry.counter(getMetricPrefix() + ".search").increment();
    logSearchResults(filter, results);
    return results;
  }

  /**
   * Rejects vectors that would mix dimensionalities or provider versions in one index.
   *
   * @param dimensionality established dimensionality, 0 when the index is still empty
   * @param version established version, null when the index is still empty
   */
  protected void validate(EmbeddedChunk item, int dimensionality, String version) {
    float[] embedding = item.embedding();
    if (embedding == null || embedding.length == 0) {
      throw new EmbeddingDimensionMismatchException(item.chunkId(), "empty embedding");
    }
    if (dimensionality > 0 && embedding.length != dimensionality) {
      throw new EmbeddingDimensionMismatchException(
          item.chunkId(),
          "expected " + dimensionality + " dimensions but got " + embedding.length);
    }
    if (version != null && !Objects.equals(version, item.embeddingVersion())) {
      throw new EmbeddingDimensionMismatchException(
          item.chunkId(),
          String.format(
              "embedding version '%s' differs from index version '%s'",
              item.embeddingVersion(), version));
    }
  }

  /**
   * Equality match of scalar metadata values with the semantics of JSONB containment ({@code
   * metadata @> filter}): values are compared as JSON values, so the string {@code "2021"} does not
   * match the number {@code 2021}, numbers compare by numeric value, and a null criterion matches
   * only a key stored with a null value.
   */
  protected static boolean matchesFilter(
      Map<String, Object> metadata, Map<String, Object> filterCriteria) {
    for (Map.Entry<String, Object> criterion : filterCriteria.entrySet()) {
      if (!metadata.containsKey(criterion.getKey())) {
        return false;
      }
      JsonNode actual = FILTER_MAPPER.valueToTree(metadata.get(criterion.getKey()));
      JsonNode expected = FILTER_MAPPER.valueToTree(criterion.getValue());
      if (!jsonEquals(actual, expected)) {
        return false;
      }
    }
    return true;
  }

  private static boolean jsonEquals(JsonNode actual, JsonNode expected) {
    if (actual.isNumber() && expected.isNumber()) {
      return actual.decimalValue().compareTo(expected.decimalValue()) == 0;
    }
    return actual.equals(expected);
  }

  private void logSearchResults(Map<String, Object> filter, List<ChunkSearchResult> results) {
    log.debug(
        "[search] backend={} filter={} returned={}",
        backend().configValue(),
        filter,
        results.size());
    if (!log.isTraceEnabled()) {
      return;
    }
    for (int i = 0; i < results.size(); i++) {
      Chunk chunk = results.get(i).chunk();
      String text = chunk.text();
      String preview = text.length() > 120 ? text.substring(0, 120) + "..." : text;
      log.trace(
          "  rank={} id={} score={} section='{}' text='{}'",
          i + 1,
          chunk.chunkId(),
          results.get(i).score(),
          chunk.sectionHeading(),
          preview);
    }
  }
}
