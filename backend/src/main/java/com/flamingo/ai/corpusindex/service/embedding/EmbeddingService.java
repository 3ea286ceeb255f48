package com.flamingo.ai.corpusindex.service.embedding;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embedding provider for chunks, queries and claims.
 *
 * <p>Every vector produced here belongs to {@link #version()}. An empty array means the call failed
 * and the caller should skip the item.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; chunks are far below, claims and queries too.
  // The char cap only guards against pathological input.
  private static final int MAX_CHARS_PER_EMBEDDING = 8000;

  private final EmbeddingModel embeddingModel;
  private final CorpusIndexConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds one text.
   *
   * @param text the text to embed
   * @return embedding vector, or an empty array when the provider is unavailable
   */
  @Timed(value = "embedding.embed", description = "Time to embed one text")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedFallback")
  @Retry(name = "openai")
  public float[] embed(String text) {
    String input = truncate(text, "Text");
    Response<Embedding> response = embeddingModel.embed(input);
    meterRegistry.counter("embedding.requests.success", "type", "single").increment();
    return response.content().vector();
  }

  /**
   * Embeds texts in one provider call. Order of results matches order of inputs.
   *
   * @param texts the texts to embed
   * @return embedding vectors, or an empty list when the provider is unavailable
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedAllFallback")
  @Retry(name = "openai")
  public List<float[]> embedAll(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      segments.add(TextSegment.from(truncate(texts.get(i), "Text " + i)));
    }
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (Embedding embedding : response.content()) {
      vectors.add(embedding.vector());
    }
    meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
    return vectors;
  }

  /** Provider version stamped on stored vectors. */
  public String version() {
    return config.getEmbedding().resolvedVersion();
  }

  private String truncate(String text, String what) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "{} too long for embedding, truncating from {} chars to {} chars",
        what,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  @SuppressWarnings("unused")
  private float[] embedFallback(String text, Throwable t) {
    log.error("Embedding failed, circuit breaker open: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "single").increment();
    return new float[0];
  }

  @SuppressWarnings("unused")
  private List<float[]> embedAllFallback(List<String> texts, Throwable t) {
    log.error(
        "Batch embedding of {} texts failed, circuit breaker open: {}",
        texts.size(),
        t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "batch").increment();
    return List.of();
  }
}
