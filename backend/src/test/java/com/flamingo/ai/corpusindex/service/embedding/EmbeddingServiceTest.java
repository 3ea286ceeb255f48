package com.flamingo.ai.corpusindex.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private CorpusIndexConfig config;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);
    config = new CorpusIndexConfig();
    embeddingService = new EmbeddingService(embeddingModel, config, meterRegistry);
  }

  @Test
  @DisplayName("Should return the provider vector for a single text")
  void shouldReturnVector_whenEmbeddingOneText() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f})));

    float[] result = embeddingService.embed("Planarian regeneration");

    assertThat(result).containsExactly(0.1f, 0.2f, 0.3f);
    verify(meterRegistry.counter("embedding.requests.success", "type", "single")).increment();
  }

  @Test
  @DisplayName("Should truncate very long text before embedding")
  void shouldTruncate_whenTextTooLong() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {1f})));

    embeddingService.embed("a".repeat(9000));

    ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel).embed(sent.capture());
    assertThat(sent.getValue()).hasSize(8000);
  }

  @Test
  @DisplayName("Should keep input order when embedding a batch")
  @SuppressWarnings("unchecked")
  void shouldKeepOrder_whenEmbeddingBatch() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(
            Response.from(
                List.of(
                    Embedding.from(new float[] {1f, 0f}), Embedding.from(new float[] {0f, 1f}))));

    List<float[]> result = embeddingService.embedAll(List.of("first", "second"));

    assertThat(result).hasSize(2);
    assertThat(result.get(0)).containsExactly(1f, 0f);
    assertThat(result.get(1)).containsExactly(0f, 1f);
    ArgumentCaptor<List<TextSegment>> segments = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel).embedAll(segments.capture());
    assertThat(segments.getValue())
        .extracting(TextSegment::text)
        .containsExactly("first", "second");
  }

  @Test
  @DisplayName("Should not call the provider for an empty batch")
  void shouldSkipProvider_whenBatchEmpty() {
    assertThat(embeddingService.embedAll(List.of())).isEmpty();

    verify(embeddingModel, never()).embedAll(anyList());
  }

  @Test
  @DisplayName("Should derive the version from model name and dimensions when not configured")
  void shouldDeriveVersion_whenVersionBlank() {
    config.getEmbedding().setModelName("text-embedding-3-small");
    config.getEmbedding().setDimensions(1536);

    assertThat(embeddingService.version()).isEqualTo("text-embedding-3-small@1536");

    config.getEmbedding().setVersion("pinned-v2");
    assertThat(embeddingService.version()).isEqualTo("pinned-v2");
  }
}
