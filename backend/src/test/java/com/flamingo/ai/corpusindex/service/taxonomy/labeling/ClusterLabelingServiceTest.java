package com.flamingo.ai.corpusindex.service.taxonomy.labeling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import com.flamingo.ai.corpusindex.exception.ClusterLabelingException;
import com.flamingo.ai.corpusindex.service.taxonomy.model.ClusterLabel;
import com.flamingo.ai.corpusindex.service.taxonomy.model.DocumentVector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClusterLabelingService Tests")
class ClusterLabelingServiceTest {

  private static final ClusterLabel GOOD =
      new ClusterLabel("Regeneration", "Whole-body regeneration.", List.of("a", "b", "c"), "llm");

  @Mock private ClusterLabeler labeler;

  private CorpusIndexConfig config;
  private SimpleMeterRegistry meterRegistry;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    config = new CorpusIndexConfig();
    meterRegistry = new SimpleMeterRegistry();
    executor = Executors.newFixedThreadPool(2);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  @DisplayName("should use placeholders without calling the labeler when labels are skipped")
  void shouldUsePlaceholders_whenSkipped() {
    ClusterLabelingService service = service();

    List<ClusterLabel> labels = service.labelAll(List.of(members(1), members(2)), true);

    assertThat(labels).extracting(ClusterLabel::label).containsExactly("Cluster 0", "Cluster 1");
    assertThat(labels).allSatisfy(l -> assertThat(l.isPlaceholder()).isTrue());
    verifyNoInteractions(labeler);
  }

  @Test
  @DisplayName("should replace a failed label with a placeholder and keep the others")
  void shouldFallBackToPlaceholder_whenLabelerFails() {
    when(labeler.label(eq(0), anyList())).thenReturn(GOOD);
    when(labeler.label(eq(1), anyList())).thenThrow(new ClusterLabelingException(1, "bad json"));

    List<ClusterLabel> labels = service().labelAll(List.of(members(2), members(2)), false);

    assertThat(labels.get(0)).isEqualTo(GOOD);
    assertThat(labels.get(1))
        .isEqualTo(ClusterLabel.placeholder(1, ClusterLabelingService.FAILED_DESCRIPTION));
    assertThat(meterRegistry.counter("taxonomy.labels.fallback").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should replace a label that exceeds the timeout with a placeholder")
  void shouldFallBackToPlaceholder_whenLabelerTimesOut() {
    config.getTaxonomy().setLabelTimeout(Duration.ofMillis(100));
    when(labeler.label(anyInt(), anyList()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(2000);
              return GOOD;
            });

    List<ClusterLabel> labels = service().labelAll(List.of(members(1)), false);

    assertThat(labels.get(0).isPlaceholder()).isTrue();
    assertThat(labels.get(0).label()).isEqualTo("Cluster 0");
  }

  @Test
  @DisplayName("should send at most the configured number of members")
  @SuppressWarnings("unchecked")
  void shouldLimitSample_whenClusterLarge() {
    config.getTaxonomy().setLabelSampleSize(2);
    when(labeler.label(anyInt(), anyList())).thenReturn(GOOD);

    service().labelAll(List.of(members(4)), false);

    ArgumentCaptor<List<DocumentVector>> sample = ArgumentCaptor.forClass(List.class);
    verify(labeler).label(eq(0), sample.capture());
    assertThat(sample.getValue())
        .extracting(DocumentVector::documentId)
        .containsExactly("d0", "d1");
  }

  private ClusterLabelingService service() {
    return new ClusterLabelingService(labeler, config, executor, meterRegistry);
  }

  private static List<DocumentVector> members(int count) {
    DocumentVector[] members = new DocumentVector[count];
    for (int i = 0; i < count; i++) {
      members[i] = new DocumentVector("d" + i, "Title " + i, "", null, new double[] {1, 0}, 1);
    }
    return List.of(members);
  }
}
