package com.flamingo.ai.corpusindex.service.taxonomy.labeling;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import com.flamingo.ai.corpusindex.service.BoundedExecution;
import com.flamingo.ai.corpusindex.service.taxonomy.model.ClusterLabel;
import com.flamingo.ai.corpusindex.service.taxonomy.model.DocumentVector;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Labels all clusters of a rebuild in parallel.
 *
 * <p>Each call is bounded by the label timeout. A label that fails or arrives late is replaced by
 * the placeholder {@code "Cluster {id}"}, so labeling never fails a rebuild.
 */
@Slf4j
@Service
public class ClusterLabelingService {

  static final String SKIPPED_DESCRIPTION = "Label generation skipped.";
  static final String FAILED_DESCRIPTION = "Cluster description pending.";

  private final ClusterLabeler labeler;
  private final CorpusIndexConfig config;
  private final Executor labelingExecutor;
  private final MeterRegistry meterRegistry;

  public ClusterLabelingService(
      ClusterLabeler labeler,
      CorpusIndexConfig config,
      @Qualifier("labelingExecutor") Executor labelingExecutor,
      MeterRegistry meterRegistry) {
    this.labeler = labeler;
    this.config = config;
    this.labelingExecutor = labelingExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Labels clusters {@code 0..samples.size()-1}.
   *
   * @param samples per cluster, its member documents ordered by descending confidence
   * @param skipLabels use placeholders without calling the labeler
   * @return one label per cluster, in cluster id order
   */
  public List<ClusterLabel> labelAll(List<List<DocumentVector>> samples, boolean skipLabels) {
    List<ClusterLabel> labels = new ArrayList<>(samples.size());
    if (skipLabels) {
      for (int clusterId = 0; clusterId < samples.size(); clusterId++) {
        labels.add(ClusterLabel.placeholder(clusterId, SKIPPED_DESCRIPTION));
      }
      log.info("Label generation skipped for {} clusters", samples.size());
      return labels;
    }

    int sampleSize = Math.max(1, config.getTaxonomy().getLabelSampleSize());
    List<CompletableFuture<ClusterLabel>> futures = new ArrayList<>(samples.size());
    for (int clusterId = 0; clusterId < samples.size(); clusterId++) {
      int id = clusterId;
      List<DocumentVector> members = samples.get(clusterId);
      List<DocumentVector> sample = members.subList(0, Math.min(sampleSize, members.size()));
      futures.add(
          BoundedExecution.submit(
              labelingExecutor,
              config.getTaxonomy().getLabelTimeout(),
              () -> labeler.label(id, sample)));
    }

    int fallbacks = 0;
    for (int clusterId = 0; clusterId < futures.size(); clusterId++) {
      try {
        labels.add(futures.get(clusterId).join());
      } catch (CompletionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof TimeoutException) {
          log.warn("Labeling timed out for cluster {}, using placeholder", clusterId);
        } else {
          log.warn("Using placeholder for cluster {}: {}", clusterId, cause.getMessage());
        }
        labels.add(ClusterLabel.placeholder(clusterId, FAILED_DESCRIPTION));
        fallbacks++;
      }
    }
    if (fallbacks > 0) {
      meterRegistry.counter("taxonomy.labels.fallback").increment(fallbacks);
    }
    log.info("Labeled {} clusters ({} placeholders)", samples.size(), fallbacks);
    return labels;
  }
}
