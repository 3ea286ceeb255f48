package com.flamingo.ai.corpusindex.service.taxonomy.model;

import com.flamingo.ai.corpusindex.domain.entity.TaxonomyCluster;
import com.flamingo.ai.corpusindex.service.PipelineRunSummary;
import java.util.List;

/**
 * Outcome of a taxonomy rebuild.
 *
 * @param selection chosen k and the candidate scores behind it
 * @param projectionMethod projector that produced the layout
 * @param clusters clusters with labels, positions and counts
 * @param persisted false for dry runs
 * @param summary counts: documents clustered, documents skipped, label fallbacks and writes
 */
public record TaxonomyBuildReport(
    ClusterSelection selection,
    String projectionMethod,
    List<TaxonomyCluster> clusters,
    boolean persisted,
    PipelineRunSummary summary) {

  public int k() {
    return selection.k();
  }
}
