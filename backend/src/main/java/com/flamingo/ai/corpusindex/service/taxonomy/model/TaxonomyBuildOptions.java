package com.flamingo.ai.corpusindex.service.taxonomy.model;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;

/**
 * Per-run switches of a taxonomy rebuild.
 *
 * @param dryRun compute everything but persist nothing
 * @param forcedK cluster count to use without model-order selection, or null
 * @param skipLabels label every cluster with its placeholder
 * @param skipClaims leave claim assignments empty
 */
public record TaxonomyBuildOptions(
    boolean dryRun, Integer forcedK, boolean skipLabels, boolean skipClaims) {

  public static TaxonomyBuildOptions fromConfig(CorpusIndexConfig config, boolean dryRun) {
    CorpusIndexConfig.Taxonomy taxonomy = config.getTaxonomy();
    return new TaxonomyBuildOptions(
        dryRun,
        taxonomy.getForcedClusterCount(),
        taxonomy.isSkipLabels(),
        taxonomy.isSkipClaims());
  }
}
