package com.flamingo.ai.corpusindex.service.taxonomy.model;

import java.util.List;

/**
 * Chosen cluster count and its fitted mixture.
 *
 * @param k chosen cluster count
 * @param fit mixture fitted with {@code k} components
 * @param candidates scores of every candidate considered, ascending k
 * @param clamped whether the candidate range was reduced to fit a small corpus
 * @param forced whether k came from configuration rather than selection
 */
public record ClusterSelection(
    int k, MixtureFit fit, List<CandidateScore> candidates, boolean clamped, boolean forced) {}
