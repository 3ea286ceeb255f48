package com.flamingo.ai.corpusindex.service.taxonomy.model;

/**
 * Model-order selection score of one candidate cluster count.
 *
 * @param k candidate cluster count
 * @param bic Bayesian information criterion, lower is better
 * @param silhouette silhouette score, null when not defined for this k
 * @param combined {@code bic / bicScale - silhouetteWeight * silhouette}, lower is better
 * @param discarded whether the fit left a component empty
 */
public record CandidateScore(
    int k, double bic, Double silhouette, double combined, boolean discarded) {}
