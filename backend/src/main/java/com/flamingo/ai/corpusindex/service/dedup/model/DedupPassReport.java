package com.flamingo.ai.corpusindex.service.dedup.model;

import java.time.Duration;

/**
 * Counts of one dedup pass, summed over the episodes it ran on.
 *
 * @param pass 1-based pass number
 * @param similarityThreshold cosine similarity cut-off of the pass
 * @param temporalWindow maximum timestamp distance of the pass
 * @param claimsAnalyzed active claims with an embedding
 * @param groups duplicate groups found
 * @param linked duplicate links written, or that would be written in detect-only mode
 * @param rejected links refused by the cycle check
 * @param embeddingFailures claims left out because they could not be embedded
 */
public record DedupPassReport(
    int pass,
    double similarityThreshold,
    Duration temporalWindow,
    int claimsAnalyzed,
    int groups,
    int linked,
    int rejected,
    int embeddingFailures) {

  public DedupPassReport plus(int analyzed, int groupCount, int links, int refused, int failures) {
    return new DedupPassReport(
        pass,
        similarityThreshold,
        temporalWindow,
        claimsAnalyzed + analyzed,
        groups + groupCount,
        linked + links,
        rejected + refused,
        embeddingFailures + failures);
  }
}
