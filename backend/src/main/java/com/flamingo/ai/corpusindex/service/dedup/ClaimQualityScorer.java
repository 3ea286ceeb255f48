package com.flamingo.ai.corpusindex.service.dedup;

import com.flamingo.ai.corpusindex.domain.entity.Claim;
import java.util.Comparator;

/**
 * Ranks claims of a duplicate group; the highest score is kept.
 *
 * <p>A distilled form dominates everything else (+1000, plus 10 per distilled word). A linked
 * source document adds 50, upstream confidence adds up to 100 and the raw text adds one point per
 * ten characters.
 */
public final class ClaimQualityScorer {

  /** Best claim first; equal scores prefer the lower id. */
  public static final Comparator<Claim> BEST_FIRST =
      Comparator.comparingDouble(ClaimQualityScorer::score)
          .reversed()
          .thenComparing(Claim::getId);

  private ClaimQualityScorer() {}

  public static double score(Claim claim) {
    double score = 0;
    if (claim.hasDistilledForm()) {
      score += 1000;
      Integer words = claim.getDistilledWordCount();
      score += (words == null ? 0 : words) * 10;
    }
    if (claim.getDocumentId() != null) {
      score += 50;
    }
    Double confidence = claim.getConfidenceScore();
    score += (confidence == null ? 0 : confidence) * 100;
    String text = claim.getClaimText();
    score += (text == null ? 0 : text.length()) / 10.0;
    return score;
  }
}
