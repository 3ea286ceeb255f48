package com.flamingo.ai.corpusindex.service.dedup.model;

import com.flamingo.ai.corpusindex.domain.entity.Claim;

/** An active claim with the embedding of its raw text. */
public record EmbeddedClaim(Claim claim, float[] embedding) {

  public long id() {
    return claim.getId();
  }

  /** Episode offset in milliseconds; a missing timestamp counts as the start of the episode. */
  public long startMs() {
    return claim.getStartMs() == null ? 0L : claim.getStartMs();
  }
}
