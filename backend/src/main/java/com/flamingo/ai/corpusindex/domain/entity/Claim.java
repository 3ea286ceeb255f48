package com.flamingo.ai.corpusindex.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A short assertion extracted from a transcript or paper by an external process.
 *
 * <p>{@code duplicateOf} is the soft-delete link written by the claim deduplicator: a claim with a
 * non-null value has been folded into the referenced claim and is no longer active.
 */
@Entity
@Table(name = "claims")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Claim {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  /** Episode the claim was spoken in; timestamps are relative to it. */
  private String episodeId;

  /** Source document reference, nullable. */
  private String documentId;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String claimText;

  /** Short distilled form of the claim, when one was generated. */
  @Column(columnDefinition = "TEXT")
  private String distilledClaim;

  private Integer distilledWordCount;

  /** Upstream extraction confidence. */
  private Double confidenceScore;

  /** Offset of the claim within its episode, in milliseconds. */
  private Long startMs;

  private Long duplicateOf;

  public boolean isActive() {
    return duplicateOf == null;
  }

  public boolean hasDistilledForm() {
    return distilledClaim != null && !distilledClaim.isBlank();
  }
}
