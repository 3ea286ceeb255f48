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

/** Soft membership of a document in a cluster. At most one row per document is primary. */
@Entity
@Table(name = "paper_cluster_assignments")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaperClusterAssignment {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private String documentId;

  @Column(nullable = false)
  private Integer clusterId;

  /** Mixture posterior probability. */
  @Column(nullable = false)
  private double confidence;

  @Column(name = "is_primary")
  private boolean primary;

  /** Document position in the same normalized layout as the clusters. */
  private Double positionX;

  private Double positionY;
}
