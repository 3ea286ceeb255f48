package com.flamingo.ai.corpusindex.domain.entity;

import com.flamingo.ai.corpusindex.domain.converter.FloatArrayConverter;
import com.flamingo.ai.corpusindex.domain.converter.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A topical cluster produced by a taxonomy rebuild. Replaced wholesale on every rebuild. */
@Entity
@Table(name = "taxonomy_clusters")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaxonomyCluster {

  /** Dense id, 0 to k-1. */
  @Id private Integer clusterId;

  @Column(nullable = false)
  private String label;

  @Column(columnDefinition = "TEXT")
  private String description;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> keywords = new ArrayList<>();

  /** Normalized 0-1 layout position. */
  @Column(nullable = false)
  private double positionX;

  @Column(nullable = false)
  private double positionY;

  @Convert(converter = FloatArrayConverter.class)
  @Column(columnDefinition = "TEXT")
  private float[] centroid;

  private int paperCount;
  private int primaryPaperCount;

  /** Labeler that produced the label, or "placeholder". */
  private String labelSource;

  private LocalDateTime generatedAt;

  @PrePersist
  protected void onCreate() {
    if (generatedAt == null) {
      generatedAt = LocalDateTime.now();
    }
  }
}
