package com.flamingo.ai.corpusindex.service.taxonomy.model;

import java.util.List;

/**
 * Human-readable name of a cluster.
 *
 * @param label short topic name
 * @param description one or two sentences
 * @param keywords 3 to 5 keywords, empty for placeholders
 * @param source labeler that produced it, {@link #PLACEHOLDER_SOURCE} for the fallback
 */
public record ClusterLabel(String label, String description, List<String> keywords, String source) {

  public static final String PLACEHOLDER_SOURCE = "placeholder";

  public ClusterLabel {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }

  /** Deterministic fallback used when labeling is skipped, fails or times out. */
  public static ClusterLabel placeholder(int clusterId, String description) {
    return new ClusterLabel("Cluster " + clusterId, description, List.of(), PLACEHOLDER_SOURCE);
  }

  public boolean isPlaceholder() {
    return PLACEHOLDER_SOURCE.equals(source);
  }
}
