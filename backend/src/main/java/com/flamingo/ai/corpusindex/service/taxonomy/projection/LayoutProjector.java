package com.flamingo.ai.corpusindex.service.taxonomy.projection;

/** Reduces high-dimensional points to raw 2D coordinates. */
public interface LayoutProjector {

  /**
   * Projects the rows of {@code points} to two dimensions.
   *
   * @param points {@code m x d}
   * @return {@code m x 2}, not normalized
   */
  double[][] project(double[][] points);

  /** Name reported in the build report, e.g. "cosine-mds". */
  String method();
}
