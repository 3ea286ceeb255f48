package com.flamingo.ai.corpusindex.service.taxonomy.model;

/**
 * 2D positions of clusters and documents, both axes normalized to [0, 1] over all points.
 *
 * @param clusterPositions {@code k x 2}
 * @param documentPositions {@code n x 2}, empty when document positions are not computed
 * @param method projection that produced the layout
 */
public record Layout(double[][] clusterPositions, double[][] documentPositions, String method) {

  /**
   * Splits raw 2D coordinates of {@code clusters} clusters followed by documents, rescaling each
   * axis to [0, 1]. An axis with no spread maps to 0.
   */
  public static Layout normalized(double[][] raw, int clusters, String method) {
    double[] min = {Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY};
    double[] max = {Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY};
    for (double[] point : raw) {
      for (int axis = 0; axis < 2; axis++) {
        min[axis] = Math.min(min[axis], point[axis]);
        max[axis] = Math.max(max[axis], point[axis]);
      }
    }
    double[][] clusterPositions = new double[clusters][];
    double[][] documentPositions = new double[raw.length - clusters][];
    for (int i = 0; i < raw.length; i++) {
      double[] scaled = new double[2];
      for (int axis = 0; axis < 2; axis++) {
        double range = max[axis] - min[axis];
        scaled[axis] = range > 0 ? (raw[i][axis] - min[axis]) / range : 0.0;
      }
      if (i < clusters) {
        clusterPositions[i] = scaled;
      } else {
        documentPositions[i - clusters] = scaled;
      }
    }
    return new Layout(clusterPositions, documentPositions, method);
  }
}
