package com.flamingo.ai.corpusindex.service.taxonomy;

/** Mean silhouette coefficient under Euclidean distance. */
public final class SilhouetteScore {

  private SilhouetteScore() {}

  /**
   * Returns the mean silhouette of a hard labeling, or {@code null} when it is undefined (fewer
   * than two distinct labels, or every sample in its own cluster). Samples in singleton clusters
   * score 0.
   */
  public static Double of(double[][] data, int[] labels) {
    int n = data.length;
    int clusters = 0;
    for (int label : labels) {
      clusters = Math.max(clusters, label + 1);
    }
    int[] sizes = new int[clusters];
    for (int label : labels) {
      sizes[label]++;
    }
    int distinct = 0;
    for (int size : sizes) {
      if (size > 0) {
        distinct++;
      }
    }
    if (distinct < 2 || distinct > n - 1) {
      return null;
    }

    double[][] distance = new double[n][n];
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        double dist = Math.sqrt(SphericalGaussianMixture.squaredDistance(data[i], data[j]));
        distance[i][j] = dist;
        distance[j][i] = dist;
      }
    }

    double total = 0;
    for (int i = 0; i < n; i++) {
      if (sizes[labels[i]] == 1) {
        continue;
      }
      double[] sums = new double[clusters];
      for (int j = 0; j < n; j++) {
        if (j != i) {
          sums[labels[j]] += distance[i][j];
        }
      }
      double a = sums[labels[i]] / (sizes[labels[i]] - 1);
      double b = Double.POSITIVE_INFINITY;
      for (int c = 0; c < clusters; c++) {
        if (c != labels[i] && sizes[c] > 0) {
          b = Math.min(b, sums[c] / sizes[c]);
        }
      }
      double max = Math.max(a, b);
      total += max == 0 ? 0 : (b - a) / max;
    }
    return total / n;
  }
}
