package com.flamingo.ai.corpusindex.service.taxonomy.model;

/**
 * A fitted spherical Gaussian mixture.
 *
 * @param k number of components
 * @param means component means, {@code k x d}
 * @param variances per-component variance (one scalar per component)
 * @param weights mixing weights, summing to 1
 * @param responsibilities posterior membership probabilities, {@code n x k}
 * @param logLikelihood total log-likelihood of the training data
 * @param iterations EM iterations of the kept restart
 * @param converged whether the kept restart met the tolerance
 */
public record MixtureFit(
    int k,
    double[][] means,
    double[] variances,
    double[] weights,
    double[][] responsibilities,
    double logLikelihood,
    int iterations,
    boolean converged) {

  /** Free parameters: means, one variance per component, and k-1 weights. */
  public int freeParameters() {
    int d = means.length == 0 ? 0 : means[0].length;
    return k * d + k + (k - 1);
  }

  /** Bayesian information criterion over {@code n} samples, lower is better. */
  public double bic() {
    int n = responsibilities.length;
    return -2.0 * logLikelihood + freeParameters() * Math.log(n);
  }

  /** Most probable component per sample, lowest index on ties. */
  public int[] hardLabels() {
    int[] labels = new int[responsibilities.length];
    for (int i = 0; i < responsibilities.length; i++) {
      labels[i] = argMax(responsibilities[i]);
    }
    return labels;
  }

  /** Number of components that are the most probable one for at least one sample. */
  public int nonEmptyComponents() {
    boolean[] seen = new boolean[k];
    int count = 0;
    for (int label : hardLabels()) {
      if (!seen[label]) {
        seen[label] = true;
        count++;
      }
    }
    return count;
  }

  public static int argMax(double[] values) {
    int best = 0;
    for (int j = 1; j < values.length; j++) {
      if (values[j] > values[best]) {
        best = j;
      }
    }
    return best;
  }
}
