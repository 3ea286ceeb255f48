package com.flamingo.ai.corpusindex.service.taxonomy;

import com.flamingo.ai.corpusindex.service.taxonomy.model.MixtureFit;
import java.util.Arrays;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;

/**
 * Gaussian mixture with one scalar variance per component, fitted by expectation-maximization.
 *
 * <p>Each restart seeds the means with k-means++ drawn from a generator seeded once per fit, so a
 * fit is fully reproducible. The restart with the highest log-likelihood is kept.
 */
@Slf4j
public class SphericalGaussianMixture {

  static final double VARIANCE_FLOOR = 1e-6;
  private static final double LOG_2PI = Math.log(2 * Math.PI);

  private final long seed;
  private final int restarts;
  private final int maxIterations;
  private final double tolerance;

  public SphericalGaussianMixture(long seed, int restarts, int maxIterations, double tolerance) {
    this.seed = seed;
    this.restarts = Math.max(1, restarts);
    this.maxIterations = Math.max(1, maxIterations);
    this.tolerance = tolerance;
  }

  /**
   * Fits {@code k} components to the rows of {@code data}.
   *
   * @param data {@code n x d} samples, {@code n >= k}
   * @param k number of components, positive
   */
  public MixtureFit fit(double[][] data, int k) {
    if (k < 1 || k > data.length) {
      throw new IllegalArgumentException(
          "Cannot fit " + k + " components to " + data.length + " samples");
    }
    Random random = new Random(seed);
    MixtureFit best = null;
    for (int restart = 0; restart < restarts; restart++) {
      MixtureFit fit = fitOnce(data, k, random);
      log.debug(
          "k={} restart={} logLikelihood={} iterations={} converged={}",
          k,
          restart,
          fit.logLikelihood(),
          fit.iterations(),
          fit.converged());
      if (best == null || fit.logLikelihood() > best.logLikelihood()) {
        best = fit;
      }
    }
    return best;
  }

  private MixtureFit fitOnce(double[][] data, int k, Random random) {
    int n = data.length;
    int d = data[0].length;
    double[][] means = kMeansPlusPlus(data, k, random);
    double[] variances = new double[k];
    double[] weights = new double[k];
    initialVariance(data, means, variances);
    Arrays.fill(weights, 1.0 / k);

    double[][] resp = new double[n][k];
    double logLikelihood = Double.NEGATIVE_INFINITY;
    boolean converged = false;
    int iteration = 0;
    while (iteration < maxIterations) {
      iteration++;
      double current = expectation(data, means, variances, weights, resp);
      if (Math.abs(current - logLikelihood) / n < tolerance) {
        logLikelihood = current;
        converged = true;
        break;
      }
      logLikelihood = current;
      maximization(data, resp, means, variances, weights, d);
    }
    if (!converged) {
      logLikelihood = expectation(data, means, variances, weights, resp);
    }
    return new MixtureFit(k, means, variances, weights, resp, logLikelihood, iteration, converged);
  }

  /** Fills {@code resp} with posterior probabilities and returns the total log-likelihood. */
  static double expectation(
      double[][] data, double[][] means, double[] variances, double[] weights, double[][] resp) {
    int k = means.length;
    int d = data[0].length;
    double total = 0;
    double[] logP = new double[k];
    for (int i = 0; i < data.length; i++) {
      double max = Double.NEGATIVE_INFINITY;
      for (int j = 0; j < k; j++) {
        logP[j] =
            Math.log(weights[j])
                - 0.5 * d * (LOG_2PI + Math.log(variances[j]))
                - squaredDistance(data[i], means[j]) / (2 * variances[j]);
        max = Math.max(max, logP[j]);
      }
      double sum = 0;
      for (int j = 0; j < k; j++) {
        sum += Math.exp(logP[j] - max);
      }
      double logNorm = max + Math.log(sum);
      for (int j = 0; j < k; j++) {
        resp[i][j] = Math.exp(logP[j] - logNorm);
      }
      total += logNorm;
    }
    return total;
  }

  private static void maximization(
      double[][] data,
      double[][] resp,
      double[][] means,
      double[] variances,
      double[] weights,
      int d) {
    int n = data.length;
    int k = means.length;
    for (int j = 0; j < k; j++) {
      double nj = 10 * Double.MIN_NORMAL;
      double[] mean = new double[d];
      for (int i = 0; i < n; i++) {
        double r = resp[i][j];
        nj += r;
        for (int c = 0; c < d; c++) {
          mean[c] += r * data[i][c];
        }
      }
      for (int c = 0; c < d; c++) {
        mean[c] /= nj;
      }
      double spread = 0;
      for (int i = 0; i < n; i++) {
        spread += resp[i][j] * squaredDistance(data[i], mean);
      }
      means[j] = mean;
      variances[j] = spread / (d * nj) + VARIANCE_FLOOR;
      weights[j] = nj / n;
    }
  }

  static double[][] kMeansPlusPlus(double[][] data, int k, Random random) {
    int n = data.length;
    double[][] centers = new double[k][];
    centers[0] = data[random.nextInt(n)].clone();
    double[] nearest = new double[n];
    Arrays.fill(nearest, Double.POSITIVE_INFINITY);
    for (int c = 1; c < k; c++) {
      double total = 0;
      for (int i = 0; i < n; i++) {
        nearest[i] = Math.min(nearest[i], squaredDistance(data[i], centers[c - 1]));
        total += nearest[i];
      }
      int chosen;
      if (total <= 0) {
        chosen = random.nextInt(n);
      } else {
        double target = random.nextDouble() * total;
        chosen = n - 1;
        double cumulative = 0;
        for (int i = 0; i < n; i++) {
          cumulative += nearest[i];
          if (cumulative >= target) {
            chosen = i;
            break;
          }
        }
      }
      centers[c] = data[chosen].clone();
    }
    return centers;
  }

  private static void initialVariance(double[][] data, double[][] means, double[] variances) {
    int d = data[0].length;
    double[] spread = new double[means.length];
    int[] counts = new int[means.length];
    for (double[] x : data) {
      int closest = 0;
      double closestDistance = Double.POSITIVE_INFINITY;
      for (int j = 0; j < means.length; j++) {
        double distance = squaredDistance(x, means[j]);
        if (distance < closestDistance) {
          closestDistance = distance;
          closest = j;
        }
      }
      spread[closest] += closestDistance;
      counts[closest]++;
    }
    for (int j = 0; j < means.length; j++) {
      variances[j] =
          counts[j] == 0 ? VARIANCE_FLOOR : spread[j] / (d * counts[j]) + VARIANCE_FLOOR;
    }
  }

  static double squaredDistance(double[] a, double[] b) {
    double sum = 0;
    for (int i = 0; i < a.length; i++) {
      double diff = a[i] - b[i];
      sum += diff * diff;
    }
    return sum;
  }
}
