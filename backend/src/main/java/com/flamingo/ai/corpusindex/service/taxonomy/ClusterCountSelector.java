package com.flamingo.ai.corpusindex.service.taxonomy;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import com.flamingo.ai.corpusindex.exception.TaxonomyBuildException;
import com.flamingo.ai.corpusindex.service.taxonomy.model.CandidateScore;
import com.flamingo.ai.corpusindex.service.taxonomy.model.ClusterSelection;
import com.flamingo.ai.corpusindex.service.taxonomy.model.MixtureFit;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Chooses the number of clusters by fitting a mixture per candidate k.
 *
 * <p>Candidates are scored with {@code bic / bicScale - silhouetteWeight * silhouette}, lower is
 * better; a candidate only replaces the current best when strictly better, so ties keep the
 * smaller k. A candidate whose fit leaves a component empty is discarded. A corpus smaller than the
 * lower bound of the range is reduced to the single candidate {@code max(2, n - 1)}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClusterCountSelector {

  private final CorpusIndexConfig config;

  /**
   * Selects k and returns the fit for it.
   *
   * @param data unit-length document vectors, one per row
   * @param forcedK cluster count to use without selection, or null
   */
  public ClusterSelection select(double[][] data, Integer forcedK) {
    int n = data.length;
    if (n == 0) {
      throw new TaxonomyBuildException("No document vectors to cluster");
    }
    CorpusIndexConfig.Taxonomy taxonomy = config.getTaxonomy();
    SphericalGaussianMixture mixture =
        new SphericalGaussianMixture(
            taxonomy.getRandomSeed(),
            taxonomy.getEmRestarts(),
            taxonomy.getMaxIterations(),
            taxonomy.getConvergenceTolerance());

    if (forcedK != null) {
      int k = Math.max(1, Math.min(forcedK, n));
      if (k != forcedK) {
        log.warn("Forced cluster count {} reduced to {} for {} documents", forcedK, k, n);
      }
      return new ClusterSelection(k, mixture.fit(data, k), List.of(), k != forcedK, true);
    }
    if (n == 1) {
      log.warn("Single document corpus, using one cluster");
      return new ClusterSelection(1, mixture.fit(data, 1), List.of(), true, false);
    }

    int minK = Math.max(1, taxonomy.getMinClusters());
    int maxK = Math.max(minK, taxonomy.getMaxClusters());
    int lower;
    int upper;
    boolean clamped;
    if (n < minK) {
      lower = Math.min(n, Math.max(2, n - 1));
      upper = lower;
      clamped = true;
      log.warn(
          "Only {} documents for a candidate range of {}-{}, clamping k to {}",
          n,
          minK,
          maxK,
          lower);
    } else {
      lower = minK;
      upper = Math.min(maxK, n);
      clamped = upper < maxK;
    }

    List<CandidateScore> candidates = new ArrayList<>();
    MixtureFit bestFit = null;
    double bestCombined = Double.POSITIVE_INFINITY;
    MixtureFit fallbackFit = null;
    for (int k = lower; k <= upper; k++) {
      MixtureFit fit = mixture.fit(data, k);
      if (fallbackFit == null) {
        fallbackFit = fit;
      }
      double bic = fit.bic();
      int nonEmpty = fit.nonEmptyComponents();
      if (nonEmpty < k) {
        log.debug("k={}: only {} non-empty components, discarded", k, nonEmpty);
        candidates.add(new CandidateScore(k, bic, null, Double.NaN, true));
        continue;
      }
      Double silhouette = k >= 3 && k <= n - 1 ? SilhouetteScore.of(data, fit.hardLabels()) : null;
      double combined =
          bic / taxonomy.getBicScale()
              - (silhouette == null ? 0 : taxonomy.getSilhouetteWeight() * silhouette);
      candidates.add(new CandidateScore(k, bic, silhouette, combined, false));
      log.debug("k={}: bic={} silhouette={} combined={}", k, bic, silhouette, combined);
      if (combined < bestCombined) {
        bestCombined = combined;
        bestFit = fit;
      }
    }

    if (bestFit == null) {
      log.warn("Every candidate k left an empty component, using k={}", lower);
      bestFit = fallbackFit;
    }
    log.info("Selected k={} from candidates {}-{}", bestFit.k(), lower, upper);
    return new ClusterSelection(bestFit.k(), bestFit, candidates, clamped, false);
  }
}
