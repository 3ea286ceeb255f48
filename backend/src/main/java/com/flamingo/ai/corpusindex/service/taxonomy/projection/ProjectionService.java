package com.flamingo.ai.corpusindex.service.taxonomy.projection;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import com.flamingo.ai.corpusindex.service.taxonomy.model.Layout;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Lays out cluster centroids and documents jointly in 2D.
 *
 * <p>Uses the configured projector and drops to PCA when it fails. Both axes of the combined point
 * set are normalized to [0, 1].
 */
@Slf4j
@Service
public class ProjectionService {

  private final CorpusIndexConfig config;
  private final LayoutProjector preferred;
  private final LayoutProjector fallback;

  @Autowired
  public ProjectionService(CorpusIndexConfig config) {
    this(config, new CosineMdsProjector(), new PcaProjector());
  }

  ProjectionService(CorpusIndexConfig config, LayoutProjector preferred, LayoutProjector fallback) {
    this.config = config;
    this.preferred = preferred;
    this.fallback = fallback;
  }

  /**
   * @param centroids {@code k x d} cluster means
   * @param documents {@code n x d} document vectors, ignored when document positions are disabled
   */
  public Layout layout(double[][] centroids, double[][] documents) {
    boolean withDocuments = config.getTaxonomy().isIncludeDocumentPositions();
    double[][] points = withDocuments ? stack(centroids, documents) : centroids;

    LayoutProjector projector =
        PcaProjector.METHOD.equalsIgnoreCase(config.getTaxonomy().getProjection())
            ? fallback
            : preferred;
    double[][] raw;
    try {
      raw = projector.project(points);
    } catch (RuntimeException e) {
      if (projector == fallback) {
        throw e;
      }
      log.warn(
          "{} projection failed, using {}: {}",
          projector.method(),
          fallback.method(),
          e.getMessage());
      projector = fallback;
      raw = fallback.project(points);
    }
    log.info("Projected {} points with {}", points.length, projector.method());
    return Layout.normalized(raw, centroids.length, projector.method());
  }

  private static double[][] stack(double[][] first, double[][] second) {
    double[][] all = new double[first.length + second.length][];
    System.arraycopy(first, 0, all, 0, first.length);
    System.arraycopy(second, 0, all, first.length, second.length);
    return all;
  }
}
