package com.flamingo.ai.corpusindex.service.taxonomy;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import com.flamingo.ai.corpusindex.domain.entity.Claim;
import com.flamingo.ai.corpusindex.domain.entity.CorpusDocument;
import com.flamingo.ai.corpusindex.domain.entity.PaperClusterAssignment;
import com.flamingo.ai.corpusindex.domain.entity.TaxonomyCluster;
import com.flamingo.ai.corpusindex.domain.enums.SourceType;
import com.flamingo.ai.corpusindex.domain.repository.ClaimRepository;
import com.flamingo.ai.corpusindex.domain.repository.CorpusDocumentRepository;
import com.flamingo.ai.corpusindex.exception.TaxonomyBuildException;
import com.flamingo.ai.corpusindex.service.PipelineRunSummary;
import com.flamingo.ai.corpusindex.service.index.ChunkIndex;
import com.flamingo.ai.corpusindex.service.index.model.EmbeddedChunk;
import com.flamingo.ai.corpusindex.service.taxonomy.labeling.ClusterLabelingService;
import com.flamingo.ai.corpusindex.service.taxonomy.model.AggregationResult;
import com.flamingo.ai.corpusindex.service.taxonomy.model.ClaimPropagation;
import com.flamingo.ai.corpusindex.service.taxonomy.model.ClusterLabel;
import com.flamingo.ai.corpusindex.service.taxonomy.model.ClusterSelection;
import com.flamingo.ai.corpusindex.service.taxonomy.model.DocumentVector;
import com.flamingo.ai.corpusindex.service.taxonomy.model.Layout;
import com.flamingo.ai.corpusindex.service.taxonomy.model.SoftAssignment;
import com.flamingo.ai.corpusindex.service.taxonomy.model.TaxonomyBuildOptions;
import com.flamingo.ai.corpusindex.service.taxonomy.model.TaxonomyBuildReport;
import com.flamingo.ai.corpusindex.service.taxonomy.model.TaxonomySnapshot;
import com.flamingo.ai.corpusindex.service.taxonomy.projection.ProjectionService;
import io.micrometer.core.annotation.Counted;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Full taxonomy rebuild over the paper chunks of the vector index.
 *
 * <p>Stages run in order: aggregate chunk vectors per paper, select k, soft-assign, project,
 * label, propagate to claims. Nothing is written until every stage has finished; the store then
 * swaps the whole taxonomy in one transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaxonomyBuildService {

  private final ChunkIndex chunkIndex;
  private final CorpusDocumentRepository documentRepository;
  private final ClaimRepository claimRepository;
  private final DocumentVectorAggregator aggregator;
  private final ClusterCountSelector selector;
  private final ProjectionService projectionService;
  private final ClusterLabelingService labelingService;
  private final TaxonomyStore taxonomyStore;
  private final CorpusIndexConfig config;

  @Timed(value = "taxonomy.rebuild", description = "Time to rebuild the taxonomy")
  @Counted(value = "taxonomy.rebuild.runs", description = "Taxonomy rebuilds started")
  public TaxonomyBuildReport rebuild(TaxonomyBuildOptions options) {
    Instant started = Instant.now();

    List<EmbeddedChunk> chunks =
        chunkIndex.fetchAll().stream()
            .filter(c -> c.chunk().metadata().sourceType() == SourceType.PAPER)
            .toList();
    if (chunks.isEmpty()) {
      throw new TaxonomyBuildException(
          "No paper chunks found in the " + chunkIndex.backend() + " index");
    }

    Set<String> documentIds = new HashSet<>();
    chunks.forEach(c -> documentIds.add(c.chunk().documentId()));
    Map<String, CorpusDocument> documentsById =
        documentRepository.findAllById(documentIds).stream()
            .collect(Collectors.toMap(CorpusDocument::getId, Function.identity()));

    AggregationResult aggregation = aggregator.aggregate(chunks, documentsById);
    List<DocumentVector> documents = aggregation.documents();
    if (documents.isEmpty()) {
      throw new TaxonomyBuildException("None of the indexed papers exist in the document store");
    }
    double[][] data = new double[documents.size()][];
    for (int i = 0; i < documents.size(); i++) {
      data[i] = documents.get(i).vector();
    }

    ClusterSelection selection = selector.select(data, options.forcedK());
    int k = selection.k();
    double threshold = config.getTaxonomy().getSoftAssignmentThreshold();
    List<SoftAssignment> assignments =
        SoftAssignmentCalculator.assign(documents, selection.fit(), threshold);

    Layout layout = projectionService.layout(selection.fit().means(), data);
    List<ClusterLabel> labels =
        labelingService.labelAll(membersByCluster(k, documents, assignments), options.skipLabels());

    List<TaxonomyCluster> clusters = buildClusters(selection, assignments, layout, labels);
    List<PaperClusterAssignment> paperRows = buildPaperRows(documents, assignments, layout);

    ClaimPropagation propagation =
        options.skipClaims()
            ? new ClaimPropagation(List.of(), 0, 0)
            : propagateToClaims(assignments);

    if (options.dryRun()) {
      log.info("Dry run, taxonomy of {} clusters not persisted", k);
    } else {
      taxonomyStore.replace(new TaxonomySnapshot(clusters, paperRows, propagation.assignments()));
    }

    int labelFallbacks = (int) labels.stream().filter(ClusterLabel::isPlaceholder).count();
    Map<String, Integer> details = new LinkedHashMap<>();
    details.put("k", k);
    details.put("chunks", chunks.size());
    details.put("documentsMissing", aggregation.missingDocumentIds().size());
    details.put("paperAssignments", paperRows.size());
    details.put("claimAssignments", propagation.assignments().size());
    details.put("claimsUnknownDocument", propagation.claimsWithUnknownDocument());
    details.put("claimsUnclustered", propagation.claimsWithUnclusteredDocument());
    details.put("labelPlaceholders", labelFallbacks);
    PipelineRunSummary summary =
        new PipelineRunSummary(
            "taxonomy",
            documents.size(),
            aggregation.missingDocumentIds().size() + propagation.claimsWithUnknownDocument(),
            options.skipLabels() ? 0 : labelFallbacks,
            details,
            Duration.between(started, Instant.now()));
    log.info(summary.summaryLine());
    logClusters(clusters);
    return new TaxonomyBuildReport(
        selection, layout.method(), clusters, !options.dryRun(), summary);
  }

  /** Members of each cluster by descending confidence, ties by document id. */
  static List<List<DocumentVector>> membersByCluster(
      int k, List<DocumentVector> documents, List<SoftAssignment> assignments) {
    Map<String, DocumentVector> byId = new HashMap<>();
    documents.forEach(d -> byId.put(d.documentId(), d));
    List<List<SoftAssignment>> edges = new ArrayList<>(k);
    for (int j = 0; j < k; j++) {
      edges.add(new ArrayList<>());
    }
    assignments.forEach(a -> edges.get(a.clusterId()).add(a));

    List<List<DocumentVector>> members = new ArrayList<>(k);
    for (List<SoftAssignment> clusterEdges : edges) {
      clusterEdges.sort(
          Comparator.comparingDouble(SoftAssignment::confidence)
              .reversed()
              .thenComparing(SoftAssignment::documentId));
      members.add(clusterEdges.stream().map(a -> byId.get(a.documentId())).toList());
    }
    return members;
  }

  private List<TaxonomyCluster> buildClusters(
      ClusterSelection selection,
      List<SoftAssignment> assignments,
      Layout layout,
      List<ClusterLabel> labels) {
    LocalDateTime generatedAt = LocalDateTime.now();
    List<TaxonomyCluster> clusters = new ArrayList<>(selection.k());
    for (int j = 0; j < selection.k(); j++) {
      int clusterId = j;
      ClusterLabel label = labels.get(j);
      clusters.add(
          TaxonomyCluster.builder()
              .clusterId(clusterId)
              .label(label.label())
              .description(label.description())
              .keywords(new ArrayList<>(label.keywords()))
              .positionX(layout.clusterPositions()[j][0])
              .positionY(layout.clusterPositions()[j][1])
              .centroid(toFloats(selection.fit().means()[j]))
              .paperCount(
                  (int) assignments.stream().filter(a -> a.clusterId() == clusterId).count())
              .primaryPaperCount(
                  (int)
                      assignments.stream()
                          .filter(a -> a.clusterId() == clusterId && a.primary())
                          .count())
              .labelSource(label.source())
              .generatedAt(generatedAt)
              .build());
    }
    return clusters;
  }

  private static List<PaperClusterAssignment> buildPaperRows(
      List<DocumentVector> documents, List<SoftAssignment> assignments, Layout layout) {
    Map<String, double[]> positions = new HashMap<>();
    double[][] documentPositions = layout.documentPositions();
    for (int i = 0; i < documentPositions.length; i++) {
      positions.put(documents.get(i).documentId(), documentPositions[i]);
    }
    List<PaperClusterAssignment> rows = new ArrayList<>(assignments.size());
    for (SoftAssignment assignment : assignments) {
      double[] position = positions.get(assignment.documentId());
      rows.add(
          PaperClusterAssignment.builder()
              .documentId(assignment.documentId())
              .clusterId(assignment.clusterId())
              .confidence(assignment.confidence())
              .primary(assignment.primary())
              .positionX(position == null ? null : position[0])
              .positionY(position == null ? null : position[1])
              .build());
    }
    return rows;
  }

  private ClaimPropagation propagateToClaims(List<SoftAssignment> assignments) {
    List<Claim> claims = claimRepository.findByDocumentIdIsNotNull();
    Set<String> referenced = new HashSet<>();
    claims.forEach(c -> referenced.add(c.getDocumentId()));
    Set<String> existing = new HashSet<>();
    documentRepository.findAllById(referenced).forEach(d -> existing.add(d.getId()));
    Map<String, List<SoftAssignment>> byDocument =
        assignments.stream().collect(Collectors.groupingBy(SoftAssignment::documentId));
    return ClaimAssignmentPropagator.propagate(claims, existing, byDocument);
  }

  private static float[] toFloats(double[] vector) {
    float[] result = new float[vector.length];
    for (int i = 0; i < vector.length; i++) {
      result[i] = (float) vector[i];
    }
    return result;
  }

  private static void logClusters(List<TaxonomyCluster> clusters) {
    for (TaxonomyCluster cluster : clusters) {
      log.info(
          "  [{}] {} - {} papers ({} primary), keywords {}",
          cluster.getClusterId(),
          cluster.getLabel(),
          cluster.getPaperCount(),
          cluster.getPrimaryPaperCount(),
          cluster.getKeywords());
    }
  }
}
