package com.flamingo.ai.corpusindex.job;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import com.flamingo.ai.corpusindex.service.PipelineRunSummary;
import com.flamingo.ai.corpusindex.service.dedup.ClaimDeduplicationService;
import com.flamingo.ai.corpusindex.service.dedup.model.DedupPassReport;
import com.flamingo.ai.corpusindex.service.dedup.model.DedupRunReport;
import com.flamingo.ai.corpusindex.service.index.CorpusIndexService;
import com.flamingo.ai.corpusindex.service.index.model.ChunkSearchResult;
import com.flamingo.ai.corpusindex.service.taxonomy.TaxonomyBuildService;
import com.flamingo.ai.corpusindex.service.taxonomy.model.CandidateScore;
import com.flamingo.ai.corpusindex.service.taxonomy.model.TaxonomyBuildOptions;
import com.flamingo.ai.corpusindex.service.taxonomy.model.TaxonomyBuildReport;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point for the batch pipelines.
 *
 * <p>Runs the job named by {@code --job}:
 *
 * <ul>
 *   <li>{@code index}: rebuild the chunk index from the document store
 *   <li>{@code search}: {@code --query=...}, optional {@code --k=N} and {@code --papers-only}
 *   <li>{@code taxonomy}: rebuild clusters and assignments, {@code --dry-run} to skip writes
 *   <li>{@code dedup}: fold near-duplicate claims, {@code --episode=ID}, {@code --detect-only}
 * </ul>
 *
 * <p>Without {@code --job} nothing runs. A failing job is logged and rethrown so the process exits
 * with an error.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CorpusJobRunner implements ApplicationRunner {

  static final String JOB = "job";

  private final CorpusIndexService corpusIndexService;
  private final TaxonomyBuildService taxonomyBuildService;
  private final ClaimDeduplicationService claimDeduplicationService;
  private final CorpusIndexConfig config;

  @Override
  public void run(ApplicationArguments args) {
    String job = value(args, JOB);
    if (job == null) {
      log.debug("No --job argument, nothing to run");
      return;
    }
    log.info("Starting job '{}'", job);
    try {
      switch (job) {
        case "index" -> runIndex();
        case "search" -> runSearch(args);
        case "taxonomy" -> runTaxonomy(args);
        case "dedup" -> runDedup(args);
        default -> log.error("Unknown job '{}', expected index, search, taxonomy or dedup", job);
      }
    } catch (RuntimeException e) {
      log.error("Job '{}' failed: {}", job, e.getMessage(), e);
      throw e;
    }
  }

  private void runIndex() {
    PipelineRunSummary summary = corpusIndexService.rebuild();
    log.info("Index job finished: {}", summary.summaryLine());
  }

  private void runSearch(ApplicationArguments args) {
    String query = value(args, "query");
    if (query == null || query.isBlank()) {
      log.error("Search job needs --query");
      return;
    }
    int k = parseInt(value(args, "k"), config.getIndex().getDefaultTopK());
    Map<String, Object> filter =
        args.containsOption("papers-only") ? CorpusIndexService.papersOnly() : Map.of();
    List<ChunkSearchResult> results = corpusIndexService.search(query, k, filter);
    log.info("{} results for '{}'", results.size(), query);
    for (int i = 0; i < results.size(); i++) {
      ChunkSearchResult result = results.get(i);
      log.info(
          "  {}. [{}] {} ({}, section '{}')",
          i + 1,
          String.format("%.3f", result.score()),
          result.chunk().metadata().title(),
          result.chunk().chunkId(),
          result.chunk().sectionHeading());
    }
  }

  private void runTaxonomy(ApplicationArguments args) {
    boolean dryRun = args.containsOption("dry-run");
    TaxonomyBuildReport report =
        taxonomyBuildService.rebuild(TaxonomyBuildOptions.fromConfig(config, dryRun));
    for (CandidateScore candidate : report.selection().candidates()) {
      log.info(
          "  k={} bic={} silhouette={} combined={}{}",
          candidate.k(),
          String.format("%.1f", candidate.bic()),
          candidate.silhouette() == null ? "n/a" : String.format("%.3f", candidate.silhouette()),
          String.format("%.3f", candidate.combined()),
          candidate.discarded() ? " (discarded)" : "");
    }
    log.info(
        "Taxonomy job finished: k={} layout={} persisted={}",
        report.k(),
        report.projectionMethod(),
        report.persisted());
  }

  private void runDedup(ApplicationArguments args) {
    String episode = value(args, "episode");
    if (episode == null) {
      episode = config.getDedup().getEpisode();
    }
    DedupRunReport report =
        claimDeduplicationService.deduplicate(episode, args.containsOption("detect-only"));
    for (DedupPassReport pass : report.passes()) {
      log.info(
          "  pass {} (threshold {}, window {}s): {} claims, {} groups, {} linked, {} rejected",
          pass.pass(),
          pass.similarityThreshold(),
          pass.temporalWindow().toSeconds(),
          pass.claimsAnalyzed(),
          pass.groups(),
          pass.linked(),
          pass.rejected());
    }
  }

  private static String value(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  private static int parseInt(String value, int defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Ignoring non-numeric value '{}', using {}", value, defaultValue);
      return defaultValue;
    }
  }
}
