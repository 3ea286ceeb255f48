package com.flamingo.ai.corpusindex.service.dedup;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import com.flamingo.ai.corpusindex.domain.entity.Claim;
import com.flamingo.ai.corpusindex.domain.repository.ClaimRepository;
import com.flamingo.ai.corpusindex.exception.DuplicateCycleException;
import com.flamingo.ai.corpusindex.service.PipelineRunSummary;
import com.flamingo.ai.corpusindex.service.dedup.model.DedupPassReport;
import com.flamingo.ai.corpusindex.service.dedup.model.DedupRunReport;
import com.flamingo.ai.corpusindex.service.dedup.model.DuplicateGroup;
import com.flamingo.ai.corpusindex.service.dedup.model.DuplicateResolution;
import com.flamingo.ai.corpusindex.service.dedup.model.EmbeddedClaim;
import com.flamingo.ai.corpusindex.service.embedding.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Folds near-duplicate claims into their best representative, one episode at a time.
 *
 * <p>Passes run in configured order. A pass sees only claims that no earlier pass folded, in
 * detect-only mode too. Folding is a soft delete: the duplicate keeps its row and gets {@code
 * duplicate_of} pointing at the kept claim. Re-running on an unchanged claim set finds nothing new.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimDeduplicationService {

  private final ClaimRepository claimRepository;
  private final EmbeddingService embeddingService;
  private final CorpusIndexConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Runs the configured passes.
   *
   * @param episodeId episode to process, or null for every episode
   * @param detectOnly report groups without writing links
   */
  @Timed(value = "dedup.run", description = "Time to deduplicate claims")
  public DedupRunReport deduplicate(String episodeId, boolean detectOnly) {
    Instant started = Instant.now();
    List<CorpusIndexConfig.Dedup.Pass> passes = config.getDedup().getPasses();
    List<String> episodes =
        episodeId == null || episodeId.isBlank()
            ? claimRepository.findDistinctEpisodeIds()
            : List.of(episodeId);
    log.info(
        "Deduplicating claims of {} episodes with {} passes{}",
        episodes.size(),
        passes.size(),
        detectOnly ? " (detect only)" : "");

    List<DedupPassReport> reports = new ArrayList<>(passes.size());
    for (int p = 0; p < passes.size(); p++) {
      CorpusIndexConfig.Dedup.Pass pass = passes.get(p);
      reports.add(
          new DedupPassReport(
              p + 1, pass.getSimilarityThreshold(), pass.getTemporalWindow(), 0, 0, 0, 0, 0));
    }

    for (String episode : episodes) {
      deduplicateEpisode(episode, passes, detectOnly, reports);
    }

    DedupRunReport report = new DedupRunReport(reports, detectOnly, summarize(started, reports));
    log.info(report.summary().summaryLine());
    return report;
  }

  private void deduplicateEpisode(
      String episodeId,
      List<CorpusIndexConfig.Dedup.Pass> passes,
      boolean detectOnly,
      List<DedupPassReport> reports) {
    List<Claim> claims = claimRepository.findByEpisodeIdOrderByIdAsc(episodeId);
    DuplicateForest forest = new DuplicateForest(claims);
    List<Claim> active = claims.stream().filter(Claim::isActive).toList();
    if (active.size() < 2) {
      log.debug("Episode {} has {} active claims, nothing to compare", episodeId, active.size());
      return;
    }

    Map<Long, float[]> embeddings = embed(active);
    int embeddingFailures = active.size() - embeddings.size();
    List<Claim> changed = new ArrayList<>();

    for (int p = 0; p < passes.size(); p++) {
      CorpusIndexConfig.Dedup.Pass pass = passes.get(p);
      List<EmbeddedClaim> candidates = new ArrayList<>();
      for (Claim claim : active) {
        float[] embedding = embeddings.get(claim.getId());
        if (embedding != null && !forest.isDuplicate(claim.getId())) {
          candidates.add(new EmbeddedClaim(claim, embedding));
        }
      }

      List<DuplicateGroup> groups =
          ClaimDeduplicator.detectDuplicates(
              candidates, pass.getSimilarityThreshold(), pass.getTemporalWindow());
      int linked = 0;
      int rejected = 0;
      for (DuplicateResolution resolution : ClaimDeduplicator.resolve(groups)) {
        for (Long duplicateId : resolution.duplicateIds()) {
          try {
            forest.link(duplicateId, resolution.keptId());
            linked++;
            if (!detectOnly) {
              Claim duplicate = find(active, duplicateId);
              duplicate.setDuplicateOf(resolution.keptId());
              changed.add(duplicate);
            }
          } catch (DuplicateCycleException e) {
            log.warn("Episode {}: {}", episodeId, e.getMessage());
            rejected++;
          }
        }
      }
      log.debug(
          "Episode {} pass {}: {} claims, {} groups, {} linked, {} rejected",
          episodeId,
          p + 1,
          candidates.size(),
          groups.size(),
          linked,
          rejected);
      int failures = p == 0 ? embeddingFailures : 0;
      reports.set(
          p, reports.get(p).plus(candidates.size(), groups.size(), linked, rejected, failures));
    }

    if (!changed.isEmpty()) {
      claimRepository.saveAll(changed);
      meterRegistry.counter("dedup.links.written").increment(changed.size());
      log.info("Episode {}: folded {} duplicate claims", episodeId, changed.size());
    }
  }

  /** Embeds claim texts in one call; claims whose vector is missing are left out of the map. */
  private Map<Long, float[]> embed(List<Claim> claims) {
    List<String> texts =
        claims.stream().map(c -> c.getClaimText() == null ? "" : c.getClaimText()).toList();
    List<float[]> vectors = embeddingService.embedAll(texts);
    Map<Long, float[]> byId = new HashMap<>();
    if (vectors.size() != claims.size()) {
      log.warn("Embedding returned {} vectors for {} claims", vectors.size(), claims.size());
      return byId;
    }
    for (int i = 0; i < claims.size(); i++) {
      float[] vector = vectors.get(i);
      if (vector != null && vector.length > 0) {
        byId.put(claims.get(i).getId(), vector);
      }
    }
    return byId;
  }

  private static Claim find(List<Claim> claims, long id) {
    for (Claim claim : claims) {
      if (claim.getId() == id) {
        return claim;
      }
    }
    throw new IllegalStateException("Claim " + id + " is not among the active claims");
  }

  private static PipelineRunSummary summarize(Instant started, List<DedupPassReport> reports) {
    int analyzed = reports.isEmpty() ? 0 : reports.get(0).claimsAnalyzed();
    int linked = 0;
    int rejected = 0;
    int groups = 0;
    Map<String, Integer> details = new LinkedHashMap<>();
    for (DedupPassReport report : reports) {
      linked += report.linked();
      rejected += report.rejected();
      groups += report.groups();
      details.put("pass" + report.pass() + ".groups", report.groups());
      details.put("pass" + report.pass() + ".linked", report.linked());
    }
    details.put("groups", groups);
    details.put("linked", linked);
    return new PipelineRunSummary(
        "dedup",
        analyzed,
        reports.isEmpty() ? 0 : reports.get(0).embeddingFailures(),
        rejected,
        details,
        Duration.between(started, Instant.now()));
  }
}
