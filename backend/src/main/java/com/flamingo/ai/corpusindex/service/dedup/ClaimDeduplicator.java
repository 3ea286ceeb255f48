package com.flamingo.ai.corpusindex.service.dedup;

import com.flamingo.ai.corpusindex.domain.entity.Claim;
import com.flamingo.ai.corpusindex.service.dedup.model.DuplicateGroup;
import com.flamingo.ai.corpusindex.service.dedup.model.DuplicateResolution;
import com.flamingo.ai.corpusindex.service.dedup.model.EmbeddedClaim;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Near-duplicate detection and resolution for claims.
 *
 * <p>Two claims are a candidate pair when they belong to the same episode, their cosine similarity
 * is at least the threshold and their timestamps are at most the window apart. Groups are the
 * connected components of the pair graph, so grouping is transitive. Output is independent of
 * input order.
 */
public final class ClaimDeduplicator {

  private ClaimDeduplicator() {}

  /**
   * Groups near-duplicate claims.
   *
   * @return groups of two or more claims, each sorted by id, groups ordered by their lowest id
   */
  public static List<DuplicateGroup> detectDuplicates(
      List<EmbeddedClaim> claims, double similarityThreshold, Duration temporalWindow) {
    List<EmbeddedClaim> sorted = new ArrayList<>(claims);
    sorted.sort(Comparator.comparingLong(EmbeddedClaim::id));
    int n = sorted.size();
    long windowMs = temporalWindow.toMillis();

    List<Embedding> embeddings = new ArrayList<>(n);
    for (EmbeddedClaim claim : sorted) {
      embeddings.add(Embedding.from(claim.embedding()));
    }

    UnionFind components = new UnionFind(n);
    double[] minSimilarity = new double[n];
    Arrays.fill(minSimilarity, Double.POSITIVE_INFINITY);
    List<double[]> pairs = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      EmbeddedClaim a = sorted.get(i);
      for (int j = i + 1; j < n; j++) {
        EmbeddedClaim b = sorted.get(j);
        if (!Objects.equals(a.claim().getEpisodeId(), b.claim().getEpisodeId())
            || Math.abs(a.startMs() - b.startMs()) > windowMs
            || a.embedding().length != b.embedding().length) {
          continue;
        }
        double similarity = CosineSimilarity.between(embeddings.get(i), embeddings.get(j));
        if (similarity >= similarityThreshold) {
          components.union(i, j);
          pairs.add(new double[] {i, similarity});
        }
      }
    }

    for (double[] pair : pairs) {
      int root = components.find((int) pair[0]);
      minSimilarity[root] = Math.min(minSimilarity[root], pair[1]);
    }

    TreeMap<Integer, List<Claim>> byRoot = new TreeMap<>();
    for (int i = 0; i < n; i++) {
      int root = components.find(i);
      byRoot.computeIfAbsent(root, r -> new ArrayList<>()).add(sorted.get(i).claim());
    }

    List<DuplicateGroup> groups = new ArrayList<>();
    for (Map.Entry<Integer, List<Claim>> entry : byRoot.entrySet()) {
      if (entry.getValue().size() > 1) {
        groups.add(
            new DuplicateGroup(List.copyOf(entry.getValue()), minSimilarity[entry.getKey()]));
      }
    }
    groups.sort(Comparator.comparingLong(g -> g.members().get(0).getId()));
    return groups;
  }

  /** Picks the highest quality claim of each group as the one to keep. */
  public static List<DuplicateResolution> resolve(List<DuplicateGroup> groups) {
    List<DuplicateResolution> resolutions = new ArrayList<>(groups.size());
    for (DuplicateGroup group : groups) {
      Claim kept = group.members().stream().min(ClaimQualityScorer.BEST_FIRST).orElseThrow();
      List<Long> duplicates =
          group.members().stream()
              .map(Claim::getId)
              .filter(id -> !id.equals(kept.getId()))
              .sorted()
              .toList();
      resolutions.add(new DuplicateResolution(kept.getId(), duplicates));
    }
    return resolutions;
  }

  /** Disjoint sets with path compression; the smaller index becomes the root. */
  static final class UnionFind {
    private final int[] parent;

    UnionFind(int size) {
      parent = new int[size];
      for (int i = 0; i < size; i++) {
        parent[i] = i;
      }
    }

    int find(int x) {
      int root = x;
      while (parent[root] != root) {
        root = parent[root];
      }
      while (parent[x] != root) {
        int next = parent[x];
        parent[x] = root;
        x = next;
      }
      return root;
    }

    void union(int a, int b) {
      int rootA = find(a);
      int rootB = find(b);
      if (rootA != rootB) {
        parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
      }
    }
  }
}
