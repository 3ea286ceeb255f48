package com.flamingo.ai.corpusindex.service.dedup;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.corpusindex.domain.entity.Claim;
import com.flamingo.ai.corpusindex.service.dedup.model.DuplicateGroup;
import com.flamingo.ai.corpusindex.service.dedup.model.DuplicateResolution;
import com.flamingo.ai.corpusindex.service.dedup.model.EmbeddedClaim;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ClaimDeduplicator Tests")
class ClaimDeduplicatorTest {

  private static final Duration WINDOW = Duration.ofSeconds(30);

  @Test
  @DisplayName("should group two close claims and keep the distilled one even with shorter text")
  void shouldKeepDistilledClaim_whenPairIsNearDuplicate() {
    Claim raw = claim(1L, "ep1", 10_000L, null);
    raw.setClaimText(
        "So what we found, and this took years of work in the lab, is that the bioelectric"
            + " patterns across the tissue actually store the target morphology of the animal");
    Claim distilled = claim(2L, "ep1", 12_000L, "Bioelectric patterns store target morphology");
    distilled.setClaimText("Patterns store shape");
    List<EmbeddedClaim> claims =
        List.of(
            new EmbeddedClaim(raw, new float[] {1f, 0f}),
            new EmbeddedClaim(distilled, unit(0.97)));

    List<DuplicateGroup> groups = ClaimDeduplicator.detectDuplicates(claims, 0.95, WINDOW);

    assertThat(groups).hasSize(1);
    assertThat(groups.get(0).claimIds()).containsExactly(1L, 2L);
    assertThat(groups.get(0).minSimilarity()).isBetween(0.95, 1.0);
    List<DuplicateResolution> resolutions = ClaimDeduplicator.resolve(groups);
    assertThat(resolutions).containsExactly(new DuplicateResolution(2L, List.of(1L)));
  }

  @Test
  @DisplayName("should join claims transitively even when the ends are below the threshold")
  void shouldGroupTransitively_whenChainOfSimilarClaims() {
    List<EmbeddedClaim> claims =
        List.of(
            new EmbeddedClaim(claim(1L, "ep1", 0L, null), angle(0)),
            new EmbeddedClaim(claim(2L, "ep1", 5_000L, null), angle(15)),
            new EmbeddedClaim(claim(3L, "ep1", 10_000L, null), angle(30)));

    List<DuplicateGroup> groups = ClaimDeduplicator.detectDuplicates(claims, 0.95, WINDOW);

    assertThat(groups).singleElement().satisfies(g -> assertThat(g.claimIds()).hasSize(3));
  }

  @Test
  @DisplayName("should never group claims from different episodes")
  void shouldNotGroup_whenEpisodesDiffer() {
    List<EmbeddedClaim> claims =
        List.of(
            new EmbeddedClaim(claim(1L, "ep1", 1_000L, null), new float[] {1f, 0f}),
            new EmbeddedClaim(claim(2L, "ep2", 1_000L, null), new float[] {1f, 0f}));

    assertThat(ClaimDeduplicator.detectDuplicates(claims, 0.95, WINDOW)).isEmpty();
  }

  @Test
  @DisplayName("should not group identical claims that are further apart than the window")
  void shouldNotGroup_whenOutsideTemporalWindow() {
    List<EmbeddedClaim> claims =
        List.of(
            new EmbeddedClaim(claim(1L, "ep1", 10_000L, null), new float[] {1f, 0f}),
            new EmbeddedClaim(claim(2L, "ep1", 50_000L, null), new float[] {1f, 0f}));

    assertThat(ClaimDeduplicator.detectDuplicates(claims, 0.95, WINDOW)).isEmpty();
    assertThat(ClaimDeduplicator.detectDuplicates(claims, 0.95, Duration.ofSeconds(40)))
        .hasSize(1);
  }

  @Test
  @DisplayName("should treat a missing timestamp as the start of the episode")
  void shouldUseZero_whenTimestampMissing() {
    List<EmbeddedClaim> claims =
        List.of(
            new EmbeddedClaim(claim(1L, "ep1", null, null), new float[] {1f, 0f}),
            new EmbeddedClaim(claim(2L, "ep1", 20_000L, null), new float[] {1f, 0f}));

    assertThat(ClaimDeduplicator.detectDuplicates(claims, 0.95, WINDOW)).hasSize(1);
  }

  @Test
  @DisplayName("should produce the same groups regardless of input order")
  void shouldBeOrderIndependent_whenInputShuffled() {
    List<EmbeddedClaim> claims = new ArrayList<>();
    claims.add(new EmbeddedClaim(claim(4L, "ep1", 0L, null), angle(0)));
    claims.add(new EmbeddedClaim(claim(9L, "ep1", 1_000L, null), angle(5)));
    claims.add(new EmbeddedClaim(claim(2L, "ep1", 2_000L, null), angle(90)));
    claims.add(new EmbeddedClaim(claim(7L, "ep1", 3_000L, null), angle(92)));
    claims.add(new EmbeddedClaim(claim(5L, "ep1", 4_000L, null), angle(180)));

    List<DuplicateGroup> forward = ClaimDeduplicator.detectDuplicates(claims, 0.95, WINDOW);
    Collections.reverse(claims);
    List<DuplicateGroup> backward = ClaimDeduplicator.detectDuplicates(claims, 0.95, WINDOW);

    assertThat(forward)
        .extracting(DuplicateGroup::claimIds)
        .containsExactly(List.of(2L, 7L), List.of(4L, 9L));
    assertThat(backward)
        .extracting(DuplicateGroup::claimIds)
        .containsExactlyElementsOf(forward.stream().map(DuplicateGroup::claimIds).toList());
  }

  private static Claim claim(Long id, String episodeId, Long startMs, String distilled) {
    return Claim.builder()
        .id(id)
        .episodeId(episodeId)
        .claimText("Claim number " + id)
        .distilledClaim(distilled)
        .distilledWordCount(distilled == null ? null : distilled.split(" ").length)
        .startMs(startMs)
        .build();
  }

  private static float[] unit(double cosine) {
    return new float[] {(float) cosine, (float) Math.sqrt(1 - cosine * cosine)};
  }

  private static float[] angle(double degrees) {
    double radians = Math.toRadians(degrees);
    return new float[] {(float) Math.cos(radians), (float) Math.sin(radians)};
  }
}
