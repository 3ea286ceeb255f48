package com.flamingo.ai.corpusindex.service.taxonomy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import com.flamingo.ai.corpusindex.domain.entity.Claim;
import com.flamingo.ai.corpusindex.domain.entity.CorpusDocument;
import com.flamingo.ai.corpusindex.domain.entity.PaperClusterAssignment;
import com.flamingo.ai.corpusindex.domain.entity.TaxonomyCluster;
import com.flamingo.ai.corpusindex.domain.enums.SourceType;
import com.flamingo.ai.corpusindex.domain.repository.ClaimRepository;
import com.flamingo.ai.corpusindex.domain.repository.CorpusDocumentRepository;
import com.flamingo.ai.corpusindex.exception.TaxonomyBuildException;
import com.flamingo.ai.corpusindex.service.chunking.model.Chunk;
import com.flamingo.ai.corpusindex.service.chunking.model.ChunkMetadata;
import com.flamingo.ai.corpusindex.service.index.ChunkIndex;
import com.flamingo.ai.corpusindex.service.index.IndexBackend;
import com.flamingo.ai.corpusindex.service.index.model.EmbeddedChunk;
import com.flamingo.ai.corpusindex.service.taxonomy.labeling.ClusterLabelingService;
import com.flamingo.ai.corpusindex.service.taxonomy.model.ClusterLabel;
import com.flamingo.ai.corpusindex.service.taxonomy.model.TaxonomyBuildOptions;
import com.flamingo.ai.corpusindex.service.taxonomy.model.TaxonomyBuildReport;
import com.flamingo.ai.corpusindex.service.taxonomy.model.TaxonomySnapshot;
import com.flamingo.ai.corpusindex.service.taxonomy.projection.ProjectionService;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.IntStream;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaxonomyBuildService Tests")
class TaxonomyBuildServiceTest {

  @Mock private ChunkIndex chunkIndex;
  @Mock private CorpusDocumentRepository documentRepository;
  @Mock private ClaimRepository claimRepository;
  @Mock private ClusterLabelingService labelingService;
  @Mock private TaxonomyStore taxonomyStore;

  private CorpusIndexConfig config;
  private TaxonomyBuildService service;
  private Map<String, CorpusDocument> documents;

  @BeforeEach
  void setUp() {
    config = new CorpusIndexConfig();
    documents =
        List.of("p1", "p2", "p3", "p4", "p5").stream()
            .map(TaxonomyBuildServiceTest::paper)
            .collect(Collectors.toMap(CorpusDocument::getId, Function.identity()));
    lenient()
        .when(documentRepository.findAllById(any()))
        .thenAnswer(
            invocation -> {
              Iterable<String> ids = invocation.getArgument(0);
              List<CorpusDocument> found = new ArrayList<>();
              ids.forEach(
                  id -> {
                    if (documents.containsKey(id)) {
                      found.add(documents.get(id));
                    }
                  });
              return found;
            });
    lenient()
        .when(labelingService.labelAll(anyList(), anyBoolean()))
        .thenAnswer(
            invocation -> {
              List<?> samples = invocation.getArgument(0);
              List<ClusterLabel> labels = new ArrayList<>();
              for (int j = 0; j < samples.size(); j++) {
                labels.add(
                    new ClusterLabel("Topic " + j, "About " + j, List.of("a", "b", "c"), "llm"));
              }
              return labels;
            });
    lenient().when(chunkIndex.backend()).thenReturn(IndexBackend.LOCAL);
    service =
        new TaxonomyBuildService(
            chunkIndex,
            documentRepository,
            claimRepository,
            new DocumentVectorAggregator(),
            new ClusterCountSelector(config),
            new ProjectionService(config),
            labelingService,
            taxonomyStore,
            config);
  }

  @Test
  @DisplayName("should cluster a small corpus without error and persist one snapshot")
  void shouldPersistSnapshot_whenCorpusSmallerThanRange() {
    when(chunkIndex.fetchAll()).thenReturn(corpusChunks());
    when(claimRepository.findByDocumentIdIsNotNull())
        .thenReturn(List.of(claim(1L, "p1"), claim(2L, "ghost")));

    TaxonomyBuildReport report = service.rebuild(options(false));

    assertThat(report.k()).isLessThanOrEqualTo(4);
    assertThat(report.persisted()).isTrue();
    ArgumentCaptor<TaxonomySnapshot> captor = ArgumentCaptor.forClass(TaxonomySnapshot.class);
    verify(taxonomyStore).replace(captor.capture());
    TaxonomySnapshot snapshot = captor.getValue();

    assertThat(snapshot.clusters()).hasSize(report.k());
    assertThat(snapshot.clusters())
        .extracting(TaxonomyCluster::getClusterId)
        .containsExactlyElementsOf(IntStream.range(0, report.k()).boxed().toList());
    assertThat(snapshot.clusters())
        .allSatisfy(
            c -> {
              assertThat(c.getPositionX()).isBetween(0.0, 1.0);
              assertThat(c.getPositionY()).isBetween(0.0, 1.0);
              assertThat(c.getCentroid()).hasSize(3);
            });
    assertOnePrimaryPerDocument(snapshot.paperAssignments());
    assertThat(snapshot.claimAssignments())
        .allSatisfy(a -> assertThat(a.getClaimId()).isEqualTo(1L))
        .isNotEmpty();
    assertThat(report.summary().processed()).isEqualTo(5);
    assertThat(report.summary().detail("claimsUnknownDocument")).isEqualTo(1);
    int primaryTotal =
        snapshot.clusters().stream().mapToInt(TaxonomyCluster::getPrimaryPaperCount).sum();
    assertThat(primaryTotal).isEqualTo(5);
  }

  @Test
  @DisplayName("should compute everything but write nothing on a dry run")
  void shouldNotPersist_whenDryRun() {
    when(chunkIndex.fetchAll()).thenReturn(corpusChunks());

    TaxonomyBuildReport report = service.rebuild(new TaxonomyBuildOptions(true, null, false, true));

    assertThat(report.persisted()).isFalse();
    assertThat(report.clusters()).isNotEmpty();
    verify(taxonomyStore, never()).replace(any());
    verify(claimRepository, never()).findByDocumentIdIsNotNull();
  }

  @Test
  @DisplayName("should ignore transcript chunks and count papers missing from the store")
  void shouldSkipTranscriptsAndMissingPapers_whenAggregating() {
    List<EmbeddedChunk> chunks = new ArrayList<>(corpusChunks());
    chunks.add(embedded("episode-1", SourceType.TRANSCRIPT, new float[] {1f, 1f, 1f}));
    chunks.add(embedded("unknown-paper", SourceType.PAPER, new float[] {1f, 0f, 1f}));
    when(chunkIndex.fetchAll()).thenReturn(chunks);

    TaxonomyBuildReport report = service.rebuild(new TaxonomyBuildOptions(true, null, true, true));

    assertThat(report.summary().processed()).isEqualTo(5);
    assertThat(report.summary().detail("documentsMissing")).isEqualTo(1);
    assertThat(report.summary().skipped()).isEqualTo(1);
  }

  @Test
  @DisplayName("should honour a forced cluster count")
  void shouldUseForcedK_whenGiven() {
    when(chunkIndex.fetchAll()).thenReturn(corpusChunks());

    TaxonomyBuildReport report = service.rebuild(new TaxonomyBuildOptions(true, 2, true, true));

    assertThat(report.k()).isEqualTo(2);
    assertThat(report.selection().forced()).isTrue();
  }

  @Test
  @DisplayName("should fail before writing when the index holds no paper chunks")
  void shouldThrow_whenNoPaperChunks() {
    when(chunkIndex.fetchAll())
        .thenReturn(List.of(embedded("episode-1", SourceType.TRANSCRIPT, new float[] {1f, 0f})));

    assertThatThrownBy(() -> service.rebuild(options(false)))
        .isInstanceOf(TaxonomyBuildException.class);
    verify(taxonomyStore, never()).replace(any());
  }

  private static void assertOnePrimaryPerDocument(List<PaperClusterAssignment> rows) {
    Set<String> documentIds = new HashSet<>();
    rows.forEach(r -> documentIds.add(r.getDocumentId()));
    for (String documentId : documentIds) {
      List<PaperClusterAssignment> edges =
          rows.stream().filter(r -> r.getDocumentId().equals(documentId)).toList();
      List<PaperClusterAssignment> primaries =
          edges.stream().filter(PaperClusterAssignment::isPrimary).toList();
      assertThat(primaries).hasSize(1);
      double max =
          edges.stream().mapToDouble(PaperClusterAssignment::getConfidence).max().orElse(0);
      assertThat(primaries.get(0).getConfidence()).isEqualTo(max);
      assertThat(primaries.get(0).getPositionX()).isNotNull();
    }
    assertThat(documentIds).hasSize(5);
  }

  private static TaxonomyBuildOptions options(boolean dryRun) {
    return new TaxonomyBuildOptions(dryRun, null, false, false);
  }

  private static List<EmbeddedChunk> corpusChunks() {
    return List.of(
        embedded("p1", SourceType.PAPER, new float[] {1f, 0f, 0f}),
        embedded("p2", SourceType.PAPER, new float[] {0.9f, 0.1f, 0f}),
        embedded("p3", SourceType.PAPER, new float[] {0f, 1f, 0f}),
        embedded("p4", SourceType.PAPER, new float[] {0f, 0.9f, 0.2f}),
        embedded("p5", SourceType.PAPER, new float[] {0f, 0f, 1f}));
  }

  private static EmbeddedChunk embedded(String documentId, SourceType type, float[] vector) {
    ChunkMetadata metadata =
        new ChunkMetadata(
            ChunkMetadata.CURRENT_SCHEMA_VERSION, type, documentId, null, null, null, null);
    Chunk chunk =
        new Chunk(
            Chunk.chunkId(documentId, 0),
            documentId,
            0,
            0,
            "Abstract",
            "text of " + documentId,
            20,
            0,
            1,
            metadata);
    return new EmbeddedChunk(chunk, vector, "v1");
  }

  private static CorpusDocument paper(String id) {
    return CorpusDocument.builder()
        .id(id)
        .title("Paper " + id)
        .abstractText("Abstract of " + id)
        .sourceType(SourceType.PAPER)
        .publicationYear(2020)
        .build();
  }

  private static Claim claim(long id, String documentId) {
    return Claim.builder().id(id).documentId(documentId).claimText("claim " + id).build();
  }
}
