package com.flamingo.ai.corpusindex.service.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.corpusindex.domain.enums.SourceType;
import com.flamingo.ai.corpusindex.exception.VectorIndexUnavailableException;
import com.flamingo.ai.corpusindex.service.chunking.model.Chunk;
import com.flamingo.ai.corpusindex.service.chunking.model.ChunkMetadata;
import com.flamingo.ai.corpusindex.service.index.model.EmbeddedChunk;
import com.flamingo.ai.corpusindex.service.index.model.IndexStats;
import com.flamingo.ai.corpusindex.service.index.model.IndexWriteResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

@ExtendWith(MockitoExtension.class)
@DisplayName("PgVectorChunkIndex Tests")
class PgVectorChunkIndexTest {

  @Mock private JdbcTemplate jdbcTemplate;

  private PgVectorChunkIndex index;

  @BeforeEach
  void setUp() {
    index = newIndex(true, 0.0);
  }

  @Test
  @DisplayName("should run the schema script with table, function and dimensions filled in")
  void shouldCreateSchema_whenInitializing() {
    index.initialize();

    ArgumentCaptor<String> statements = ArgumentCaptor.forClass(String.class);
    verify(jdbcTemplate, atLeast(4)).execute(statements.capture());
    assertThat(statements.getAllValues())
        .anySatisfy(s -> assertThat(s).startsWith("CREATE TABLE IF NOT EXISTS paper_chunks"))
        .anySatisfy(s -> assertThat(s).contains("FUNCTION match_chunks("))
        .anySatisfy(s -> assertThat(s).contains("vector(3)"))
        .noneSatisfy(s -> assertThat(s).contains("${"));
  }

  @Test
  @DisplayName("should leave the schema alone when initialization is disabled")
  void shouldSkipSchema_whenInitializationDisabled() {
    newIndex(false, 0.0).initialize();

    verify(jdbcTemplate, never()).execute(anyString());
  }

  @Test
  @DisplayName("should reject table names that are not plain identifiers")
  void shouldThrow_whenTableNameInvalid() {
    assertThatThrownBy(
            () ->
                new PgVectorChunkIndex(
                    jdbcTemplate,
                    new ObjectMapper(),
                    new SimpleMeterRegistry(),
                    "chunks; DROP TABLE x",
                    "match_chunks",
                    3,
                    false,
                    100,
                    0.0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should upsert rows with JSON metadata and a vector literal")
  @SuppressWarnings("unchecked")
  void shouldBatchInsertRows_whenUpserting() {
    stubStats(new IndexStats(0, 0, IndexBackend.PGVECTOR, null));

    IndexWriteResult result = index.upsert(List.of(embedded("p1", new float[] {1f, 0.5f, 0f})));

    assertThat(result.written()).isEqualTo(1);
    ArgumentCaptor<List<Object[]>> rows = ArgumentCaptor.forClass(List.class);
    verify(jdbcTemplate).batchUpdate(contains("ON CONFLICT (chunk_id)"), rows.capture());
    Object[] row = rows.getValue().get(0);
    assertThat(row[0]).isEqualTo("p1_chunk_0");
    assertThat((String) row[9]).contains("\"source_type\":\"paper\"");
    assertThat(row[10]).isEqualTo("v1");
    assertThat(row[11]).isEqualTo("[1.0,0.5,0.0]");
  }

  @Test
  @DisplayName("should pass the min score to the match function as a raw cosine threshold")
  @SuppressWarnings("unchecked")
  void shouldConvertThreshold_whenSearching() {
    PgVectorChunkIndex strict = newIndex(false, 0.75);
    stubStats(new IndexStats(4, 2, IndexBackend.PGVECTOR, "v1"));

    strict.search(new float[] {1f, 0f}, 3, Map.of("source_type", "paper"));

    verify(jdbcTemplate)
        .query(
            contains("match_chunks(?::vector, ?, ?, ?::jsonb)"),
            any(RowMapper.class),
            eq("[1.0,0.0]"),
            eq(0.5),
            eq(3),
            eq("{\"source_type\":\"paper\"}"));
  }

  @Test
  @DisplayName("should send each filter as JSON that keeps its value types")
  @SuppressWarnings("unchecked")
  void shouldSerializeFilterWithTypes_whenSearching() {
    stubStats(new IndexStats(4, 2, IndexBackend.PGVECTOR, "v1"));

    for (MetadataFilterCases.FilterCase filterCase : MetadataFilterCases.CASES) {
      index.search(new float[] {1f, 0f}, 3, filterCase.filter());

      verify(jdbcTemplate)
          .query(anyString(), any(RowMapper.class), any(), any(), any(), eq(filterCase.json()));
      clearInvocations(jdbcTemplate);
    }
  }

  @Test
  @DisplayName("should report the index unavailable when the database is down")
  @SuppressWarnings("unchecked")
  void shouldThrowUnavailable_whenDatabaseDown() {
    when(jdbcTemplate.queryForObject(anyString(), any(RowMapper.class)))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    assertThatThrownBy(() -> index.stats())
        .isInstanceOf(VectorIndexUnavailableException.class)
        .hasMessageContaining("pgvector");
  }

  @Test
  @DisplayName("should truncate the table when cleared")
  void shouldTruncate_whenCleared() {
    index.clear();

    verify(jdbcTemplate).execute("TRUNCATE TABLE paper_chunks");
  }

  @Test
  @DisplayName("should parse pgvector text literals")
  void shouldParseVectorLiteral_whenReadingEmbedding() {
    assertThat(PgVectorChunkIndex.parseVectorLiteral("[0.25, -1,3.5]"))
        .containsExactly(0.25f, -1f, 3.5f);
    assertThat(PgVectorChunkIndex.parseVectorLiteral("[]")).isEmpty();
    assertThat(PgVectorChunkIndex.toVectorLiteral(new float[] {2f, -0.5f})).isEqualTo("[2.0,-0.5]");
  }

  @SuppressWarnings("unchecked")
  private void stubStats(IndexStats stats) {
    when(jdbcTemplate.queryForObject(anyString(), any(RowMapper.class))).thenReturn(stats);
  }

  private PgVectorChunkIndex newIndex(boolean initializeSchema, double minScore) {
    return new PgVectorChunkIndex(
        jdbcTemplate,
        new ObjectMapper(),
        new SimpleMeterRegistry(),
        "paper_chunks",
        "match_chunks",
        3,
        initializeSchema,
        100,
        minScore);
  }

  private static EmbeddedChunk embedded(String documentId, float[] vector) {
    ChunkMetadata metadata =
        new ChunkMetadata(
            ChunkMetadata.CURRENT_SCHEMA_VERSION,
            SourceType.PAPER,
            "Title",
            List.of(),
            2022,
            null,
            null);
    Chunk chunk =
        new Chunk(
            Chunk.chunkId(documentId, 0),
            documentId,
            0,
            0,
            "Introduction",
            "text",
            1,
            0,
            null,
            metadata);
    return new EmbeddedChunk(chunk, vector, "v1");
  }
}
