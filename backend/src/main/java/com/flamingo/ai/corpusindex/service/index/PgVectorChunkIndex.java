package com.flamingo.ai.corpusindex.service.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.corpusindex.exception.VectorIndexUnavailableException;
import com.flamingo.ai.corpusindex.service.chunking.model.Chunk;
import com.flamingo.ai.corpusindex.service.chunking.model.ChunkMetadata;
import com.flamingo.ai.corpusindex.service.index.model.ChunkSearchResult;
import com.flamingo.ai.corpusindex.service.index.model.EmbeddedChunk;
import com.flamingo.ai.corpusindex.service.index.model.IndexStats;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.util.StreamUtils;

/**
 * Vector index stored in a PostgreSQL table with a pgvector {@code embedding} column.
 *
 * <p>Nearest-neighbour search runs server side through the {@code match_chunks(query_embedding,
 * match_threshold, match_count, filter)} function, which compares by cosine distance and applies
 * the filter as JSONB containment on the metadata column. Vectors travel as pgvector text literals
 * ({@code [0.1,0.2,...]}) cast with {@code ::vector}.
 */
@Slf4j
public class PgVectorChunkIndex extends AbstractChunkIndex {

  static final String SCHEMA_SCRIPT = "db/pgvector-schema.sql";
  private static final Pattern STATEMENT_SEPARATOR = Pattern.compile("(?m)^;\\s*$");
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

  private static final String COLUMNS =
      "chunk_id, document_id, chunk_index, section_index, section_heading, token_count,"
          + " overlap_chars, page, text, metadata, embedding_version";

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final String table;
  private final String matchFunction;
  private final int dimensions;
  private final boolean initializeSchema;

  public PgVectorChunkIndex(
      JdbcTemplate jdbcTemplate,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      String table,
      String matchFunction,
      int dimensions,
      boolean initializeSchema,
      int upsertBatchSize,
      double minScore) {
    super(meterRegistry, upsertBatchSize, minScore);
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
    this.table = requireIdentifier(table);
    this.matchFunction = requireIdentifier(matchFunction);
    this.dimensions = dimensions;
    this.initializeSchema = initializeSchema;
  }

  @Override
  public IndexBackend backend() {
    return IndexBackend.PGVECTOR;
  }

  @Override
  protected void initialize() {
    if (!initializeSchema) {
      log.info("Schema initialization disabled, expecting table {} to exist", table);
      return;
    }
    String script = loadSchemaScript();
    try {
      for (String statement : STATEMENT_SEPARATOR.split(script)) {
        if (!statement.isBlank()) {
          jdbcTemplate.execute(statement.trim());
        }
      }
      log.info("Initialized pgvector table {} and function {}", table, matchFunction);
    } catch (DataAccessException e) {
      throw unavailable("schema initialization failed", e);
    }
  }

  @Override
  protected void writeBatch(List<EmbeddedChunk> batch) {
    String sql =
        "INSERT INTO "
            + table
            + " ("
            + COLUMNS
            + ", embedding) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?::vector)"
            + " ON CONFLICT (chunk_id) DO UPDATE SET"
            + " document_id = EXCLUDED.document_id, chunk_index = EXCLUDED.chunk_index,"
            + " section_index = EXCLUDED.section_index,"
            + " section_heading = EXCLUDED.section_heading, token_count = EXCLUDED.token_count,"
            + " overlap_chars = EXCLUDED.overlap_chars, page = EXCLUDED.page,"
            + " text = EXCLUDED.text, metadata = EXCLUDED.metadata,"
            + " embedding_version = EXCLUDED.embedding_version, embedding = EXCLUDED.embedding";
    List<Object[]> rows = new ArrayList<>(batch.size());
    for (EmbeddedChunk item : batch) {
      Chunk c = item.chunk();
      rows.add(
          new Object[] {
            c.chunkId(),
            c.documentId(),
            c.chunkIndex(),
            c.sectionIndex(),
            c.sectionHeading(),
            c.tokenCount(),
            c.overlapChars(),
            c.page(),
            c.text(),
            toJson(c.metadata().toMap()),
            item.embeddingVersion(),
            toVectorLiteral(item.embedding())
          });
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      jdbcTemplate.batchUpdate(sql, rows);
    } catch (DataAccessException e) {
      throw unavailable("upsert failed", e);
    } finally {
      sample.stop(meterRegistry.timer(getMetricPrefix() + ".write.duration"));
    }
  }

  @Override
  protected List<ChunkSearchResult> doSearch(
      float[] queryEmbedding, int topK, double minScore, Map<String, Object> filterCriteria) {
    // match_chunks thresholds on raw cosine similarity in [-1, 1]
    double cosineThreshold = 2 * minScore - 1;
    String sql = "SELECT * FROM " + matchFunction + "(?::vector, ?, ?, ?::jsonb)";
    try {
      return jdbcTemplate.query(
          sql,
          (rs, rowNum) ->
              new ChunkSearchResult(mapChunk(rs), (rs.getDouble("similarity") + 1.0) / 2.0),
          toVectorLiteral(queryEmbedding),
          cosineThreshold,
          topK,
          toJson(filterCriteria));
    } catch (DataAccessException e) {
      throw unavailable("search failed", e);
    }
  }

  @Override
  public void clear() {
    try {
      jdbcTemplate.execute("TRUNCATE TABLE " + table);
      log.info("Cleared pgvector table {}", table);
    } catch (DataAccessException e) {
      throw unavailable("clear failed", e);
    }
  }

  @Override
  public IndexStats stats() {
    String sql =
        "SELECT COUNT(*) AS chunk_count, MAX(vector_dims(embedding)) AS dims,"
            + " MAX(embedding_version) AS version FROM "
            + table;
    try {
      return jdbcTemplate.queryForObject(
          sql,
          (rs, rowNum) -> {
            long count = rs.getLong("chunk_count");
            return new IndexStats(
                count,
                count == 0 ? 0 : rs.getInt("dims"),
                backend(),
                count == 0 ? null : rs.getString("version"));
          });
    } catch (DataAccessException e) {
      throw unavailable("stats failed", e);
    }
  }

  @Override
  public List<EmbeddedChunk> fetchAll() {
    String sql =
        "SELECT "
            + COLUMNS
            + ", embedding::text AS embedding_text FROM "
            + table
            + " ORDER BY document_id, chunk_index";
    RowMapper<EmbeddedChunk> mapper =
        (rs, rowNum) ->
            new EmbeddedChunk(
                mapChunk(rs),
                parseVectorLiteral(rs.getString("embedding_text")),
                rs.getString("embedding_version"));
    try {
      return jdbcTemplate.query(sql, mapper);
    } catch (DataAccessException e) {
      throw unavailable("fetch failed", e);
    }
  }

  private Chunk mapChunk(ResultSet rs) throws SQLException {
    int page = rs.getInt("page");
    Integer pageOrNull = rs.wasNull() ? null : page;
    return new Chunk(
        rs.getString("chunk_id"),
        rs.getString("document_id"),
        rs.getInt("chunk_index"),
        rs.getInt("section_index"),
        rs.getString("section_heading"),
        rs.getString("text"),
        rs.getInt("token_count"),
        rs.getInt("overlap_chars"),
        pageOrNull,
        ChunkMetadata.fromMap(fromJson(rs.getString("metadata"))));
  }

  private String loadSchemaScript() {
    try {
      String script =
          StreamUtils.copyToString(
              new ClassPathResource(SCHEMA_SCRIPT).getInputStream(), StandardCharsets.UTF_8);
      return script
          .replace("${table}", table)
          .replace("${match_function}", matchFunction)
          .replace("${dimensions}", String.valueOf(dimensions));
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + SCHEMA_SCRIPT, e);
    }
  }

  static String toVectorLiteral(float[] vector) {
    StringBuilder literal = new StringBuilder(vector.length * 10 + 2).append('[');
    for (int i = 0; i < vector.length; i++) {
      if (i > 0) {
        literal.append(',');
      }
      literal.append(vector[i]);
    }
    return literal.append(']').toString();
  }

  static float[] parseVectorLiteral(String literal) {
    String body = literal.trim();
    body = body.substring(1, body.length() - 1).trim();
    if (body.isEmpty()) {
      return new float[0];
    }
    String[] parts = body.split(",");
    float[] vector = new float[parts.length];
    for (int i = 0; i < parts.length; i++) {
      vector[i] = Float.parseFloat(parts[i].trim());
    }
    return vector;
  }

  private String toJson(Map<String, Object> map) {
    try {
      return objectMapper.writeValueAsString(map);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Metadata is not serializable: " + map, e);
    }
  }

  private Map<String, Object> fromJson(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, METADATA_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Unreadable chunk metadata, using defaults: {}", e.getMessage());
      return Map.of();
    }
  }

  private VectorIndexUnavailableException unavailable(String what, DataAccessException e) {
    log.error("pgvector {} on table {}: {}", what, table, e.getMessage());
    return new VectorIndexUnavailableException(backend().configValue(), what, e);
  }

  private static String requireIdentifier(String name) {
    if (name == null || !IDENTIFIER.matcher(name).matches()) {
      throw new IllegalArgumentException("Invalid SQL identifier: " + name);
    }
    return name;
  }
}
