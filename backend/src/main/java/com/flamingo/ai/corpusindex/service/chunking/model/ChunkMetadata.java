package com.flamingo.ai.corpusindex.service.chunking.model;

import com.flamingo.ai.corpusindex.domain.entity.CorpusDocument;
import com.flamingo.ai.corpusindex.domain.enums.SourceType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Source-level attributes carried by every chunk, so a chunk is retrievable without its document.
 *
 * <p>Stored as flat scalar key/value pairs (see {@link #toMap()}). Version 1 records were
 * paper-only, had no {@code schema_version} and kept the title under {@code paper_title}; {@link
 * #fromMap(Map)} upgrades them to the current layout.
 *
 * @param schemaVersion layout version of the stored record
 * @param sourceType paper or transcript
 * @param title document title
 * @param authors author names, empty for transcripts without speakers
 * @param year publication year, null for transcripts
 * @param sourcePath path or URL the document was ingested from
 * @param episodeId episode id, transcripts only
 */
public record ChunkMetadata(
    int schemaVersion,
    SourceType sourceType,
    String title,
    List<String> authors,
    Integer year,
    String sourcePath,
    String episodeId) {

  public static final int CURRENT_SCHEMA_VERSION = 2;

  public static final String SCHEMA_VERSION = "schema_version";
  public static final String SOURCE_TYPE = "source_type";
  public static final String TITLE = "title";
  public static final String AUTHORS = "authors";
  public static final String YEAR = "year";
  public static final String SOURCE_PATH = "source_path";
  public static final String EPISODE_ID = "episode_id";

  private static final String LEGACY_TITLE = "paper_title";
  private static final String AUTHOR_SEPARATOR = "; ";

  public ChunkMetadata {
    authors = authors == null ? List.of() : List.copyOf(authors);
    sourceType = sourceType == null ? SourceType.PAPER : sourceType;
  }

  public static ChunkMetadata of(CorpusDocument document) {
    return new ChunkMetadata(
        CURRENT_SCHEMA_VERSION,
        document.getSourceType(),
        document.getTitle(),
        document.getAuthors(),
        document.getPublicationYear(),
        document.getSourcePath(),
        document.getEpisodeId());
  }

  /** Flattens to scalar values; authors are joined into one string and nulls are omitted. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(SCHEMA_VERSION, schemaVersion);
    map.put(SOURCE_TYPE, sourceType.metadataValue());
    putIfPresent(map, TITLE, title);
    if (!authors.isEmpty()) {
      map.put(AUTHORS, String.join(AUTHOR_SEPARATOR, authors));
    }
    putIfPresent(map, YEAR, year);
    putIfPresent(map, SOURCE_PATH, sourcePath);
    putIfPresent(map, EPISODE_ID, episodeId);
    return map;
  }

  /** Reads a stored record, migrating older layouts to {@link #CURRENT_SCHEMA_VERSION}. */
  public static ChunkMetadata fromMap(Map<String, ?> map) {
    if (map == null) {
      map = Map.of();
    }
    Object version = map.get(SCHEMA_VERSION);
    int storedVersion = version == null ? 1 : toInteger(version);

    String title;
    SourceType sourceType;
    if (storedVersion < 2) {
      title = asString(map.get(LEGACY_TITLE) != null ? map.get(LEGACY_TITLE) : map.get(TITLE));
      sourceType = SourceType.PAPER;
    } else {
      title = asString(map.get(TITLE));
      sourceType = SourceType.fromMetadataValue(asString(map.get(SOURCE_TYPE)));
    }
    Object year = map.get(YEAR);
    return new ChunkMetadata(
        CURRENT_SCHEMA_VERSION,
        sourceType,
        title,
        parseAuthors(map.get(AUTHORS)),
        year == null ? null : toInteger(year),
        asString(map.get(SOURCE_PATH)),
        asString(map.get(EPISODE_ID)));
  }

  private static void putIfPresent(Map<String, Object> map, String key, Object value) {
    if (value != null) {
      map.put(key, value);
    }
  }

  private static List<String> parseAuthors(Object value) {
    if (value == null) {
      return List.of();
    }
    if (value instanceof Collection<?> collection) {
      List<String> authors = new ArrayList<>();
      collection.forEach(a -> authors.add(String.valueOf(a)));
      return authors;
    }
    String joined = value.toString();
    if (joined.isBlank()) {
      return List.of();
    }
    return Arrays.stream(joined.split(";"))
        .map(String::trim)
        .filter(a -> !a.isEmpty())
        .collect(Collectors.toList());
  }

  private static int toInteger(Object value) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    return Integer.parseInt(value.toString().trim());
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }
}
