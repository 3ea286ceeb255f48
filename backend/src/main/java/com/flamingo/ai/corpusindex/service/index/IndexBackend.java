package com.flamingo.ai.corpusindex.service.index;

/** Vector index backends selectable through {@code corpus.index.backend}. */
public enum IndexBackend {
  /** Embedded store persisted to a local JSON file. */
  LOCAL("local"),
  /** PostgreSQL table with a pgvector column and a server-side match function. */
  PGVECTOR("pgvector");

  private final String configValue;

  IndexBackend(String configValue) {
    this.configValue = configValue;
  }

  public String configValue() {
    return configValue;
  }

  public static IndexBackend fromConfigValue(String value) {
    if (value == null || value.isBlank()) {
      return LOCAL;
    }
    for (IndexBackend backend : values()) {
      if (backend.configValue.equalsIgnoreCase(value.trim())) {
        return backend;
      }
    }
    throw new IllegalArgumentException(
        "Unknown corpus.index.backend '" + value + "', expected 'local' or 'pgvector'");
  }
}
