package com.flamingo.ai.corpusindex.domain.enums;

/** Kind of source an ingested document came from. */
public enum SourceType {
  PAPER,
  TRANSCRIPT;

  /** Lower-case value used in chunk metadata and search filters. */
  public String metadataValue() {
    return name().toLowerCase();
  }

  /** Parses a metadata value, defaulting to {@link #PAPER} for legacy records. */
  public static SourceType fromMetadataValue(String value) {
    if (value == null || value.isBlank()) {
      return PAPER;
    }
    return SourceType.valueOf(value.trim().toUpperCase());
  }
}
