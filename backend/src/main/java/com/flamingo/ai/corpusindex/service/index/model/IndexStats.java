package com.flamingo.ai.corpusindex.service.index.model;

import com.flamingo.ai.corpusindex.service.index.IndexBackend;

/**
 * Corpus statistics of a vector index.
 *
 * @param count number of stored chunks
 * @param dimensionality vector length shared by all stored chunks, 0 when empty
 * @param backend backend serving the index
 * @param embeddingVersion provider version shared by all stored chunks, null when empty
 */
public record IndexStats(
    long count, int dimensionality, IndexBackend backend, String embeddingVersion) {

  public boolean isEmpty() {
    return count == 0;
  }
}
