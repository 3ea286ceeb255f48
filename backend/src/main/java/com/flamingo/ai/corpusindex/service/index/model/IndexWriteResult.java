package com.flamingo.ai.corpusindex.service.index.model;

/**
 * Outcome of an upsert.
 *
 * @param written chunks inserted or replaced
 * @param skipped chunks rejected for an inconsistent vector
 */
public record IndexWriteResult(int written, int skipped) {

  public static IndexWriteResult empty() {
    return new IndexWriteResult(0, 0);
  }

  public IndexWriteResult plus(IndexWriteResult other) {
    return new IndexWriteResult(written + other.written, skipped + other.skipped);
  }
}
