package com.flamingo.ai.corpusindex.exception;

/** Exception thrown when a duplicate link would create a self-loop or a cycle. */
public class DuplicateCycleException extends RuntimeException {

  private final long duplicateId;
  private final long keptId;

  public DuplicateCycleException(long duplicateId, long keptId) {
    super("Linking claim " + duplicateId + " to " + keptId + " would create a cycle");
    this.duplicateId = duplicateId;
    this.keptId = keptId;
  }

  public long getDuplicateId() {
    return duplicateId;
  }

  public long getKeptId() {
    return keptId;
  }
}
