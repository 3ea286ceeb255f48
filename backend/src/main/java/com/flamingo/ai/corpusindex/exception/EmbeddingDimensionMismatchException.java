package com.flamingo.ai.corpusindex.exception;

/** Exception thrown when a vector does not match the index's dimensionality or provider version. */
public class EmbeddingDimensionMismatchException extends RuntimeException {

  private final String itemId;

  public EmbeddingDimensionMismatchException(String itemId, String message) {
    super("Embedding for " + itemId + " rejected: " + message);
    this.itemId = itemId;
  }

  public String getItemId() {
    return itemId;
  }
}
