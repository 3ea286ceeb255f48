package com.flamingo.ai.corpusindex.exception;

/** Exception thrown when the labeler fails or returns a malformed label. */
public class ClusterLabelingException extends RuntimeException {

  private final int clusterId;

  public ClusterLabelingException(int clusterId, String message) {
    super("Labeling failed for cluster " + clusterId + ": " + message);
    this.clusterId = clusterId;
  }

  public ClusterLabelingException(int clusterId, String message, Throwable cause) {
    super("Labeling failed for cluster " + clusterId + ": " + message, cause);
    this.clusterId = clusterId;
  }

  public int getClusterId() {
    return clusterId;
  }
}
