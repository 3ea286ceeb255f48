package com.flamingo.ai.corpusindex.exception;

/**
 * Exception thrown when the configured vector index backend cannot be reached or written.
 *
 * <p>Fatal for the whole run. There is no automatic fallback to the other backend.
 */
public class VectorIndexUnavailableException extends RuntimeException {

  private final String backend;

  public VectorIndexUnavailableException(String backend, String message, Throwable cause) {
    super("Vector index backend '" + backend + "' unavailable: " + message, cause);
    this.backend = backend;
  }

  public String getBackend() {
    return backend;
  }
}
