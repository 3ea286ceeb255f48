package com.flamingo.ai.corpusindex.exception;

/** Exception thrown when a taxonomy rebuild cannot proceed at all. */
public class TaxonomyBuildException extends RuntimeException {

  public TaxonomyBuildException(String message) {
    super(message);
  }

  public TaxonomyBuildException(String message, Throwable cause) {
    super(message, cause);
  }
}
