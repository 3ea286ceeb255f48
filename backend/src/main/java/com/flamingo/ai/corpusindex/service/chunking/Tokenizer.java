package com.flamingo.ai.corpusindex.service.chunking;

/**
 * Splits text into tokens for chunk sizing.
 *
 * <p>Implementations must be stateless and safe for concurrent use.
 */
public interface Tokenizer {

  /** Number of tokens in {@code text}; zero for null or empty text. */
  int countTokens(String text);

  /**
   * Character offset at which each token of {@code text} ends, in token order.
   *
   * <p>Offsets are non-decreasing and the last one equals {@code text.length()}. A token that ends
   * inside a multi-byte character is snapped forward to the next character boundary, so every
   * offset is a valid {@link String#substring} index.
   */
  int[] tokenEndOffsets(String text);
}
