package com.flamingo.ai.corpusindex.service.chunking.model;

/**
 * A contiguous, token-bounded slice of a document's text.
 *
 * @param chunkId {@code documentId + "_chunk_" + chunkIndex}
 * @param documentId owning document
 * @param chunkIndex ordinal within the document, starting at 0
 * @param sectionIndex ordinal of the section the chunk was cut from
 * @param sectionHeading heading of that section
 * @param text chunk text, including the leading overlap
 * @param tokenCount number of tokens in {@code text}
 * @param overlapChars length of the leading prefix repeated from the previous chunk of the same
 *     section
 * @param page page the section starts on, when known
 * @param metadata source-level attributes
 */
public record Chunk(
    String chunkId,
    String documentId,
    int chunkIndex,
    int sectionIndex,
    String sectionHeading,
    String text,
    int tokenCount,
    int overlapChars,
    Integer page,
    ChunkMetadata metadata) {

  public static String chunkId(String documentId, int chunkIndex) {
    return documentId + "_chunk_" + chunkIndex;
  }

  /** Text that is new in this chunk, i.e. without the overlap shared with the previous chunk. */
  public String textWithoutOverlap() {
    return text.substring(overlapChars);
  }
}
