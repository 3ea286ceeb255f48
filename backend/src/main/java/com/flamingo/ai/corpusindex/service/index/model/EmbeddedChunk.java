package com.flamingo.ai.corpusindex.service.index.model;

import com.flamingo.ai.corpusindex.service.chunking.model.Chunk;

/**
 * A chunk together with its embedding, as written to and read from a vector index.
 *
 * @param chunk the chunk
 * @param embedding the vector
 * @param embeddingVersion provider version that produced {@code embedding}
 */
public record EmbeddedChunk(Chunk chunk, float[] embedding, String embeddingVersion) {

  public String chunkId() {
    return chunk.chunkId();
  }
}
