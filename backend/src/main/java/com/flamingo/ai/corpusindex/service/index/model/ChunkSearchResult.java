package com.flamingo.ai.corpusindex.service.index.model;

import com.flamingo.ai.corpusindex.service.chunking.model.Chunk;

/**
 * One search hit.
 *
 * @param chunk the matching chunk
 * @param score cosine similarity mapped to [0, 1] as {@code (cos + 1) / 2}, higher is better
 */
public record ChunkSearchResult(Chunk chunk, double score) {}
