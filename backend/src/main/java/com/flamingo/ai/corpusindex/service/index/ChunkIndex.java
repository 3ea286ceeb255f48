package com.flamingo.ai.corpusindex.service.index;

import com.flamingo.ai.corpusindex.service.index.model.ChunkSearchResult;
import com.flamingo.ai.corpusindex.service.index.model.EmbeddedChunk;
import com.flamingo.ai.corpusindex.service.index.model.IndexStats;
import com.flamingo.ai.corpusindex.service.index.model.IndexWriteResult;
import java.util.List;
import java.util.Map;

/**
 * Backend-agnostic vector index over embedded chunks.
 *
 * <p>All vectors in one index share a dimensionality and an embedding version; {@link #upsert}
 * skips items that would break this. Rebuilding is destructive: {@link #clear()} followed by a bulk
 * {@link #upsert}. There is no delete-by-document operation.
 *
 * <p>Backend failures surface as {@link
 * com.flamingo.ai.corpusindex.exception.VectorIndexUnavailableException}.
 */
public interface ChunkIndex {

  /**
   * Inserts or replaces chunks by chunk id.
   *
   * @param chunks chunks with their embeddings
   * @return written and skipped counts
   */
  IndexWriteResult upsert(List<EmbeddedChunk> chunks);

  /**
   * Ranks stored chunks by cosine similarity to the query.
   *
   * @param queryEmbedding query vector, same dimensionality as the index
   * @param topK maximum number of hits
   * @param filterCriteria equality constraints on scalar metadata fields (see {@link
   *     com.flamingo.ai.corpusindex.service.chunking.model.ChunkMetadata}); empty for none
   * @return hits ordered by descending score
   */
  List<ChunkSearchResult> search(
      float[] queryEmbedding, int topK, Map<String, Object> filterCriteria);

  /** Removes every stored chunk. */
  void clear();

  /** Count, dimensionality, backend and embedding version. */
  IndexStats stats();

  /** Every stored chunk ordered by document id and chunk index. */
  List<EmbeddedChunk> fetchAll();

  IndexBackend backend();
}
