package com.flamingo.ai.corpusindex.service.chunking;

import com.flamingo.ai.corpusindex.domain.entity.CorpusDocument;
import com.flamingo.ai.corpusindex.service.chunking.model.Chunk;
import java.util.List;

/**
 * Splits a {@link CorpusDocument} into token-bounded {@link Chunk}s ready for embedding.
 *
 * <p>Implementations must be stateless and safe for concurrent use. A chunker only chunks: it does
 * not parse or embed.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from the document's ordered sections.
   *
   * @param document the document; empty text yields an empty list
   * @param targetTokens maximum tokens per chunk
   * @param overlapTokens trailing tokens repeated at the start of the next chunk
   * @return ordered list of chunks
   */
  List<Chunk> chunk(CorpusDocument document, int targetTokens, int overlapTokens);
}
