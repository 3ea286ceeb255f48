package com.flamingo.ai.corpusindex.service.index;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import com.flamingo.ai.corpusindex.domain.entity.CorpusDocument;
import com.flamingo.ai.corpusindex.domain.enums.SourceType;
import com.flamingo.ai.corpusindex.domain.repository.CorpusDocumentRepository;
import com.flamingo.ai.corpusindex.service.BoundedExecution;
import com.flamingo.ai.corpusindex.service.PipelineRunSummary;
import com.flamingo.ai.corpusindex.service.chunking.DocumentChunker;
import com.flamingo.ai.corpusindex.service.chunking.model.Chunk;
import com.flamingo.ai.corpusindex.service.chunking.model.ChunkMetadata;
import com.flamingo.ai.corpusindex.service.embedding.EmbeddingService;
import com.flamingo.ai.corpusindex.service.index.model.ChunkSearchResult;
import com.flamingo.ai.corpusindex.service.index.model.EmbeddedChunk;
import com.flamingo.ai.corpusindex.service.index.model.IndexWriteResult;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Write and read paths of the chunk index: rebuild from the document store, and text search.
 *
 * <p>A rebuild embeds every chunk before it touches the index, then clears and bulk-upserts. A
 * chunk whose embedding fails or times out is skipped and counted. An unreachable index aborts the
 * run.
 */
@Service
@Slf4j
public class CorpusIndexService {

  private final CorpusDocumentRepository documentRepository;
  private final DocumentChunker chunker;
  private final EmbeddingService embeddingService;
  private final ChunkIndex chunkIndex;
  private final CorpusIndexConfig config;
  private final Executor embeddingExecutor;

  public CorpusIndexService(
      CorpusDocumentRepository documentRepository,
      DocumentChunker chunker,
      EmbeddingService embeddingService,
      ChunkIndex chunkIndex,
      CorpusIndexConfig config,
      @Qualifier("embeddingExecutor") Executor embeddingExecutor) {
    this.documentRepository = documentRepository;
    this.chunker = chunker;
    this.embeddingService = embeddingService;
    this.chunkIndex = chunkIndex;
    this.config = config;
    this.embeddingExecutor = embeddingExecutor;
  }

  /** Filter restricting a search to papers. */
  public static Map<String, Object> papersOnly() {
    return Map.of(ChunkMetadata.SOURCE_TYPE, SourceType.PAPER.metadataValue());
  }

  /**
   * Rebuilds the whole index from the document store.
   *
   * @return counts of documents and chunks processed, skipped and errored
   */
  @Timed(value = "corpus.index.rebuild", description = "Time to rebuild the chunk index")
  public PipelineRunSummary rebuild() {
    Instant started = Instant.now();
    List<CorpusDocument> documents = documentRepository.findAllByOrderByIdAsc();
    log.info("Rebuilding {} index from {} documents", chunkIndex.backend(), documents.size());

    CorpusIndexConfig.Chunking chunking = config.getChunking();
    List<Chunk> chunks = new ArrayList<>();
    int documentsChunked = 0;
    int emptyDocuments = 0;
    int failedDocuments = 0;
    for (CorpusDocument document : documents) {
      List<Chunk> documentChunks;
      try {
        documentChunks =
            chunker.chunk(document, chunking.getTargetTokens(), chunking.getOverlapTokens());
      } catch (RuntimeException e) {
        log.warn("Chunking failed for document {}: {}", document.getId(), e.getMessage());
        failedDocuments++;
        continue;
      }
      if (documentChunks.isEmpty()) {
        log.warn("Document {} has no text, skipping", document.getId());
        emptyDocuments++;
        continue;
      }
      chunks.addAll(documentChunks);
      documentsChunked++;
    }

    EmbeddingOutcome outcome = embedAll(chunks);

    if (!chunks.isEmpty() && outcome.embedded().isEmpty()) {
      log.error(
          "No chunk could be embedded ({} errored, {} empty), keeping the existing index",
          outcome.errored(),
          outcome.empty());
      return summary(
          started, documentsChunked, emptyDocuments, failedDocuments, chunks.size(), outcome, null);
    }

    chunkIndex.clear();
    IndexWriteResult written = chunkIndex.upsert(outcome.embedded());

    PipelineRunSummary summary =
        summary(
            started,
            documentsChunked,
            emptyDocuments,
            failedDocuments,
            chunks.size(),
            outcome,
            written);
    log.info(summary.summaryLine());
    return summary;
  }

  /**
   * Embeds the query and searches the index.
   *
   * @param queryText query text
   * @param topK maximum hits; the configured default when not positive
   * @param filterCriteria metadata equality filter, may be empty
   * @return hits by descending score, empty when the query cannot be embedded
   */
  @Timed(value = "corpus.index.search", description = "Time to embed and search a query")
  public List<ChunkSearchResult> search(
      String queryText, int topK, Map<String, Object> filterCriteria) {
    int k = topK > 0 ? topK : config.getIndex().getDefaultTopK();
    float[] query = embeddingService.embed(queryText);
    if (query.length == 0) {
      log.warn("Query could not be embedded, returning no results");
      return List.of();
    }
    return chunkIndex.search(query, k, filterCriteria);
  }

  /**
   * Embeds chunks in windows of at most {@code submitWindow} tasks; each window is joined before
   * the next is submitted, so the executor queue never holds more than one window.
   */
  private EmbeddingOutcome embedAll(List<Chunk> chunks) {
    String version = embeddingService.version();
    Duration timeout = config.getEmbedding().getTimeout();
    int window = Math.max(1, config.getEmbedding().getSubmitWindow());

    List<EmbeddedChunk> embedded = new ArrayList<>(chunks.size());
    int empty = 0;
    int errored = 0;
    for (int start = 0; start < chunks.size(); start += window) {
      List<Chunk> slice = chunks.subList(start, Math.min(start + window, chunks.size()));
      List<CompletableFuture<EmbeddedChunk>> futures = new ArrayList<>(slice.size());
      for (Chunk chunk : slice) {
        futures.add(
            BoundedExecution.submit(
                embeddingExecutor,
                timeout,
                () -> new EmbeddedChunk(chunk, embeddingService.embed(chunk.text()), version)));
      }
      for (int i = 0; i < futures.size(); i++) {
        try {
          EmbeddedChunk result = futures.get(i).join();
          if (result.embedding() == null || result.embedding().length == 0) {
            empty++;
          } else {
            embedded.add(result);
          }
        } catch (CompletionException e) {
          errored++;
          Throwable cause = e.getCause() != null ? e.getCause() : e;
          if (cause instanceof TimeoutException) {
            log.warn("Embedding timed out for chunk {}", slice.get(i).chunkId());
          } else {
            log.warn(
                "Embedding failed for chunk {}: {}", slice.get(i).chunkId(), cause.getMessage());
          }
        }
      }
      log.debug("Embedded {}/{} chunks", Math.min(start + window, chunks.size()), chunks.size());
    }
    log.info(
        "Embedded {}/{} chunks ({} empty, {} errored)",
        embedded.size(),
        chunks.size(),
        empty,
        errored);
    return new EmbeddingOutcome(embedded, empty, errored);
  }

  private PipelineRunSummary summary(
      Instant started,
      int documentsChunked,
      int emptyDocuments,
      int failedDocuments,
      int chunksTotal,
      EmbeddingOutcome outcome,
      IndexWriteResult written) {
    int indexed = written == null ? 0 : written.written();
    int rejected = written == null ? 0 : written.skipped();
    Map<String, Integer> details = new LinkedHashMap<>();
    details.put("documents", documentsChunked);
    details.put("documentsEmpty", emptyDocuments);
    details.put("documentsFailed", failedDocuments);
    details.put("chunks", chunksTotal);
    details.put("chunksIndexed", indexed);
    details.put("chunksRejected", rejected);
    return new PipelineRunSummary(
        "index",
        indexed,
        outcome.empty() + rejected,
        outcome.errored() + failedDocuments,
        details,
        Duration.between(started, Instant.now()));
  }

  private record EmbeddingOutcome(List<EmbeddedChunk> embedded, int empty, int errored) {}
}
