package com.flamingo.ai.corpusindex.service.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.corpusindex.exception.VectorIndexUnavailableException;
import com.flamingo.ai.corpusindex.service.chunking.model.Chunk;
import com.flamingo.ai.corpusindex.service.chunking.model.ChunkMetadata;
import com.flamingo.ai.corpusindex.service.index.model.ChunkSearchResult;
import com.flamingo.ai.corpusindex.service.index.model.EmbeddedChunk;
import com.flamingo.ai.corpusindex.service.index.model.IndexStats;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.RelevanceScore;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Embedded vector index: chunks live in memory and are persisted to one JSON file.
 *
 * <p>Search is an exact brute-force cosine scan. The file is replaced atomically (temp file plus
 * move) after every upsert and clear, so a crash never leaves a half-written index behind.
 */
@Slf4j
public class LocalFileChunkIndex extends AbstractChunkIndex {

  static final int FORMAT_VERSION = 1;

  private final Path path;
  private final ObjectMapper objectMapper;
  private final Map<String, EmbeddedChunk> chunks = new LinkedHashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  public LocalFileChunkIndex(
      Path path,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      int upsertBatchSize,
      double minScore) {
    super(meterRegistry, upsertBatchSize, minScore);
    this.path = path;
    this.objectMapper = objectMapper;
  }

  @Override
  public IndexBackend backend() {
    return IndexBackend.LOCAL;
  }

  @Override
  protected void initialize() {
    lock.writeLock().lock();
    try {
      chunks.clear();
      if (!Files.exists(path)) {
        log.info("Local vector index {} does not exist yet, starting empty", path);
        return;
      }
      IndexFile file = objectMapper.readValue(path.toFile(), IndexFile.class);
      if (file.chunks() != null) {
        for (StoredChunk stored : file.chunks()) {
          EmbeddedChunk chunk = stored.toEmbeddedChunk();
          chunks.put(chunk.chunkId(), chunk);
        }
      }
      log.info("Loaded {} chunks from local vector index {}", chunks.size(), path);
    } catch (IOException e) {
      throw new VectorIndexUnavailableException(
          backend().configValue(), "cannot read " + path + ": " + e.getMessage(), e);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  protected void writeBatch(List<EmbeddedChunk> batch) {
    lock.writeLock().lock();
    try {
      for (EmbeddedChunk chunk : batch) {
        chunks.put(chunk.chunkId(), chunk);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  protected void flush() {
    lock.readLock().lock();
    try {
      persist();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  protected List<ChunkSearchResult> doSearch(
      float[] queryEmbedding, int topK, double minScore, Map<String, Object> filterCriteria) {
    Embedding query = Embedding.from(queryEmbedding);
    List<ChunkSearchResult> scored = new ArrayList<>();
    lock.readLock().lock();
    try {
      for (EmbeddedChunk candidate : chunks.values()) {
        if (!filterCriteria.isEmpty()
            && !matchesFilter(candidate.chunk().metadata().toMap(), filterCriteria)) {
          continue;
        }
        double cosine = CosineSimilarity.between(query, Embedding.from(candidate.embedding()));
        double score = RelevanceScore.fromCosineSimilarity(cosine);
        if (score >= minScore) {
          scored.add(new ChunkSearchResult(candidate.chunk(), score));
        }
      }
    } finally {
      lock.readLock().unlock();
    }
    scored.sort(
        Comparator.comparingDouble(ChunkSearchResult::score)
            .reversed()
            .thenComparing(r -> r.chunk().chunkId()));
    return scored.size() > topK ? new ArrayList<>(scored.subList(0, topK)) : scored;
  }

  @Override
  public void clear() {
    lock.writeLock().lock();
    try {
      int removed = chunks.size();
      chunks.clear();
      persist();
      log.info("Cleared local vector index {} ({} chunks removed)", path, removed);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public IndexStats stats() {
    lock.readLock().lock();
    try {
      if (chunks.isEmpty()) {
        return new IndexStats(0, 0, backend(), null);
      }
      EmbeddedChunk first = chunks.values().iterator().next();
      return new IndexStats(
          chunks.size(), first.embedding().length, backend(), first.embeddingVersion());
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<EmbeddedChunk> fetchAll() {
    lock.readLock().lock();
    try {
      List<EmbeddedChunk> all = new ArrayList<>(chunks.values());
      all.sort(
          Comparator.comparing((EmbeddedChunk c) -> c.chunk().documentId())
              .thenComparingInt(c -> c.chunk().chunkIndex()));
      return all;
    } finally {
      lock.readLock().unlock();
    }
  }

  private void persist() {
    List<StoredChunk> stored = new ArrayList<>(chunks.size());
    for (EmbeddedChunk chunk : chunks.values()) {
      stored.add(StoredChunk.from(chunk));
    }
    IndexFile file = new IndexFile(FORMAT_VERSION, stored);
    try {
      Path parent = path.toAbsolutePath().getParent();
      Files.createDirectories(parent);
      Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
      objectMapper.writeValue(tmp.toFile(), file);
      try {
        Files.move(
            tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
      }
      log.debug("Persisted {} chunks to {}", stored.size(), path);
    } catch (IOException e) {
      throw new VectorIndexUnavailableException(
          backend().configValue(), "cannot write " + path + ": " + e.getMessage(), e);
    }
  }

  /** On-disk layout of the index file. */
  record IndexFile(int formatVersion, List<StoredChunk> chunks) {}

  /** On-disk layout of one chunk; metadata is kept in its flat, versioned map form. */
  record StoredChunk(
      String chunkId,
      String documentId,
      int chunkIndex,
      int sectionIndex,
      String sectionHeading,
      String text,
      int tokenCount,
      int overlapChars,
      Integer page,
      Map<String, Object> metadata,
      String embeddingVersion,
      float[] embedding) {

    static StoredChunk from(EmbeddedChunk embedded) {
      Chunk c = embedded.chunk();
      return new StoredChunk(
          c.chunkId(),
          c.documentId(),
          c.chunkIndex(),
          c.sectionIndex(),
          c.sectionHeading(),
          c.text(),
          c.tokenCount(),
          c.overlapChars(),
          c.page(),
          c.metadata().toMap(),
          embedded.embeddingVersion(),
          embedded.embedding());
    }

    EmbeddedChunk toEmbeddedChunk() {
      Chunk chunk =
          new Chunk(
              chunkId,
              documentId,
              chunkIndex,
              sectionIndex,
              sectionHeading,
              text,
              tokenCount,
              overlapChars,
              page,
              ChunkMetadata.fromMap(metadata));
      return new EmbeddedChunk(chunk, embedding, embeddingVersion);
    }
  }
}
