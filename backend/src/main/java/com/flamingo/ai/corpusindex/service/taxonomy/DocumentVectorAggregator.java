package com.flamingo.ai.corpusindex.service.taxonomy;

import com.flamingo.ai.corpusindex.domain.entity.CorpusDocument;
import com.flamingo.ai.corpusindex.service.index.model.EmbeddedChunk;
import com.flamingo.ai.corpusindex.service.taxonomy.model.AggregationResult;
import com.flamingo.ai.corpusindex.service.taxonomy.model.DocumentVector;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Pools chunk embeddings into one vector per document.
 *
 * <p>Each chunk is weighted by its token count (at least 1), the weighted mean is L2-normalized.
 * Documents without chunks never appear; chunks of documents missing from the store are dropped.
 */
@Slf4j
@Component
public class DocumentVectorAggregator {

  public AggregationResult aggregate(
      List<EmbeddedChunk> chunks, Map<String, CorpusDocument> documentsById) {
    Map<String, List<EmbeddedChunk>> byDocument = new TreeMap<>();
    for (EmbeddedChunk chunk : chunks) {
      if (chunk.embedding() == null || chunk.embedding().length == 0) {
        continue;
      }
      byDocument.computeIfAbsent(chunk.chunk().documentId(), id -> new ArrayList<>()).add(chunk);
    }

    List<DocumentVector> vectors = new ArrayList<>(byDocument.size());
    List<String> missing = new ArrayList<>();
    for (Map.Entry<String, List<EmbeddedChunk>> entry : byDocument.entrySet()) {
      CorpusDocument document = documentsById.get(entry.getKey());
      if (document == null) {
        log.warn("Chunks reference unknown document {}, skipping", entry.getKey());
        missing.add(entry.getKey());
        continue;
      }
      vectors.add(
          new DocumentVector(
              document.getId(),
              document.getTitle(),
              document.getAbstractText() == null ? "" : document.getAbstractText(),
              document.getPublicationYear(),
              weightedMean(entry.getValue()),
              entry.getValue().size()));
    }
    log.info(
        "Aggregated {} chunks into {} document vectors ({} unknown documents)",
        chunks.size(),
        vectors.size(),
        missing.size());
    return new AggregationResult(vectors, missing);
  }

  static double[] weightedMean(List<EmbeddedChunk> chunks) {
    int dimensions = chunks.get(0).embedding().length;
    double[] sum = new double[dimensions];
    double totalWeight = 0;
    for (EmbeddedChunk chunk : chunks) {
      float[] embedding = chunk.embedding();
      if (embedding.length != dimensions) {
        log.warn(
            "Chunk {} has {} dimensions, expected {}",
            chunk.chunkId(),
            embedding.length,
            dimensions);
        continue;
      }
      double weight = Math.max(1, chunk.chunk().tokenCount());
      for (int i = 0; i < dimensions; i++) {
        sum[i] += weight * embedding[i];
      }
      totalWeight += weight;
    }
    double norm = 0;
    for (int i = 0; i < dimensions; i++) {
      sum[i] /= totalWeight;
      norm += sum[i] * sum[i];
    }
    norm = Math.sqrt(norm);
    if (norm > 0) {
      for (int i = 0; i < dimensions; i++) {
        sum[i] /= norm;
      }
    }
    return sum;
  }
}
