package com.flamingo.ai.corpusindex.service.taxonomy.model;

/**
 * A document's representative vector: the token-weighted, L2-normalized mean of its chunk vectors.
 *
 * @param documentId document id
 * @param title document title
 * @param abstractText abstract, may be empty
 * @param year publication year, null for transcripts
 * @param vector unit-length vector
 * @param chunkCount number of chunks aggregated
 */
public record DocumentVector(
    String documentId,
    String title,
    String abstractText,
    Integer year,
    double[] vector,
    int chunkCount) {}
