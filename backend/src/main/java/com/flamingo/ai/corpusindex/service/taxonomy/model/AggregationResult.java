package com.flamingo.ai.corpusindex.service.taxonomy.model;

import java.util.List;

/**
 * Output of chunk-to-document aggregation.
 *
 * @param documents one vector per document, ordered by document id
 * @param missingDocumentIds ids referenced by chunks but absent from the document store
 */
public record AggregationResult(List<DocumentVector> documents, List<String> missingDocumentIds) {}
