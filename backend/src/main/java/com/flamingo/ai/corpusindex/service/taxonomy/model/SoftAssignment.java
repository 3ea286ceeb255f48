package com.flamingo.ai.corpusindex.service.taxonomy.model;

/**
 * One retained document-to-cluster edge.
 *
 * @param documentId document id
 * @param clusterId cluster id
 * @param confidence mixture posterior probability
 * @param primary whether this is the document's most probable cluster
 */
public record SoftAssignment(
    String documentId, int clusterId, double confidence, boolean primary) {}
