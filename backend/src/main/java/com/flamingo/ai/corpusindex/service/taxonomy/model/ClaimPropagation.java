package com.flamingo.ai.corpusindex.service.taxonomy.model;

import com.flamingo.ai.corpusindex.domain.entity.ClaimClusterAssignment;
import java.util.List;

/**
 * Claim assignments inherited from document assignments.
 *
 * @param assignments one row per (claim, document assignment)
 * @param claimsWithUnknownDocument claims whose document does not exist, skipped
 * @param claimsWithUnclusteredDocument claims whose document exists but has no assignment
 */
public record ClaimPropagation(
    List<ClaimClusterAssignment> assignments,
    int claimsWithUnknownDocument,
    int claimsWithUnclusteredDocument) {}
