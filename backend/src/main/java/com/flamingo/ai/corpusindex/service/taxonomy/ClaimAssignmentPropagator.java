package com.flamingo.ai.corpusindex.service.taxonomy;

import com.flamingo.ai.corpusindex.domain.entity.Claim;
import com.flamingo.ai.corpusindex.domain.entity.ClaimClusterAssignment;
import com.flamingo.ai.corpusindex.exception.DocumentNotFoundException;
import com.flamingo.ai.corpusindex.service.taxonomy.model.ClaimPropagation;
import com.flamingo.ai.corpusindex.service.taxonomy.model.SoftAssignment;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Copies each document's cluster assignments onto the claims that cite it, with the same
 * confidence. Nothing is recomputed.
 */
@Slf4j
public final class ClaimAssignmentPropagator {

  private ClaimAssignmentPropagator() {}

  /**
   * @param claims claims with a document reference
   * @param existingDocumentIds ids present in the document store
   * @param assignmentsByDocument retained assignments per document id
   */
  public static ClaimPropagation propagate(
      List<Claim> claims,
      Set<String> existingDocumentIds,
      Map<String, List<SoftAssignment>> assignmentsByDocument) {
    List<ClaimClusterAssignment> rows = new ArrayList<>();
    int unknown = 0;
    int unclustered = 0;
    for (Claim claim : claims) {
      try {
        List<SoftAssignment> inherited =
            inherited(claim, existingDocumentIds, assignmentsByDocument);
        if (inherited.isEmpty()) {
          unclustered++;
          continue;
        }
        for (SoftAssignment assignment : inherited) {
          rows.add(
              ClaimClusterAssignment.builder()
                  .claimId(claim.getId())
                  .clusterId(assignment.clusterId())
                  .sourceDocumentId(assignment.documentId())
                  .confidence(assignment.confidence())
                  .build());
        }
      } catch (DocumentNotFoundException e) {
        log.warn("Claim {} skipped: {}", claim.getId(), e.getMessage());
        unknown++;
      }
    }
    log.info(
        "Propagated {} claim assignments from {} claims ({} unknown documents, {} unclustered)",
        rows.size(),
        claims.size(),
        unknown,
        unclustered);
    return new ClaimPropagation(rows, unknown, unclustered);
  }

  private static List<SoftAssignment> inherited(
      Claim claim,
      Set<String> existingDocumentIds,
      Map<String, List<SoftAssignment>> assignmentsByDocument) {
    String documentId = claim.getDocumentId();
    if (!existingDocumentIds.contains(documentId)) {
      throw new DocumentNotFoundException(documentId);
    }
    return assignmentsByDocument.getOrDefault(documentId, List.of());
  }
}
