package com.flamingo.ai.corpusindex.service.taxonomy;

import com.flamingo.ai.corpusindex.service.taxonomy.model.DocumentVector;
import com.flamingo.ai.corpusindex.service.taxonomy.model.MixtureFit;
import com.flamingo.ai.corpusindex.service.taxonomy.model.SoftAssignment;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns mixture posteriors into retained document-to-cluster edges.
 *
 * <p>An edge is kept when its probability is at least the threshold. The one exception is the
 * most probable cluster: it is always kept and flagged primary, even when its probability is below
 * the threshold. With many clusters the posteriors of a document can all fall under the threshold,
 * and a pure threshold rule would then leave that document with no cluster at all. Keeping the
 * primary guarantees every document exactly one primary edge carrying its maximal confidence.
 */
public final class SoftAssignmentCalculator {

  private SoftAssignmentCalculator() {}

  public static List<SoftAssignment> assign(
      List<DocumentVector> documents, MixtureFit fit, double threshold) {
    double[][] resp = fit.responsibilities();
    List<SoftAssignment> assignments = new ArrayList<>();
    for (int i = 0; i < documents.size(); i++) {
      int primary = MixtureFit.argMax(resp[i]);
      for (int j = 0; j < fit.k(); j++) {
        if (j == primary || resp[i][j] >= threshold) {
          assignments.add(
              new SoftAssignment(documents.get(i).documentId(), j, resp[i][j], j == primary));
        }
      }
    }
    return assignments;
  }
}
