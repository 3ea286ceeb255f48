package com.flamingo.ai.corpusindex.service.dedup.model;

import com.flamingo.ai.corpusindex.domain.entity.Claim;
import java.util.List;

/**
 * A connected component of the candidate-pair graph.
 *
 * @param members claims of the group, ascending id
 * @param minSimilarity lowest similarity among the pairs that joined the group
 */
public record DuplicateGroup(List<Claim> members, double minSimilarity) {

  public List<Long> claimIds() {
    return members.stream().map(Claim::getId).toList();
  }
}
