package com.flamingo.ai.corpusindex.service.dedup;

import com.flamingo.ai.corpusindex.domain.entity.Claim;
import com.flamingo.ai.corpusindex.exception.DuplicateCycleException;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * In-memory view of the duplicate links among a set of claims.
 *
 * <p>Links must form a forest. {@link #link(long, long)} refuses self-loops and any link whose
 * target already resolves to the source, so following links from any claim ends at a root within
 * as many hops as there are claims.
 */
public class DuplicateForest {

  private final Map<Long, Long> parent = new HashMap<>();

  public DuplicateForest(Collection<Claim> claims) {
    for (Claim claim : claims) {
      if (claim.getDuplicateOf() != null) {
        parent.put(claim.getId(), claim.getDuplicateOf());
      }
    }
  }

  /**
   * Follows links from {@code claimId} to the claim that has none.
   *
   * @throws DuplicateCycleException when the links starting here loop
   */
  public long root(long claimId) {
    long current = claimId;
    int hops = 0;
    int limit = parent.size() + 1;
    while (parent.containsKey(current)) {
      current = parent.get(current);
      if (++hops > limit) {
        throw new DuplicateCycleException(claimId, current);
      }
    }
    return current;
  }

  /**
   * Records {@code duplicateId -> keptId}.
   *
   * @throws DuplicateCycleException when the link is a self-loop or would close a cycle
   */
  public void link(long duplicateId, long keptId) {
    if (duplicateId == keptId || root(keptId) == duplicateId) {
      throw new DuplicateCycleException(duplicateId, keptId);
    }
    if (parent.containsKey(duplicateId)) {
      throw new IllegalStateException("Claim " + duplicateId + " is already a duplicate");
    }
    parent.put(duplicateId, keptId);
  }

  public boolean isDuplicate(long claimId) {
    return parent.containsKey(claimId);
  }

  public int size() {
    return parent.size();
  }
}
