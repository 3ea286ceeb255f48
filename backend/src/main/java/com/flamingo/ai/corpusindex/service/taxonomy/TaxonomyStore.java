package com.flamingo.ai.corpusindex.service.taxonomy;

import com.flamingo.ai.corpusindex.service.taxonomy.model.TaxonomySnapshot;

/**
 * Persistence of the taxonomy tables. A replace is all-or-nothing: readers see either the old
 * taxonomy or the new one.
 */
public interface TaxonomyStore {

  /** Deletes every cluster and assignment and writes {@code snapshot} in their place. */
  void replace(TaxonomySnapshot snapshot);

  TaxonomySnapshot current();
}
