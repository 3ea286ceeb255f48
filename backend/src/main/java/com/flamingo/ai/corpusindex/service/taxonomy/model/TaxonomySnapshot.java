package com.flamingo.ai.corpusindex.service.taxonomy.model;

import com.flamingo.ai.corpusindex.domain.entity.ClaimClusterAssignment;
import com.flamingo.ai.corpusindex.domain.entity.PaperClusterAssignment;
import com.flamingo.ai.corpusindex.domain.entity.TaxonomyCluster;
import java.util.List;

/** Complete taxonomy state, written and read as a unit. */
public record TaxonomySnapshot(
    List<TaxonomyCluster> clusters,
    List<PaperClusterAssignment> paperAssignments,
    List<ClaimClusterAssignment> claimAssignments) {}
