package com.flamingo.ai.corpusindex.domain.repository;

import com.flamingo.ai.corpusindex.domain.entity.TaxonomyCluster;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for taxonomy clusters. */
@Repository
public interface TaxonomyClusterRepository extends JpaRepository<TaxonomyCluster, Integer> {

  List<TaxonomyCluster> findAllByOrderByClusterIdAsc();
}
