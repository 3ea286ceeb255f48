package com.flamingo.ai.corpusindex.service.taxonomy;

import com.flamingo.ai.corpusindex.domain.repository.ClaimClusterAssignmentRepository;
import com.flamingo.ai.corpusindex.domain.repository.PaperClusterAssignmentRepository;
import com.flamingo.ai.corpusindex.domain.repository.TaxonomyClusterRepository;
import com.flamingo.ai.corpusindex.service.taxonomy.model.TaxonomySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link TaxonomyStore} over the JPA repositories; one transaction replaces all three tables. */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaTaxonomyStore implements TaxonomyStore {

  private final TaxonomyClusterRepository clusterRepository;
  private final PaperClusterAssignmentRepository paperAssignmentRepository;
  private final ClaimClusterAssignmentRepository claimAssignmentRepository;

  @Override
  @Transactional
  public void replace(TaxonomySnapshot snapshot) {
    claimAssignmentRepository.deleteAllInBatch();
    paperAssignmentRepository.deleteAllInBatch();
    clusterRepository.deleteAllInBatch();

    clusterRepository.saveAll(snapshot.clusters());
    paperAssignmentRepository.saveAll(snapshot.paperAssignments());
    claimAssignmentRepository.saveAll(snapshot.claimAssignments());
    log.info(
        "Replaced taxonomy: {} clusters, {} paper assignments, {} claim assignments",
        snapshot.clusters().size(),
        snapshot.paperAssignments().size(),
        snapshot.claimAssignments().size());
  }

  @Override
  @Transactional(readOnly = true)
  public TaxonomySnapshot current() {
    return new TaxonomySnapshot(
        clusterRepository.findAllByOrderByClusterIdAsc(),
        paperAssignmentRepository.findAll(),
        claimAssignmentRepository.findAll());
  }
}
