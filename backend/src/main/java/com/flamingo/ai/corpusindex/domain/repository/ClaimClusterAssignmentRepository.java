package com.flamingo.ai.corpusindex.domain.repository;

import com.flamingo.ai.corpusindex.domain.entity.ClaimClusterAssignment;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for inherited claim-to-cluster assignments. */
@Repository
public interface ClaimClusterAssignmentRepository
    extends JpaRepository<ClaimClusterAssignment, Long> {

  List<ClaimClusterAssignment> findByClaimId(Long claimId);
}
