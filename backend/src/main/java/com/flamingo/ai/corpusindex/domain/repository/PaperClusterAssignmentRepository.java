package com.flamingo.ai.corpusindex.domain.repository;

import com.flamingo.ai.corpusindex.domain.entity.PaperClusterAssignment;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for document-to-cluster soft assignments. */
@Repository
public interface PaperClusterAssignmentRepository
    extends JpaRepository<PaperClusterAssignment, Long> {

  List<PaperClusterAssignment> findByDocumentId(String documentId);

  List<PaperClusterAssignment> findByDocumentIdIn(Collection<String> documentIds);

  List<PaperClusterAssignment> findByClusterIdOrderByConfidenceDesc(Integer clusterId);
}
