package com.flamingo.ai.corpusindex.domain.repository;

import com.flamingo.ai.corpusindex.domain.entity.Claim;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/** Repository for claims and their duplicate links. */
@Repository
public interface ClaimRepository extends JpaRepository<Claim, Long> {

  /** Every claim of one episode, folded ones included. */
  List<Claim> findByEpisodeIdOrderByIdAsc(String episodeId);

  /** Claims that reference a source document. */
  List<Claim> findByDocumentIdIsNotNull();

  @Query(
      "SELECT DISTINCT c.episodeId FROM Claim c WHERE c.episodeId IS NOT NULL ORDER BY c.episodeId")
  List<String> findDistinctEpisodeIds();
}
