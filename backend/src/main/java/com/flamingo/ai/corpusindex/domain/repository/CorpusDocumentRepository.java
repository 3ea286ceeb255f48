package com.flamingo.ai.corpusindex.domain.repository;

import com.flamingo.ai.corpusindex.domain.entity.CorpusDocument;
import com.flamingo.ai.corpusindex.domain.enums.SourceType;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for ingested documents. */
@Repository
public interface CorpusDocumentRepository extends JpaRepository<CorpusDocument, String> {

  /** All documents in a stable order, so rebuilds chunk and upsert deterministically. */
  List<CorpusDocument> findAllByOrderByIdAsc();

  List<CorpusDocument> findBySourceType(SourceType sourceType);
}
