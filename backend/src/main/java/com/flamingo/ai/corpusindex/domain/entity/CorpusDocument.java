package com.flamingo.ai.corpusindex.domain.entity;

import com.flamingo.ai.corpusindex.domain.converter.DocumentSectionListConverter;
import com.flamingo.ai.corpusindex.domain.converter.StringListConverter;
import com.flamingo.ai.corpusindex.domain.enums.SourceType;
import com.flamingo.ai.corpusindex.domain.model.DocumentSection;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A paper or transcript ingested into the corpus.
 *
 * <p>Rows are written by the ingestion scripts and are read-only here apart from metadata
 * corrections.
 */
@Entity
@Table(name = "documents")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CorpusDocument {

  @Id private String id;

  @Column(nullable = false)
  private String title;

  @Column(columnDefinition = "TEXT")
  private String abstractText;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private SourceType sourceType;

  /** Null for transcripts. */
  private Integer publicationYear;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> authors = new ArrayList<>();

  private String sourcePath;

  /** Episode identifier for transcripts. */
  private String episodeId;

  @Column(columnDefinition = "TEXT")
  private String fullText;

  @Convert(converter = DocumentSectionListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<DocumentSection> sections = new ArrayList<>();

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }

  /**
   * Sections the chunker should walk. Documents without declared sections are treated as one
   * untitled section holding the full text.
   */
  public List<DocumentSection> effectiveSections() {
    if (sections != null && !sections.isEmpty()) {
      return sections;
    }
    if (fullText == null || fullText.isEmpty()) {
      return List.of();
    }
    return List.of(new DocumentSection(null, fullText, null));
  }

  /** Non-blank section texts in order, separated by a blank line. */
  public String text() {
    return effectiveSections().stream()
        .map(DocumentSection::text)
        .filter(t -> t != null && !t.isBlank())
        .collect(Collectors.joining("\n\n"));
  }
}
