package com.flamingo.ai.corpusindex.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import com.flamingo.ai.corpusindex.domain.entity.CorpusDocument;
import com.flamingo.ai.corpusindex.domain.enums.SourceType;
import com.flamingo.ai.corpusindex.domain.model.DocumentSection;
import com.flamingo.ai.corpusindex.service.chunking.model.Chunk;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SectionAwareChunker Tests")
class SectionAwareChunkerTest {

  private static final Tokenizer TOKENIZER = new JtokkitTokenizer("cl100k_base");

  private SectionAwareChunker chunker;

  @BeforeEach
  void setUp() {
    chunker = new SectionAwareChunker(TOKENIZER, new CorpusIndexConfig());
  }

  @Test
  @DisplayName("should emit exactly one chunk when the whole document fits the target")
  void shouldEmitSingleChunk_whenDocumentFitsTarget() {
    CorpusDocument document =
        paper(
            "p1",
            List.of(
                new DocumentSection("Abstract", "Planaria regenerate heads.", 1),
                new DocumentSection("Results", "Gap junctions carry the signal.", 2)));

    List<Chunk> chunks = chunker.chunk(document, 400, 50);

    assertThat(chunks).hasSize(1);
    Chunk chunk = chunks.get(0);
    assertThat(chunk.chunkId()).isEqualTo("p1_chunk_0");
    assertThat(chunk.text()).isEqualTo(document.text());
    assertThat(chunk.sectionHeading()).isEqualTo("Abstract");
    assertThat(chunk.overlapChars()).isZero();
    assertThat(chunk.metadata().title()).isEqualTo("Title of p1");
  }

  @Test
  @DisplayName("should produce no chunks when the document has no text")
  void shouldProduceNoChunks_whenDocumentEmpty() {
    CorpusDocument document = paper("empty", List.of(new DocumentSection("Body", "   ", null)));

    assertThat(chunker.chunk(document, 400, 50)).isEmpty();
  }

  @Test
  @DisplayName("should keep every chunk within the token target")
  void shouldKeepChunksWithinTarget_whenDocumentIsLong() {
    CorpusDocument document =
        paper(
            "long",
            List.of(
                new DocumentSection("Introduction", sentences("bioelectric", 120), 1),
                new DocumentSection("Methods", sentences("voltage dye", 80), 4)));

    List<Chunk> chunks = chunker.chunk(document, 100, 20);

    assertThat(chunks).hasSizeGreaterThan(2);
    assertThat(chunks).allSatisfy(c -> assertThat(c.tokenCount()).isLessThanOrEqualTo(100));
    for (int i = 0; i < chunks.size(); i++) {
      assertThat(chunks.get(i).chunkIndex()).isEqualTo(i);
      assertThat(chunks.get(i).chunkId()).isEqualTo("long_chunk_" + i);
    }
  }

  @Test
  @DisplayName("should rebuild the document text when overlaps are removed")
  void shouldReconstructDocument_whenOverlapsRemoved() {
    CorpusDocument document =
        paper(
            "recon",
            List.of(
                new DocumentSection("Introduction", sentences("morphogenesis", 90), 1),
                new DocumentSection("Discussion", sentences("anatomical memory", 70), 6)));

    List<Chunk> chunks = chunker.chunk(document, 80, 15);

    assertThat(SectionAwareChunker.reconstruct(chunks)).isEqualTo(document.text());
  }

  @Test
  @DisplayName("should chunk special-token strings as ordinary text")
  void shouldChunkSpecialTokenText_whenDocumentQuotesEndOfText() {
    CorpusDocument document =
        paper(
            "special",
            List.of(
                new DocumentSection(
                    "Methods",
                    "The model emitted <|endoftext|> and stopped. " + sentences("decoding", 40),
                    1)));

    List<Chunk> chunks = chunker.chunk(document, 60, 10);

    assertThat(chunks).isNotEmpty();
    assertThat(chunks.get(0).text()).contains("<|endoftext|>");
    assertThat(SectionAwareChunker.reconstruct(chunks)).isEqualTo(document.text());
  }

  @Test
  @DisplayName("should repeat the tail of the previous chunk when overlap is positive")
  void shouldRepeatPreviousTail_whenOverlapPositive() {
    CorpusDocument document =
        paper("overlap", List.of(new DocumentSection("Body", sentences("regeneration", 60), 1)));

    List<Chunk> chunks = chunker.chunk(document, 60, 10);

    assertThat(chunks).hasSizeGreaterThan(1);
    assertThat(chunks.get(0).overlapChars()).isZero();
    for (int i = 1; i < chunks.size(); i++) {
      Chunk previous = chunks.get(i - 1);
      Chunk current = chunks.get(i);
      assertThat(current.overlapChars()).isPositive();
      assertThat(previous.text()).endsWith(current.text().substring(0, current.overlapChars()));
    }
  }

  @Test
  @DisplayName("should never cut a chunk across a section boundary")
  void shouldStayInsideSection_whenSectionsAreLong() {
    String first = sentences("alpha", 50);
    String second = sentences("omega", 50);
    CorpusDocument document =
        paper(
            "sections",
            List.of(new DocumentSection("A", first, 1), new DocumentSection("B", second, 3)));

    List<Chunk> chunks = chunker.chunk(document, 70, 10);

    assertThat(chunks)
        .allSatisfy(
            c -> {
              String section = c.sectionIndex() == 0 ? first : second;
              assertThat(section).contains(c.text());
              assertThat(c.sectionHeading()).isEqualTo(c.sectionIndex() == 0 ? "A" : "B");
            });
    assertThat(chunks.stream().filter(c -> c.sectionIndex() == 1).findFirst())
        .hasValueSatisfying(c -> assertThat(c.page()).isEqualTo(3));
  }

  @Test
  @DisplayName("should label untitled sections as Introduction")
  void shouldUseDefaultHeading_whenSectionUntitled() {
    CorpusDocument document = paper("plain", new ArrayList<>());
    document.setFullText("Plain text without any section headings.");

    List<Chunk> chunks = chunker.chunk(document, 400, 50);

    assertThat(chunks).hasSize(1);
    assertThat(chunks.get(0).sectionHeading()).isEqualTo(SectionAwareChunker.DEFAULT_HEADING);
  }

  @Test
  @DisplayName("should use configured target and overlap when none are given")
  void shouldUseConfiguredSizes_whenCalledWithoutSizes() {
    CorpusIndexConfig config = new CorpusIndexConfig();
    config.getChunking().setTargetTokens(50);
    config.getChunking().setOverlapTokens(5);
    SectionAwareChunker configured = new SectionAwareChunker(TOKENIZER, config);
    CorpusDocument document =
        paper("cfg", List.of(new DocumentSection("Body", sentences("cells", 40), 1)));

    List<Chunk> chunks = configured.chunk(document);

    assertThat(chunks).hasSizeGreaterThan(1);
    assertThat(chunks).allSatisfy(c -> assertThat(c.tokenCount()).isLessThanOrEqualTo(50));
  }

  @Test
  @DisplayName("should reject a non-positive target")
  void shouldThrow_whenTargetNotPositive() {
    CorpusDocument document = paper("bad", List.of(new DocumentSection("Body", "text", 1)));

    assertThatThrownBy(() -> chunker.chunk(document, 0, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static CorpusDocument paper(String id, List<DocumentSection> sections) {
    return CorpusDocument.builder()
        .id(id)
        .title("Title of " + id)
        .sourceType(SourceType.PAPER)
        .publicationYear(2021)
        .authors(new ArrayList<>(List.of("M. Levin")))
        .sections(new ArrayList<>(sections))
        .build();
  }

  private static String sentences(String topic, int count) {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < count; i++) {
      if (i > 0) {
        text.append(i % 10 == 0 ? "\n\n" : " ");
      }
      text.append("Sentence ").append(i).append(" discusses ").append(topic).append(" in depth.");
    }
    return text.toString();
  }
}
