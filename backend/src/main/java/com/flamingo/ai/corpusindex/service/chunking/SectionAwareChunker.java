package com.flamingo.ai.corpusindex.service.chunking;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import com.flamingo.ai.corpusindex.domain.entity.CorpusDocument;
import com.flamingo.ai.corpusindex.domain.model.DocumentSection;
import com.flamingo.ai.corpusindex.service.chunking.model.Chunk;
import com.flamingo.ai.corpusindex.service.chunking.model.ChunkMetadata;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that produces chunks aligned to section boundaries.
 *
 * <p>A document whose whole text fits within the target is emitted as a single chunk. Otherwise
 * each non-blank section is chunked on its own: a section that fits is one chunk, a longer section
 * is cut with a sliding token window that advances by {@code target - overlap} tokens. A window may
 * give up to {@code cleanBreakWindow} of its tokens to end on a paragraph or sentence break; when
 * no break is in reach it ends on the token boundary.
 *
 * <p>Chunk texts are exact substrings of the section text, so dropping each chunk's {@code
 * overlapChars} prefix and joining sections with a blank line rebuilds {@link
 * CorpusDocument#text()}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SectionAwareChunker implements DocumentChunker {

  static final String DEFAULT_HEADING = "Introduction";
  private static final String SECTION_SEPARATOR = "\n\n";

  private final Tokenizer tokenizer;
  private final CorpusIndexConfig config;

  /** Chunks with the configured target and overlap. */
  public List<Chunk> chunk(CorpusDocument document) {
    CorpusIndexConfig.Chunking chunking = config.getChunking();
    return chunk(document, chunking.getTargetTokens(), chunking.getOverlapTokens());
  }

  @Override
  public List<Chunk> chunk(CorpusDocument document, int targetTokens, int overlapTokens) {
    if (targetTokens <= 0) {
      throw new IllegalArgumentException("targetTokens must be positive: " + targetTokens);
    }
    int overlap = Math.max(0, Math.min(overlapTokens, targetTokens - 1));
    ChunkMetadata metadata = ChunkMetadata.of(document);
    List<Chunk> result = new ArrayList<>();

    String fullText = document.text();
    if (fullText.isEmpty()) {
      log.debug("Document {} has no text, producing no chunks", document.getId());
      return result;
    }

    List<DocumentSection> sections = nonBlankSections(document);
    int totalTokens = tokenizer.countTokens(fullText);
    if (totalTokens <= targetTokens) {
      DocumentSection first = sections.get(0);
      result.add(newChunk(document, 0, 0, first, fullText, totalTokens, 0, metadata));
      return result;
    }

    for (int s = 0; s < sections.size(); s++) {
      chunkSection(document, s, sections.get(s), targetTokens, overlap, metadata, result);
    }

    log.debug(
        "SectionAwareChunker produced {} chunks for document {} ({} sections, {} tokens)",
        result.size(),
        document.getId(),
        sections.size(),
        totalTokens);
    return result;
  }

  /**
   * Rebuilds the document text from its chunks by dropping overlaps and rejoining sections.
   *
   * @param chunks chunks of one document in ordinal order
   */
  public static String reconstruct(List<Chunk> chunks) {
    StringBuilder text = new StringBuilder();
    int currentSection = -1;
    for (Chunk chunk : chunks) {
      if (chunk.sectionIndex() != currentSection) {
        if (currentSection >= 0) {
          text.append(SECTION_SEPARATOR);
        }
        currentSection = chunk.sectionIndex();
      }
      text.append(chunk.textWithoutOverlap());
    }
    return text.toString();
  }

  // ---- per-section sliding window ----

  private void chunkSection(
      CorpusDocument document,
      int sectionIndex,
      DocumentSection section,
      int targetTokens,
      int overlap,
      ChunkMetadata metadata,
      List<Chunk> result) {

    String text = section.text();
    int[] ends = tokenizer.tokenEndOffsets(text);
    int tokenCount = ends.length;

    if (tokenCount <= targetTokens) {
      result.add(
          newChunk(
              document, result.size(), sectionIndex, section, text, tokenCount, 0, metadata));
      return;
    }

    int breakWindow = (int) Math.floor(targetTokens * config.getChunking().getCleanBreakWindow());
    int start = 0;
    int previousCharEnd = 0;
    while (start < tokenCount) {
      int end = Math.min(start + targetTokens, tokenCount);
      if (end < tokenCount) {
        end = findCleanBreak(text, ends, start + overlap + 1, end, breakWindow);
      }

      int charStart = start == 0 ? 0 : ends[start - 1];
      int charEnd = ends[end - 1];
      int overlapChars = start == 0 ? 0 : previousCharEnd - charStart;
      result.add(
          newChunk(
              document,
              result.size(),
              sectionIndex,
              section,
              text.substring(charStart, charEnd),
              end - start,
              overlapChars,
              metadata));

      if (end >= tokenCount) {
        break;
      }
      previousCharEnd = charEnd;
      start = end - overlap;
    }
  }

  /**
   * Looks back from {@code end} for a token boundary that closes a paragraph, then one that closes
   * a sentence. Returns {@code end} when neither is in reach.
   */
  private int findCleanBreak(String text, int[] ends, int minEnd, int end, int breakWindow) {
    int lowest = Math.max(minEnd, end - breakWindow);
    for (int e = end; e >= lowest; e--) {
      if (isParagraphBreak(text, ends[e - 1])) {
        return e;
      }
    }
    for (int e = end; e >= lowest; e--) {
      if (isSentenceBreak(text, ends[e - 1])) {
        return e;
      }
    }
    return end;
  }

  private static boolean isParagraphBreak(String text, int offset) {
    return offset >= 2
        && offset < text.length()
        && text.charAt(offset - 1) == '\n'
        && text.charAt(offset - 2) == '\n';
  }

  private static boolean isSentenceBreak(String text, int offset) {
    if (offset < 1 || offset >= text.length()) {
      return false;
    }
    char last = text.charAt(offset - 1);
    char next = text.charAt(offset);
    return (last == '.' || last == '!' || last == '?' || last == '\n')
        && Character.isWhitespace(next);
  }

  private List<DocumentSection> nonBlankSections(CorpusDocument document) {
    List<DocumentSection> sections = new ArrayList<>();
    for (DocumentSection section : document.effectiveSections()) {
      if (section.text() != null && !section.text().isBlank()) {
        sections.add(section);
      }
    }
    return sections;
  }

  private Chunk newChunk(
      CorpusDocument document,
      int chunkIndex,
      int sectionIndex,
      DocumentSection section,
      String text,
      int tokenCount,
      int overlapChars,
      ChunkMetadata metadata) {
    String heading =
        section.heading() == null || section.heading().isBlank()
            ? DEFAULT_HEADING
            : section.heading();
    return new Chunk(
        Chunk.chunkId(document.getId(), chunkIndex),
        document.getId(),
        chunkIndex,
        sectionIndex,
        heading,
        text,
        tokenCount,
        overlapChars,
        section.page(),
        metadata);
  }
}
