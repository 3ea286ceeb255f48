package com.flamingo.ai.corpusindex.service.chunking;

import com.flamingo.ai.corpusindex.config.CorpusIndexConfig;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.IntArrayList;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link Tokenizer} backed by a jtokkit BPE encoding (cl100k_base by default).
 *
 * <p>Special-token strings such as {@code <|endoftext|>} are encoded as ordinary text.
 */
@Component
@Slf4j
public class JtokkitTokenizer implements Tokenizer {

  private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

  private final Encoding encoding;

  @Autowired
  public JtokkitTokenizer(CorpusIndexConfig config) {
    this(config.getChunking().getEncoding());
  }

  public JtokkitTokenizer(String encodingName) {
    this.encoding =
        REGISTRY
            .getEncoding(encodingName)
            .orElseThrow(
                () -> new IllegalArgumentException("Unknown tokenizer encoding: " + encodingName));
    log.debug("Tokenizer initialized with encoding {}", encodingName);
  }

  @Override
  public int countTokens(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return encoding.countTokensOrdinary(text);
  }

  @Override
  public int[] tokenEndOffsets(String text) {
    if (text == null || text.isEmpty()) {
      return new int[0];
    }
    IntArrayList tokens = encoding.encodeOrdinary(text);
    int[] charAtByte = charOffsetsByByte(text);

    int[] ends = new int[tokens.size()];
    IntArrayList single = new IntArrayList(1);
    int byteOffset = 0;
    for (int i = 0; i < tokens.size(); i++) {
      single.clear();
      single.add(tokens.get(i));
      byteOffset += encoding.decodeBytes(single).length;
      ends[i] = charAtByte[Math.min(byteOffset, charAtByte.length - 1)];
    }
    if (ends.length > 0) {
      ends[ends.length - 1] = text.length();
    }
    return ends;
  }

  /**
   * Maps every UTF-8 byte offset of {@code text} to a char offset. Offsets inside a multi-byte
   * sequence map to the end of that character.
   */
  private static int[] charOffsetsByByte(String text) {
    int totalBytes = text.getBytes(StandardCharsets.UTF_8).length;
    int[] charAtByte = new int[totalBytes + 1];
    int b = 0;
    int c = 0;
    while (c < text.length()) {
      int codePoint = text.codePointAt(c);
      int chars = Character.charCount(codePoint);
      int bytes = utf8Length(codePoint);
      charAtByte[b] = c;
      for (int i = 1; i < bytes; i++) {
        charAtByte[b + i] = c + chars;
      }
      b += bytes;
      c += chars;
    }
    charAtByte[totalBytes] = text.length();
    return charAtByte;
  }

  private static int utf8Length(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    } else if (codePoint < 0x800) {
      return 2;
    } else if (codePoint < 0x10000) {
      return 3;
    }
    return 4;
  }
}
