package com.flamingo.ai.techdocs.service.ingestion.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Last-resort splitter that cuts text into pieces of at most {@code chunkSize} characters.
 *
 * <p>A cut that would land inside a word is moved back to the nearest preceding space, provided
 * that space lies strictly after the piece start. Consecutive pieces overlap by {@code overlap}
 * characters. Atomic tokens (protected-block placeholders) are never cut: a cut that falls inside
 * one moves before it, or past it when the token starts the piece. Sizes are measured in
 * characters unless a {@link TextMeasure} weighs tokens by the blocks they replace.
 */
public class HardSplitter {

  private final Pattern atomicTokens;

  public HardSplitter() {
    this(ContentProtector.PLACEHOLDER_PATTERN);
  }

  public HardSplitter(Pattern atomicTokens) {
    this.atomicTokens = atomicTokens;
  }

  public List<String> split(String text, int chunkSize, int overlap) {
    return split(text, chunkSize, overlap, TextMeasure.plain(atomicTokens));
  }

  /**
   * Splits with sizes taken from {@code measure}, so a placeholder costs the length of its block.
   */
  List<String> split(String text, int chunkSize, int overlap, TextMeasure measure) {
    List<String> pieces = new ArrayList<>();
    int length = text.length();
    int start = 0;

    while (start < length) {
      int end = measure.fitEnd(text, start, chunkSize);

      if (end < length) {
        int lastSpace = text.lastIndexOf(' ', end - 1);
        if (lastSpace > start) {
          end = lastSpace;
        }
      }

      pieces.add(text.substring(start, end));
      if (end >= length) {
        break;
      }

      int next = overlap > 0 ? measure.tailStart(text, start, end, overlap) : end;
      if (next <= start) {
        next = end;
      }
      start = next;
    }
    return pieces;
  }
}
