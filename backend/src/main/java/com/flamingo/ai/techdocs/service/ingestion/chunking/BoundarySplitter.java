package com.flamingo.ai.techdocs.service.ingestion.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Recursive splitter that breaks text along a priority-ordered hierarchy of separators.
 *
 * <p>The first separator in the list is tried first. If it does not occur in the text, the
 * remaining separators are tried on the same text. Otherwise the pieces are re-joined greedily into
 * segments that fit {@code chunkSize}; a segment that still exceeds the budget is split again with
 * the remaining separators, and once none are left the {@link HardSplitter} takes over. Each new
 * segment is seeded with the tail of the previously emitted one so context carries across the seam.
 *
 * <p>Every call is a pure function of its arguments: the separator list is passed down explicitly
 * and no state is shared between calls. Given the block map, a placeholder is sized by the block it
 * stands for, so a segment holds several blocks only when all of them fit the budget.
 */
public class BoundarySplitter {

  /** Separators from most to least structurally significant. */
  public static final List<String> DEFAULT_SEPARATORS =
      List.of(
          "\n## ", // chapter sections
          "\n### ",
          "\n#### ",
          "\n```", // code fence boundaries
          "\n\n", // paragraphs
          "\n",
          " ");

  private final HardSplitter hardSplitter;
  private final Pattern atomicTokens;

  public BoundarySplitter() {
    this(new HardSplitter(), ContentProtector.PLACEHOLDER_PATTERN);
  }

  public BoundarySplitter(HardSplitter hardSplitter, Pattern atomicTokens) {
    this.hardSplitter = hardSplitter;
    this.atomicTokens = atomicTokens;
  }

  public List<String> split(String text, int chunkSize, int overlap) {
    return split(text, chunkSize, overlap, DEFAULT_SEPARATORS);
  }

  /**
   * Splits protected text, sizing each placeholder by the block it replaces so that restored
   * segments keep to the budget.
   *
   * @param text text containing placeholders
   * @param chunkSize budget in restored characters
   * @param overlap restored characters carried into the next segment
   * @param blocks placeholder to original block
   * @return ordered segments, still containing placeholders
   */
  public List<String> split(
      String text, int chunkSize, int overlap, Map<String, String> blocks) {
    return split(
        text, chunkSize, overlap, DEFAULT_SEPARATORS, new TextMeasure(atomicTokens, blocks));
  }

  /**
   * Splits {@code text} into ordered segments of at most {@code chunkSize} characters, except where
   * a single atomic token is larger than the budget.
   *
   * @param text text to split (placeholders already substituted)
   * @param chunkSize budget in characters
   * @param overlap characters of the previous segment carried into the next one
   * @param separators remaining separators, most significant first
   * @return ordered segments
   */
  public List<String> split(String text, int chunkSize, int overlap, List<String> separators) {
    return split(text, chunkSize, overlap, separators, TextMeasure.plain(atomicTokens));
  }

  private List<String> split(
      String text, int chunkSize, int overlap, List<String> separators, TextMeasure measure) {
    if (separators.isEmpty()) {
      return hardSplitter.split(text, chunkSize, overlap, measure);
    }

    String separator = separators.get(0);
    List<String> remaining = separators.subList(1, separators.size());

    List<String> pieces = splitOnLiteral(text, separator);
    if (pieces.size() == 1) {
      return split(text, chunkSize, overlap, remaining, measure);
    }

    List<String> segments = new ArrayList<>();
    String current = "";
    int currentSize = 0;

    for (int i = 0; i < pieces.size(); i++) {
      String piece = i > 0 ? separator + pieces.get(i) : pieces.get(i);
      int pieceSize = measure.length(piece);

      if (currentSize + pieceSize <= chunkSize) {
        current = current + piece;
        currentSize += pieceSize;
        continue;
      }

      if (!current.isEmpty()) {
        close(current, currentSize, chunkSize, overlap, remaining, measure, segments);
      }
      current = piece;
      currentSize = pieceSize;
      if (!segments.isEmpty() && overlap > 0) {
        String seed = overlapTail(segments.get(segments.size() - 1), overlap, measure);
        current = seed + current;
        currentSize += measure.length(seed);
      }
    }

    if (!current.isEmpty()) {
      close(current, currentSize, chunkSize, overlap, remaining, measure, segments);
    }
    return segments;
  }

  private void close(
      String segment,
      int segmentSize,
      int chunkSize,
      int overlap,
      List<String> remaining,
      TextMeasure measure,
      List<String> segments) {
    if (segmentSize > chunkSize) {
      segments.addAll(split(segment, chunkSize, overlap, remaining, measure));
    } else {
      segments.add(segment);
    }
  }

  String overlapTail(String segment, int overlap) {
    return overlapTail(segment, overlap, TextMeasure.plain(atomicTokens));
  }

  /**
   * Returns the longest tail of {@code segment} measuring at most {@code overlap} that does not
   * start inside an atomic token.
   */
  private String overlapTail(String segment, int overlap, TextMeasure measure) {
    return segment.substring(measure.tailStart(segment, 0, segment.length(), overlap));
  }

  /** Splits on a literal separator, keeping leading and trailing empty pieces. */
  static List<String> splitOnLiteral(String text, String separator) {
    List<String> pieces = new ArrayList<>();
    int from = 0;
    int at;
    while ((at = text.indexOf(separator, from)) >= 0) {
      pieces.add(text.substring(from, at));
      from = at + separator.length();
    }
    pieces.add(text.substring(from));
    return pieces;
  }
}
