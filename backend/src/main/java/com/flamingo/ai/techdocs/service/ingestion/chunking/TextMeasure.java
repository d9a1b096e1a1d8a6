package com.flamingo.ai.techdocs.service.ingestion.chunking;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Measures protected text by the length it will have once restored.
 *
 * <p>Plain characters count one each; an atomic token counts as the full length of the block it
 * stands for, nested placeholders included. Tokens without a block count their own length.
 */
final class TextMeasure {

  private final Pattern atomicTokens;
  private final Map<String, String> blocks;
  private final Map<String, Integer> weights = new HashMap<>();

  TextMeasure(Pattern atomicTokens, Map<String, String> blocks) {
    this.atomicTokens = atomicTokens;
    this.blocks = blocks;
  }

  /** Measure that counts every character, tokens included, once. */
  static TextMeasure plain(Pattern atomicTokens) {
    return new TextMeasure(atomicTokens, Map.of());
  }

  int length(String text) {
    if (blocks.isEmpty()) {
      return text.length();
    }
    int length = text.length();
    Matcher matcher = atomicTokens.matcher(text);
    while (matcher.find()) {
      length += weight(matcher.group()) - matcher.group().length();
    }
    return length;
  }

  /**
   * Returns the furthest cut after {@code start} whose measured length stays within {@code
   * budget} and does not fall inside a token. A token at {@code start} that alone exceeds the
   * budget is returned whole.
   */
  int fitEnd(String text, int start, int budget) {
    Matcher matcher = atomicTokens.matcher(text);
    matcher.region(start, text.length());
    int position = start;
    int used = 0;
    while (matcher.find()) {
      int plain = matcher.start() - position;
      if (used + plain >= budget) {
        return position + (budget - used);
      }
      used += plain;
      int weight = weight(matcher.group());
      if (used + weight > budget) {
        return matcher.start() > start ? matcher.start() : matcher.end();
      }
      used += weight;
      position = matcher.end();
    }
    return Math.min(text.length(), position + (budget - used));
  }

  /**
   * Returns the earliest position in {@code [from, end]} from which the measured length up to
   * {@code end} is at most {@code overlap}, never inside a token.
   */
  int tailStart(String text, int from, int end, int overlap) {
    List<int[]> tokens = new ArrayList<>();
    Matcher matcher = atomicTokens.matcher(text);
    matcher.region(from, end);
    while (matcher.find()) {
      tokens.add(new int[] {matcher.start(), matcher.end()});
    }

    int position = end;
    int used = 0;
    for (int i = tokens.size() - 1; i >= 0; i--) {
      int[] token = tokens.get(i);
      int plain = position - token[1];
      if (used + plain >= overlap) {
        return position - (overlap - used);
      }
      used += plain;
      int weight = weight(text.substring(token[0], token[1]));
      if (used + weight > overlap) {
        return token[1];
      }
      used += weight;
      position = token[0];
    }
    int plain = position - from;
    return used + plain >= overlap ? position - (overlap - used) : from;
  }

  private int weight(String token) {
    String block = blocks.get(token);
    if (block == null) {
      return token.length();
    }
    Integer cached = weights.get(token);
    if (cached == null) {
      cached = length(block);
      weights.put(token, cached);
    }
    return cached;
  }
}
