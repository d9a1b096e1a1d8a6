package com.flamingo.ai.techdocs.service.ingestion.prefix;

import com.flamingo.ai.techdocs.exception.InvalidChunkingConfigException;

/**
 * Which fields go into a contextual prefix and how long it may get.
 *
 * @param includeSource emit the {@code <label>: <title>} line
 * @param includeChapter emit the {@code Chapter:} line
 * @param includeSection emit the {@code Section:} line
 * @param includePage emit the {@code Page:} line
 * @param separator line placed between the prefix and the chunk content
 * @param maxPrefixLength maximum length of the joined field lines, excluding the separator line
 */
public record ContextualPrefixConfig(
    boolean includeSource,
    boolean includeChapter,
    boolean includeSection,
    boolean includePage,
    String separator,
    int maxPrefixLength) {

  static final String ELLIPSIS = "...";

  public ContextualPrefixConfig {
    if (separator == null) {
      throw new InvalidChunkingConfigException("prefix separator must not be null");
    }
    if (maxPrefixLength <= ELLIPSIS.length()) {
      throw new InvalidChunkingConfigException(
          "maxPrefixLength must be greater than " + ELLIPSIS.length() + ", was " + maxPrefixLength);
    }
  }

  public static ContextualPrefixConfig defaults() {
    return new ContextualPrefixConfig(true, true, true, false, "---", 200);
  }
}
