package com.flamingo.ai.techdocs.service.ingestion.model;

/**
 * Structural hints detected in the text of a single chunk. Not persisted.
 *
 * @param chapter first level-1 header title, or {@code null}
 * @param section first level-2 header title, or {@code null}
 * @param subsection first level-3 header title, or {@code null}
 * @param hasCode whether a code fence marker is present
 * @param hasTable whether a markdown table header-separator row is present
 * @param hasCommand whether command-like text was recognised
 */
public record ChunkMetadata(
    String chapter,
    String section,
    String subsection,
    boolean hasCode,
    boolean hasTable,
    boolean hasCommand) {

  public static ChunkMetadata empty() {
    return new ChunkMetadata(null, null, null, false, false, false);
  }
}
