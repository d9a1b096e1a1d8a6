package com.flamingo.ai.techdocs.service.ingestion.chunking;

import com.flamingo.ai.techdocs.service.ingestion.model.ChunkMetadata;

/**
 * The chapter and section enclosing the current position in a document.
 *
 * <p>Folded forward chunk by chunk: a chunk without its own header inherits the previous values, a
 * chunk with a header replaces them for every chunk that follows.
 *
 * @param chapter most recent chapter, or {@code null}
 * @param section most recent section, or {@code null}
 */
public record RunningContext(String chapter, String section) {

  private static final RunningContext EMPTY = new RunningContext(null, null);

  public static RunningContext empty() {
    return EMPTY;
  }

  public RunningContext advance(ChunkMetadata metadata) {
    String nextChapter = metadata.chapter() != null ? metadata.chapter() : chapter;
    String nextSection = metadata.section() != null ? metadata.section() : section;
    return new RunningContext(nextChapter, nextSection);
  }
}
