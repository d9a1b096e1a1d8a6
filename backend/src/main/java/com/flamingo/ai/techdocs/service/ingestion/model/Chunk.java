package com.flamingo.ai.techdocs.service.ingestion.model;

/**
 * A unit of document text ready for embedding and indexing.
 *
 * <p>Chunks are created once by the chunking pipeline and never mutated; {@link
 * #withContextualPrefix(String)} returns a new value.
 *
 * @param chunkId identifier unique within a document, e.g. {@code windows_internals_0007}
 * @param content trimmed chunk text
 * @param contextualPrefix descriptive header prepended before embedding; empty when not yet built
 * @param sourceType kind of source the chunk belongs to
 * @param bookTitle title of the owning document
 * @param chapter enclosing chapter, or {@code null}
 * @param section enclosing section, or {@code null}
 * @param page estimated page number, or {@code null}
 * @param chunkIndex zero-based emission order within the document
 */
public record Chunk(
    String chunkId,
    String content,
    String contextualPrefix,
    SourceType sourceType,
    String bookTitle,
    String chapter,
    String section,
    Integer page,
    int chunkIndex) {

  public Chunk {
    if (content == null || content.isBlank()) {
      throw new IllegalArgumentException("Chunk content must not be blank");
    }
    contextualPrefix = contextualPrefix == null ? "" : contextualPrefix;
    sourceType = sourceType == null ? SourceType.BOOK : sourceType;
  }

  public boolean hasContextualPrefix() {
    return !contextualPrefix.isEmpty();
  }

  public Chunk withContextualPrefix(String prefix) {
    return new Chunk(
        chunkId, content, prefix, sourceType, bookTitle, chapter, section, page, chunkIndex);
  }
}
