package com.flamingo.ai.techdocs.service.ingestion.chunking;

import com.flamingo.ai.techdocs.service.ingestion.model.Chunk;
import com.flamingo.ai.techdocs.service.ingestion.model.ExtractedContent;
import java.util.List;
import java.util.stream.Stream;

/**
 * Splits {@link ExtractedContent} into {@link Chunk}s ready for embedding.
 *
 * <p>Implementations must be stateless and safe for concurrent use: any per-document state lives
 * only for the duration of one call. A chunker only chunks; it does not extract or embed.
 */
public interface DocumentChunker {

  /**
   * Lazily produces the chunks of one document. Every call starts over and yields the same
   * sequence for the same input.
   *
   * @param content extracted document text and metadata
   * @return finite, ordered stream of chunks
   */
  Stream<Chunk> stream(ExtractedContent content);

  /**
   * Produces all chunks of one document.
   *
   * @param content extracted document text and metadata
   * @return ordered list of chunks
   */
  default List<Chunk> chunk(ExtractedContent content) {
    try (Stream<Chunk> chunks = stream(content)) {
      return chunks.toList();
    }
  }
}
