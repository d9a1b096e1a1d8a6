package com.flamingo.ai.techdocs.service.ingestion.embedding;

import com.flamingo.ai.techdocs.service.ingestion.model.Chunk;
import java.util.List;

/**
 * A chunk paired with the vector computed from its prefixed text, ready for a vector-store upsert.
 *
 * @param chunk the embedded chunk
 * @param embedding the embedding vector
 */
public record EmbeddedChunk(Chunk chunk, List<Float> embedding) {

  public EmbeddedChunk {
    embedding = List.copyOf(embedding);
  }
}
