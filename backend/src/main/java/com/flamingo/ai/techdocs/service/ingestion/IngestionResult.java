package com.flamingo.ai.techdocs.service.ingestion;

import com.flamingo.ai.techdocs.service.ingestion.embedding.EmbeddedChunk;
import com.flamingo.ai.techdocs.service.ingestion.model.Chunk;
import com.flamingo.ai.techdocs.service.ingestion.quality.ChunkQualityReport;
import java.util.List;

/**
 * Outcome of ingesting one document.
 *
 * @param documentTitle title of the ingested document
 * @param chunks prefixed chunks in emission order
 * @param qualityReport quality summary of {@code chunks}
 * @param embeddedChunks chunks with vectors; empty when embedding is disabled
 */
public record IngestionResult(
    String documentTitle,
    List<Chunk> chunks,
    ChunkQualityReport qualityReport,
    List<EmbeddedChunk> embeddedChunks) {

  public boolean isEmbedded() {
    return !embeddedChunks.isEmpty();
  }
}
