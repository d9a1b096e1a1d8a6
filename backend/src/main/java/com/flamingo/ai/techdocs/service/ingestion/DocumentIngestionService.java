package com.flamingo.ai.techdocs.service.ingestion;

import com.flamingo.ai.techdocs.service.ingestion.chunking.DocumentChunker;
import com.flamingo.ai.techdocs.service.ingestion.embedding.ChunkEmbeddingService;
import com.flamingo.ai.techdocs.service.ingestion.embedding.EmbeddedChunk;
import com.flamingo.ai.techdocs.service.ingestion.model.Chunk;
import com.flamingo.ai.techdocs.service.ingestion.model.ExtractedContent;
import com.flamingo.ai.techdocs.service.ingestion.prefix.BatchPrefixProcessor;
import com.flamingo.ai.techdocs.service.ingestion.quality.ChunkQualityReport;
import com.flamingo.ai.techdocs.service.ingestion.quality.ChunkQualityValidator;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Orchestrates ingestion of one extracted document: chunk, prefix, check quality and, when an
 * embedding backend is configured, embed.
 *
 * <p>Quality problems are logged and reported in the result; they never abort ingestion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionService {

  private final DocumentChunker chunker;
  private final BatchPrefixProcessor prefixProcessor;
  private final ChunkQualityValidator qualityValidator;
  private final ObjectProvider<ChunkEmbeddingService> embeddingService;
  private final MeterRegistry meterRegistry;

  @Timed(value = "document.ingest", description = "Time to chunk, prefix and embed a document")
  public IngestionResult ingest(ExtractedContent content) {
    String title = content.document().title();

    List<Chunk> chunks = prefixProcessor.processBatch(chunker.chunk(content));
    if (chunks.isEmpty()) {
      log.warn("Document '{}' produced no chunks", title);
      meterRegistry.counter("ingestion.documents.empty").increment();
    } else {
      meterRegistry.counter("ingestion.chunks.created").increment(chunks.size());
    }

    ChunkQualityReport report = qualityValidator.validateBatch(chunks);
    if (!chunks.isEmpty() && !report.passed()) {
      log.warn(
          "Chunk quality below threshold for '{}': average {}, {} of {} chunks with issues",
          title,
          report.averageQualityScore(),
          report.chunksWithIssues(),
          report.totalChunks());
      meterRegistry.counter("ingestion.quality.failed").increment();
    }

    ChunkEmbeddingService embedder = embeddingService.getIfAvailable();
    List<EmbeddedChunk> embedded =
        embedder != null && !chunks.isEmpty() ? embedder.embedChunks(chunks) : List.of();

    BatchPrefixProcessor.Stats prefixStats = prefixProcessor.stats();
    log.info(
        "Ingested '{}': {} chunks, average quality {}, {} embedded, prefixes {} added / {} kept",
        title,
        chunks.size(),
        report.averageQualityScore(),
        embedded.size(),
        prefixStats.prefixAdded(),
        prefixStats.withExistingPrefix());
    return new IngestionResult(title, chunks, report, embedded);
  }
}
