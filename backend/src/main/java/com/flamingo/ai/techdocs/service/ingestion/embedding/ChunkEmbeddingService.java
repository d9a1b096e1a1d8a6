package com.flamingo.ai.techdocs.service.ingestion.embedding;

import com.flamingo.ai.techdocs.config.IngestionConfig;
import com.flamingo.ai.techdocs.exception.DocumentProcessingException;
import com.flamingo.ai.techdocs.service.ingestion.model.Chunk;
import com.flamingo.ai.techdocs.service.ingestion.prefix.BatchPrefixProcessor;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Hands chunks to the embedding backend. The text embedded for each chunk is its contextual prefix
 * followed by its content.
 */
@Service
@ConditionalOnProperty(prefix = "ingestion.embedding", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ChunkEmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final BatchPrefixProcessor prefixProcessor;
  private final IngestionConfig ingestionConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds the given chunks in batches.
   *
   * @param chunks chunks of one document
   * @return one {@link EmbeddedChunk} per input chunk, in input order
   * @throws DocumentProcessingException if the backend fails or returns a short response
   */
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedChunksFallback")
  @Retry(name = "embedding")
  public List<EmbeddedChunk> embedChunks(List<Chunk> chunks) {
    if (chunks.isEmpty()) {
      return List.of();
    }
    int batchSize = Math.max(1, ingestionConfig.getEmbedding().getBatchSize());
    String documentTitle = chunks.get(0).bookTitle();

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<EmbeddedChunk> results = new ArrayList<>(chunks.size());
      for (int from = 0; from < chunks.size(); from += batchSize) {
        List<Chunk> batch = chunks.subList(from, Math.min(from + batchSize, chunks.size()));
        List<TextSegment> segments = toSegments(batch);

        Response<List<Embedding>> response = embeddingModel.embedAll(segments);
        List<Embedding> embeddings = response.content();
        if (embeddings == null || embeddings.size() != batch.size()) {
          throw new DocumentProcessingException(
              documentTitle,
              "Embedding backend returned "
                  + (embeddings == null ? 0 : embeddings.size())
                  + " vectors for "
                  + batch.size()
                  + " chunks");
        }
        for (int i = 0; i < batch.size(); i++) {
          results.add(new EmbeddedChunk(batch.get(i), embeddings.get(i).vectorAsList()));
        }
        log.debug("Embedded chunks {}-{} of {}", from, from + batch.size() - 1, documentTitle);
      }
      meterRegistry.counter("embedding.requests.success").increment();
      return results;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  private List<TextSegment> toSegments(List<Chunk> batch) {
    List<String> texts = prefixProcessor.embeddingTexts(batch);
    int maxChars = ingestionConfig.getEmbedding().getMaxChars();
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i);
      if (text.length() > maxChars) {
        log.warn(
            "Chunk {} too long for embedding, truncating from {} chars to {} chars",
            batch.get(i).chunkId(),
            text.length(),
            maxChars);
        text = text.substring(0, maxChars);
      }
      segments.add(TextSegment.from(text));
    }
    return segments;
  }

  @SuppressWarnings("unused")
  private List<EmbeddedChunk> embedChunksFallback(List<Chunk> chunks, Throwable t) {
    log.error("Embedding failed for {} chunks: {}", chunks.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    if (t instanceof DocumentProcessingException processingException) {
      throw processingException;
    }
    String title = chunks.isEmpty() ? null : chunks.get(0).bookTitle();
    throw new DocumentProcessingException(title, "Embedding backend unavailable", t);
  }
}
