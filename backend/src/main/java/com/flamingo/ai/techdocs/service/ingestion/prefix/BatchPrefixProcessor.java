package com.flamingo.ai.techdocs.service.ingestion.prefix;

import com.flamingo.ai.techdocs.service.ingestion.model.Chunk;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Adds contextual prefixes to batches of chunks and keeps running statistics. */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchPrefixProcessor {

  private final ContextualPrefixBuilder prefixBuilder;

  private final AtomicLong totalProcessed = new AtomicLong();
  private final AtomicLong withExistingPrefix = new AtomicLong();
  private final AtomicLong prefixAdded = new AtomicLong();

  /**
   * Snapshot of the processor counters.
   *
   * @param totalProcessed chunks seen since the last reset
   * @param withExistingPrefix chunks that already carried a prefix
   * @param prefixAdded chunks that received a new prefix
   */
  public record Stats(long totalProcessed, long withExistingPrefix, long prefixAdded) {}

  public List<Chunk> processBatch(List<Chunk> chunks) {
    return processBatch(chunks, true);
  }

  public List<Chunk> processBatch(List<Chunk> chunks, boolean updateStats) {
    List<Chunk> processed = new ArrayList<>(chunks.size());
    for (Chunk chunk : chunks) {
      boolean hadPrefix = chunk.hasContextualPrefix();
      processed.add(prefixBuilder.preprocess(chunk));

      if (updateStats) {
        totalProcessed.incrementAndGet();
        if (hadPrefix) {
          withExistingPrefix.incrementAndGet();
        } else {
          prefixAdded.incrementAndGet();
        }
      }
    }
    log.debug("Prefixed batch of {} chunks", chunks.size());
    return processed;
  }

  public List<String> embeddingTexts(List<Chunk> chunks) {
    return chunks.stream().map(prefixBuilder::textForEmbedding).toList();
  }

  public Stats stats() {
    return new Stats(totalProcessed.get(), withExistingPrefix.get(), prefixAdded.get());
  }

  public void resetStats() {
    totalProcessed.set(0);
    withExistingPrefix.set(0);
    prefixAdded.set(0);
  }
}
