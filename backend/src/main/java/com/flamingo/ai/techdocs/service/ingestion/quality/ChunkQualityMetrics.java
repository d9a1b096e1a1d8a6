package com.flamingo.ai.techdocs.service.ingestion.quality;

import java.util.List;

/**
 * Result of checking a single chunk.
 *
 * @param completeSentence {@code false} if the chunk appears to end mid-sentence
 * @param splitCodeBlock {@code true} if the chunk holds an odd number of code fences
 * @param splitTable {@code true} if the chunk starts inside a table
 * @param garbageChars {@code true} if control characters are present
 * @param qualityScore score in {@code [0.0, 1.0]}
 * @param issues human-readable descriptions of each detected problem
 */
public record ChunkQualityMetrics(
    boolean completeSentence,
    boolean splitCodeBlock,
    boolean splitTable,
    boolean garbageChars,
    double qualityScore,
    List<String> issues) {

  public ChunkQualityMetrics {
    issues = List.copyOf(issues);
  }

  public boolean hasIssues() {
    return !issues.isEmpty();
  }
}
