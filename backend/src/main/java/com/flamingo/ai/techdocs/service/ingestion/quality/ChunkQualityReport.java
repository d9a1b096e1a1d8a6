package com.flamingo.ai.techdocs.service.ingestion.quality;

import java.util.List;

/**
 * Quality summary for a batch of chunks.
 *
 * @param totalChunks number of chunks checked
 * @param averageQualityScore mean score rounded to three decimals
 * @param chunksWithIssues chunks with at least one issue
 * @param issueRate percentage of chunks with issues, one decimal
 * @param issues the first problem chunks, capped for reporting
 * @param passed whether the mean score reached the threshold
 */
public record ChunkQualityReport(
    int totalChunks,
    double averageQualityScore,
    int chunksWithIssues,
    double issueRate,
    List<ChunkIssue> issues,
    boolean passed) {

  /**
   * Problems found in one chunk.
   *
   * @param chunkId id of the chunk
   * @param issues issue descriptions
   * @param score the chunk's quality score
   */
  public record ChunkIssue(String chunkId, List<String> issues, double score) {}
}
