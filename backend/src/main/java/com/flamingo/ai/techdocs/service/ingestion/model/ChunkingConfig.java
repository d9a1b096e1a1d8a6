package com.flamingo.ai.techdocs.service.ingestion.model;

import com.flamingo.ai.techdocs.exception.InvalidChunkingConfigException;

/**
 * Chunk sizing in approximate tokens. Character budgets are derived with a fixed ratio of {@value
 * #CHARS_PER_TOKEN} characters per token.
 *
 * @param chunkSize target chunk size in tokens
 * @param chunkOverlap overlap between consecutive chunks in tokens; strictly less than {@code
 *     chunkSize}
 * @param minChunkSize chunks shorter than this (after trimming) are discarded
 */
public record ChunkingConfig(int chunkSize, int chunkOverlap, int minChunkSize) {

  public static final int CHARS_PER_TOKEN = 4;

  public static final int DEFAULT_CHUNK_SIZE = 512;
  public static final int DEFAULT_CHUNK_OVERLAP = 100;
  public static final int DEFAULT_MIN_CHUNK_SIZE = 100;

  public ChunkingConfig {
    if (chunkSize <= 0) {
      throw new InvalidChunkingConfigException("chunkSize must be positive, was " + chunkSize);
    }
    if (chunkOverlap < 0) {
      throw new InvalidChunkingConfigException(
          "chunkOverlap must not be negative, was " + chunkOverlap);
    }
    if (chunkOverlap >= chunkSize) {
      throw new InvalidChunkingConfigException(
          "chunkOverlap (" + chunkOverlap + ") must be less than chunkSize (" + chunkSize + ")");
    }
    if (minChunkSize < 0) {
      throw new InvalidChunkingConfigException(
          "minChunkSize must not be negative, was " + minChunkSize);
    }
  }

  public static ChunkingConfig defaults() {
    return new ChunkingConfig(DEFAULT_CHUNK_SIZE, DEFAULT_CHUNK_OVERLAP, DEFAULT_MIN_CHUNK_SIZE);
  }

  public int chunkSizeChars() {
    return chunkSize * CHARS_PER_TOKEN;
  }

  public int chunkOverlapChars() {
    return chunkOverlap * CHARS_PER_TOKEN;
  }

  public int minChunkSizeChars() {
    return minChunkSize * CHARS_PER_TOKEN;
  }
}
