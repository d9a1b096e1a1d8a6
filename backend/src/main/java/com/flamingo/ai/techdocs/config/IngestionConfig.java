package com.flamingo.ai.techdocs.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "ingestion")
@Getter
@Setter
public class IngestionConfig {

  private Chunking chunking = new Chunking();
  private ContextualPrefix contextualPrefix = new ContextualPrefix();
  private Quality quality = new Quality();
  private Embedding embedding = new Embedding();
  private Cli cli = new Cli();

  /** Chunk sizing in approximate tokens (4 characters per token). */
  @Getter
  @Setter
  public static class Chunking {
    private int size = 512;
    private int overlap = 100;

    /** Chunks shorter than this many tokens after trimming are dropped. */
    private int minSize = 100;
  }

  /**
   * Contextual prefix prepended to each chunk before embedding (Anthropic's contextual retrieval
   * technique).
   */
  @Getter
  @Setter
  public static class ContextualPrefix {
    private boolean includeSource = true;
    private boolean includeChapter = true;
    private boolean includeSection = true;
    private boolean includePage = false;
    private String separator = "---";

    /** Maximum characters of the joined prefix lines; longer prefixes end in "...". */
    private int maxLength = 200;
  }

  @Getter
  @Setter
  public static class Quality {
    /** Minimum mean chunk score for a batch to pass. */
    private double minAverageScore = 0.9;

    private int maxReportedIssues = 20;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Whether ingested chunks are sent to the embedding model. Disabled by default. */
    private boolean enabled = false;

    private int batchSize = 32;

    /** Texts longer than this are truncated before embedding. */
    private int maxChars = 8000;
  }

  /** Settings for ingesting a markdown file on start-up. */
  @Getter
  @Setter
  public static class Cli {
    /** Markdown file to ingest; nothing happens when unset. */
    private String input;

    /** Document title; defaults to the file name without extension. */
    private String title;

    /** Source kind tag (book, doc, org, procedure); unknown tags fall back to book. */
    private String sourceType = "book";
  }
}
