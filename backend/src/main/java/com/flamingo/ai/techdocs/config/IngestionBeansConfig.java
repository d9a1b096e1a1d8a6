package com.flamingo.ai.techdocs.config;

import com.flamingo.ai.techdocs.service.ingestion.chunking.BoundarySplitter;
import com.flamingo.ai.techdocs.service.ingestion.chunking.ContentProtector;
import com.flamingo.ai.techdocs.service.ingestion.chunking.HardSplitter;
import com.flamingo.ai.techdocs.service.ingestion.model.ChunkingConfig;
import com.flamingo.ai.techdocs.service.ingestion.prefix.ContextualPrefixConfig;
import com.flamingo.ai.techdocs.service.ingestion.quality.ChunkQualityValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Turns the mutable {@link IngestionConfig} properties into the immutable settings used by the
 * pipeline. Inconsistent values fail here, at start-up, rather than in the middle of a run.
 */
@Configuration
public class IngestionBeansConfig {

  @Bean
  public ChunkingConfig chunkingConfig(IngestionConfig ingestionConfig) {
    IngestionConfig.Chunking chunking = ingestionConfig.getChunking();
    return new ChunkingConfig(chunking.getSize(), chunking.getOverlap(), chunking.getMinSize());
  }

  @Bean
  public ContextualPrefixConfig contextualPrefixConfig(IngestionConfig ingestionConfig) {
    IngestionConfig.ContextualPrefix prefix = ingestionConfig.getContextualPrefix();
    return new ContextualPrefixConfig(
        prefix.isIncludeSource(),
        prefix.isIncludeChapter(),
        prefix.isIncludeSection(),
        prefix.isIncludePage(),
        prefix.getSeparator(),
        prefix.getMaxLength());
  }

  @Bean
  public BoundarySplitter boundarySplitter() {
    return new BoundarySplitter(new HardSplitter(), ContentProtector.PLACEHOLDER_PATTERN);
  }

  @Bean
  public ChunkQualityValidator chunkQualityValidator(IngestionConfig ingestionConfig) {
    IngestionConfig.Quality quality = ingestionConfig.getQuality();
    return new ChunkQualityValidator(quality.getMinAverageScore(), quality.getMaxReportedIssues());
  }
}
