package com.flamingo.ai.techdocs.config;

import com.flamingo.ai.techdocs.exception.DocumentProcessingException;
import com.flamingo.ai.techdocs.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.techdocs.service.ingestion.ExtractedContentFactory;
import com.flamingo.ai.techdocs.service.ingestion.IngestionResult;
import com.flamingo.ai.techdocs.service.ingestion.model.ExtractedContent;
import com.flamingo.ai.techdocs.service.ingestion.model.SourceType;
import com.flamingo.ai.techdocs.service.ingestion.prefix.BatchPrefixProcessor;
import com.flamingo.ai.techdocs.service.ingestion.quality.ChunkQualityReport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Start-up runner that ingests one markdown file named by {@code ingestion.cli.input}.
 *
 * <p>The file is read as already-extracted markdown; PDF extraction happens upstream. Does nothing
 * when no input is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestCommandRunner implements CommandLineRunner {

  private final IngestionConfig ingestionConfig;
  private final ExtractedContentFactory contentFactory;
  private final DocumentIngestionService ingestionService;
  private final BatchPrefixProcessor prefixProcessor;

  @Override
  public void run(String... args) {
    String input = ingestionConfig.getCli().getInput();
    if (input == null || input.isBlank()) {
      log.debug("No ingestion.cli.input configured, skipping start-up ingestion");
      return;
    }

    Path path = Path.of(input);
    String title = resolveTitle(path);
    SourceType sourceType = SourceType.fromTag(ingestionConfig.getCli().getSourceType());
    log.info("Ingesting {} as '{}' ({})", path, title, sourceType.getTag());

    String markdown;
    try {
      markdown = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          title, "Cannot read " + path + ": " + e.getMessage(), e);
    }

    ExtractedContent content =
        contentFactory.fromMarkdown(title, path.toString(), markdown, sourceType);
    prefixProcessor.resetStats();
    IngestionResult result = ingestionService.ingest(content);
    ChunkQualityReport report = result.qualityReport();
    BatchPrefixProcessor.Stats prefixStats = prefixProcessor.stats();

    log.info(
        "Ingestion of '{}' complete: {} chunks, {} pages, {} chapters, quality {} ({})",
        title,
        result.chunks().size(),
        content.document().totalPages(),
        content.document().chapters().size(),
        report.averageQualityScore(),
        report.passed() ? "passed" : "failed");
    log.info(
        "Contextual prefixes: {} processed, {} added, {} already present",
        prefixStats.totalProcessed(),
        prefixStats.prefixAdded(),
        prefixStats.withExistingPrefix());
    for (ChunkQualityReport.ChunkIssue issue : report.issues()) {
      log.info("  {} (score {}): {}", issue.chunkId(), issue.score(), issue.issues());
    }
  }

  String resolveTitle(Path path) {
    String configured = ingestionConfig.getCli().getTitle();
    if (configured != null && !configured.isBlank()) {
      return configured.trim();
    }
    String fileName = path.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String base = dot > 0 ? fileName.substring(0, dot) : fileName;
    return base.replace('_', ' ').replace('-', ' ').trim();
  }
}
