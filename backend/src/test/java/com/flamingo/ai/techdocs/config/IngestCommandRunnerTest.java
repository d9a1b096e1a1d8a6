package com.flamingo.ai.techdocs.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.techdocs.exception.DocumentProcessingException;
import com.flamingo.ai.techdocs.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.techdocs.service.ingestion.ExtractedContentFactory;
import com.flamingo.ai.techdocs.service.ingestion.IngestionResult;
import com.flamingo.ai.techdocs.service.ingestion.model.Chunk;
import com.flamingo.ai.techdocs.service.ingestion.model.ExtractedContent;
import com.flamingo.ai.techdocs.service.ingestion.model.SourceType;
import com.flamingo.ai.techdocs.service.ingestion.prefix.BatchPrefixProcessor;
import com.flamingo.ai.techdocs.service.ingestion.prefix.ContextualPrefixBuilder;
import com.flamingo.ai.techdocs.service.ingestion.prefix.ContextualPrefixConfig;
import com.flamingo.ai.techdocs.service.ingestion.quality.ChunkQualityValidator;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IngestCommandRunnerTest {

  @Mock private DocumentIngestionService ingestionService;

  @Captor private ArgumentCaptor<ExtractedContent> contentCaptor;

  @TempDir Path tempDir;

  private IngestionConfig ingestionConfig;
  private BatchPrefixProcessor prefixProcessor;
  private IngestCommandRunner runner;

  @BeforeEach
  void setUp() {
    ingestionConfig = new IngestionConfig();
    prefixProcessor =
        new BatchPrefixProcessor(new ContextualPrefixBuilder(ContextualPrefixConfig.defaults()));
    runner =
        new IngestCommandRunner(
            ingestionConfig, new ExtractedContentFactory(), ingestionService, prefixProcessor);
  }

  private void stubEmptyResult() {
    when(ingestionService.ingest(any()))
        .thenReturn(
            new IngestionResult(
                "art of memory",
                List.of(),
                new ChunkQualityValidator().validateBatch(List.of()),
                List.of()));
  }

  private Path writeInput() throws Exception {
    Path input = tempDir.resolve("art_of-memory.md");
    Files.writeString(input, "# Processes\nProcess listing.\n", StandardCharsets.UTF_8);
    ingestionConfig.getCli().setInput(input.toString());
    return input;
  }

  @Test
  void shouldDoNothing_whenNoInputConfigured() {
    runner.run();

    verifyNoInteractions(ingestionService);
  }

  @Test
  void shouldIngestFile_whenInputConfigured() throws Exception {
    writeInput();
    stubEmptyResult();

    runner.run();

    verify(ingestionService).ingest(contentCaptor.capture());
    ExtractedContent content = contentCaptor.getValue();
    assertThat(content.document().title()).isEqualTo("art of memory");
    assertThat(content.document().chapters()).containsExactly("Processes");
    assertThat(content.document().sourceType()).isEqualTo(SourceType.BOOK);
    assertThat(content.markdownContent()).isEqualTo("# Processes\nProcess listing.\n");
  }

  @Test
  void shouldTagDocumentWithConfiguredSourceType_whenSourceTypeSet() throws Exception {
    writeInput();
    ingestionConfig.getCli().setSourceType(" Procedure ");
    stubEmptyResult();

    runner.run();

    verify(ingestionService).ingest(contentCaptor.capture());
    assertThat(contentCaptor.getValue().document().sourceType())
        .isEqualTo(SourceType.PROCEDURE);
  }

  @Test
  void shouldFallBackToBook_whenSourceTypeUnknown() throws Exception {
    writeInput();
    ingestionConfig.getCli().setSourceType("wiki");
    stubEmptyResult();

    runner.run();

    verify(ingestionService).ingest(contentCaptor.capture());
    assertThat(contentCaptor.getValue().document().sourceType()).isEqualTo(SourceType.BOOK);
  }

  @Test
  void shouldResetPrefixStats_beforeIngesting() throws Exception {
    Chunk earlier =
        new Chunk("earlier_0000", "Earlier body.", "", null, "Earlier", null, null, null, 0);
    prefixProcessor.processBatch(List.of(earlier));
    assertThat(prefixProcessor.stats().totalProcessed()).isEqualTo(1);
    writeInput();
    stubEmptyResult();

    runner.run();

    assertThat(prefixProcessor.stats()).isEqualTo(new BatchPrefixProcessor.Stats(0, 0, 0));
  }

  @Test
  void shouldFailWithDocumentProcessingException_whenFileMissing() {
    ingestionConfig.getCli().setInput(tempDir.resolve("missing.md").toString());
    ingestionConfig.getCli().setTitle("Missing Book");

    assertThatThrownBy(() -> runner.run())
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageContaining("Cannot read");
    verifyNoInteractions(ingestionService);
  }

  @Test
  void shouldPreferConfiguredTitle_whenResolvingTitle() {
    ingestionConfig.getCli().setTitle("  Windows Internals ");

    assertThat(runner.resolveTitle(Path.of("wi_7th.md"))).isEqualTo("Windows Internals");
  }

  @Test
  void shouldDeriveTitleFromFileName_whenNoTitleConfigured() {
    assertThat(runner.resolveTitle(Path.of("/books/windows_internals-part1.md")))
        .isEqualTo("windows internals part1");
    assertThat(runner.resolveTitle(Path.of("README"))).isEqualTo("README");
  }
}
