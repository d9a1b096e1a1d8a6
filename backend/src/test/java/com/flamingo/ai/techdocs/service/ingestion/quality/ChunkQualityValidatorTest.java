package com.flamingo.ai.techdocs.service.ingestion.quality;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.techdocs.service.ingestion.model.Chunk;
import com.flamingo.ai.techdocs.service.ingestion.model.SourceType;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkQualityValidator Tests")
class ChunkQualityValidatorTest {

  private final ChunkQualityValidator validator = new ChunkQualityValidator();

  private static Chunk chunk(String id, String content) {
    return new Chunk(id, content, "", SourceType.BOOK, "Book", null, null, null, 0);
  }

  @Nested
  @DisplayName("validate")
  class Validate {

    @Test
    @DisplayName("should give a clean chunk the full score")
    void shouldScoreCleanChunk() {
      ChunkQualityMetrics metrics = validator.validate(chunk("c0", "A complete sentence."));

      assertThat(metrics.qualityScore()).isEqualTo(1.0);
      assertThat(metrics.hasIssues()).isFalse();
      assertThat(metrics.completeSentence()).isTrue();
    }

    @Test
    @DisplayName("should accept code fences, table rows and colons as complete endings")
    void shouldAcceptStructuralEndings() {
      assertThat(validator.validate(chunk("c0", "Run this:")).completeSentence()).isTrue();
      assertThat(validator.validate(chunk("c1", "```\nls\n```")).completeSentence()).isTrue();
      assertThat(validator.validate(chunk("c2", "Is it?")).completeSentence()).isTrue();
    }

    @Test
    @DisplayName("should penalise a chunk that ends mid-sentence")
    void shouldPenaliseTruncation() {
      ChunkQualityMetrics metrics = validator.validate(chunk("c0", "The process then"));

      assertThat(metrics.completeSentence()).isFalse();
      assertThat(metrics.qualityScore()).isCloseTo(0.9, within(1e-9));
      assertThat(metrics.issues()).containsExactly("Chunk may end mid-sentence");
    }

    @Test
    @DisplayName("should flag an odd number of code fences with a score of at most 0.7")
    void shouldFlagSplitCodeBlock() {
      ChunkQualityMetrics metrics = validator.validate(chunk("c0", "```\nvol.py -f mem.raw\n"));

      assertThat(metrics.splitCodeBlock()).isTrue();
      assertThat(metrics.qualityScore()).isLessThanOrEqualTo(0.7);
      assertThat(metrics.issues()).contains("Code block may be split");
    }

    @Test
    @DisplayName("should flag a chunk starting with a table row but lacking a separator row")
    void shouldFlagSplitTable() {
      ChunkQualityMetrics split = validator.validate(chunk("c0", "| 1 | 2 |\n| 3 | 4 |"));
      ChunkQualityMetrics whole =
          validator.validate(chunk("c1", "| a | b |\n|---|---|\n| 1 | 2 |"));

      assertThat(split.splitTable()).isTrue();
      assertThat(split.qualityScore()).isCloseTo(0.8, within(1e-9));
      assertThat(whole.splitTable()).isFalse();
    }

    @Test
    @DisplayName("should flag control characters as garbage")
    void shouldFlagGarbage() {
      ChunkQualityMetrics metrics = validator.validate(chunk("c0", "Broken \u0007 text."));

      assertThat(metrics.garbageChars()).isTrue();
      assertThat(metrics.qualityScore()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    @DisplayName("should apply every penalty when every check fails")
    void shouldApplyAllPenalties() {
      ChunkQualityMetrics metrics = validator.validate(chunk("c0", "| x ```\u0001 y"));

      assertThat(metrics.issues()).hasSize(4);
      assertThat(metrics.qualityScore()).isCloseTo(0.2, within(1e-9));
    }
  }

  @Nested
  @DisplayName("validateBatch")
  class ValidateBatch {

    @Test
    @DisplayName("should aggregate scores and pass when the mean reaches the threshold")
    void shouldAggregateBatch() {
      List<Chunk> chunks =
          List.of(
              chunk("c0", "Complete."),
              chunk("c1", "Complete too."),
              chunk("c2", "Also complete!"),
              chunk("c3", "Ends without punctuation"));

      ChunkQualityReport report = validator.validateBatch(chunks);

      assertThat(report.totalChunks()).isEqualTo(4);
      assertThat(report.averageQualityScore()).isEqualTo(0.975);
      assertThat(report.chunksWithIssues()).isEqualTo(1);
      assertThat(report.issueRate()).isEqualTo(25.0);
      assertThat(report.issues()).hasSize(1);
      assertThat(report.issues().get(0).chunkId()).isEqualTo("c3");
      assertThat(report.issues().get(0).score()).isCloseTo(0.9, within(1e-9));
      assertThat(report.passed()).isTrue();
    }

    @Test
    @DisplayName("should fail when the mean falls below the threshold")
    void shouldFailBelowThreshold() {
      ChunkQualityReport report =
          validator.validateBatch(List.of(chunk("c0", "```\nunterminated"), chunk("c1", "Fine.")));

      assertThat(report.passed()).isFalse();
      assertThat(report.averageQualityScore()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("should cap the number of reported issues")
    void shouldCapReportedIssues() {
      List<Chunk> chunks = new ArrayList<>();
      for (int i = 0; i < 30; i++) {
        chunks.add(chunk("c" + i, "no ending " + i));
      }

      ChunkQualityReport report = validator.validateBatch(chunks);

      assertThat(report.chunksWithIssues()).isEqualTo(30);
      assertThat(report.issues()).hasSize(20);
      assertThat(report.issues().get(0).chunkId()).isEqualTo("c0");
      assertThat(report.issueRate()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("should honour a custom threshold and cap")
    void shouldHonourCustomSettings() {
      ChunkQualityValidator strict = new ChunkQualityValidator(0.95, 1);

      ChunkQualityReport report =
          strict.validateBatch(List.of(chunk("c0", "no ending"), chunk("c1", "still none")));

      assertThat(report.issues()).hasSize(1);
      assertThat(report.passed()).isFalse();
    }

    @Test
    @DisplayName("should report an empty batch as not passed")
    void shouldNotPassEmptyBatch() {
      ChunkQualityReport report = validator.validateBatch(List.of());

      assertThat(report.totalChunks()).isZero();
      assertThat(report.averageQualityScore()).isEqualTo(0.0);
      assertThat(report.issueRate()).isEqualTo(0.0);
      assertThat(report.issues()).isEmpty();
      assertThat(report.passed()).isFalse();
    }
  }
}
