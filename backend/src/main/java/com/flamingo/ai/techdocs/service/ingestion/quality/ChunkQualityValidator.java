package com.flamingo.ai.techdocs.service.ingestion.quality;

import com.flamingo.ai.techdocs.service.ingestion.model.Chunk;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Post-hoc checks on finished chunks. Problems are reported as scores and issue lists, never
 * thrown; gating on the report is left to the caller.
 */
@Slf4j
public class ChunkQualityValidator {

  public static final double DEFAULT_MIN_AVERAGE_SCORE = 0.9;
  public static final int DEFAULT_MAX_REPORTED_ISSUES = 20;

  static final double TRUNCATION_PENALTY = 0.1;
  static final double SPLIT_CODE_PENALTY = 0.3;
  static final double SPLIT_TABLE_PENALTY = 0.2;
  static final double GARBAGE_PENALTY = 0.2;

  private static final String CODE_FENCE = "```";
  private static final List<String> COMPLETE_ENDINGS =
      List.of(".", "!", "?", ":", CODE_FENCE, "|");
  private static final Pattern GARBAGE =
      Pattern.compile("[\\x00-\\x08\\x0b\\x0c\\x0e-\\x1f\\x7f-\\x9f]");

  private final double minAverageScore;
  private final int maxReportedIssues;

  public ChunkQualityValidator() {
    this(DEFAULT_MIN_AVERAGE_SCORE, DEFAULT_MAX_REPORTED_ISSUES);
  }

  public ChunkQualityValidator(double minAverageScore, int maxReportedIssues) {
    this.minAverageScore = minAverageScore;
    this.maxReportedIssues = maxReportedIssues;
  }

  public ChunkQualityMetrics validate(Chunk chunk) {
    String content = chunk.content();
    List<String> issues = new ArrayList<>();

    String tail = content.stripTrailing();
    boolean completeSentence =
        content.isEmpty() || COMPLETE_ENDINGS.stream().anyMatch(tail::endsWith);
    if (!completeSentence) {
      issues.add("Chunk may end mid-sentence");
    }

    boolean splitCodeBlock = countOccurrences(content, CODE_FENCE) % 2 != 0;
    if (splitCodeBlock) {
      issues.add("Code block may be split");
    }

    boolean splitTable = content.trim().startsWith("|") && !content.contains("|---|");
    if (splitTable) {
      issues.add("Table may be split");
    }

    boolean garbageChars = GARBAGE.matcher(content).find();
    if (garbageChars) {
      issues.add("Contains garbage characters");
    }

    double score = 1.0;
    if (!completeSentence) {
      score -= TRUNCATION_PENALTY;
    }
    if (splitCodeBlock) {
      score -= SPLIT_CODE_PENALTY;
    }
    if (splitTable) {
      score -= SPLIT_TABLE_PENALTY;
    }
    if (garbageChars) {
      score -= GARBAGE_PENALTY;
    }

    return new ChunkQualityMetrics(
        completeSentence, splitCodeBlock, splitTable, garbageChars, Math.max(0.0, score), issues);
  }

  public ChunkQualityReport validateBatch(List<Chunk> chunks) {
    int total = chunks.size();
    List<ChunkQualityReport.ChunkIssue> issues = new ArrayList<>();
    double totalScore = 0.0;

    for (Chunk chunk : chunks) {
      ChunkQualityMetrics metrics = validate(chunk);
      totalScore += metrics.qualityScore();
      if (metrics.hasIssues()) {
        issues.add(
            new ChunkQualityReport.ChunkIssue(
                chunk.chunkId(), metrics.issues(), metrics.qualityScore()));
      }
    }

    double average = total > 0 ? totalScore / total : 0.0;
    double issueRate = total > 0 ? round(issues.size() * 100.0 / total, 1) : 0.0;
    boolean passed = average >= minAverageScore;

    log.debug(
        "Validated {} chunks: average score {}, {} with issues", total, average, issues.size());

    return new ChunkQualityReport(
        total,
        round(average, 3),
        issues.size(),
        issueRate,
        List.copyOf(issues.subList(0, Math.min(maxReportedIssues, issues.size()))),
        passed);
  }

  private static int countOccurrences(String text, String token) {
    int count = 0;
    int from = 0;
    int at;
    while ((at = text.indexOf(token, from)) >= 0) {
      count++;
      from = at + token.length();
    }
    return count;
  }

  private static double round(double value, int decimals) {
    double factor = Math.pow(10, decimals);
    return Math.round(value * factor) / factor;
  }
}
