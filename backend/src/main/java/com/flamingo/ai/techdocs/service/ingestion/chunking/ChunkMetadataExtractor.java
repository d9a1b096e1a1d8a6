package com.flamingo.ai.techdocs.service.ingestion.chunking;

import com.flamingo.ai.techdocs.service.ingestion.model.ChunkMetadata;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Detects header lines and content types in a restored chunk.
 *
 * <p>Level-1 headers are chapters, level-2 headers sections and level-3 headers subsections; only
 * the first header of each level is reported.
 */
@Component
public class ChunkMetadataExtractor {

  private static final Pattern H1 = Pattern.compile("^#\\s+(.+?)$", Pattern.MULTILINE);
  private static final Pattern H2 = Pattern.compile("^##\\s+(.+?)$", Pattern.MULTILINE);
  private static final Pattern H3 = Pattern.compile("^###\\s+(.+?)$", Pattern.MULTILINE);

  // Volatility invocations are the command syntax found in the memory-forensics books
  private static final Pattern COMMAND =
      Pattern.compile("vol\\.py|vol\\s+-f|volatility", Pattern.CASE_INSENSITIVE);

  public ChunkMetadata extract(String chunk) {
    return new ChunkMetadata(
        firstHeader(H1, chunk),
        firstHeader(H2, chunk),
        firstHeader(H3, chunk),
        chunk.contains("```"),
        chunk.contains("|---|") || chunk.contains("| --- |"),
        COMMAND.matcher(chunk).find());
  }

  private String firstHeader(Pattern pattern, String chunk) {
    Matcher matcher = pattern.matcher(chunk);
    if (!matcher.find()) {
      return null;
    }
    String title = matcher.group(1).trim();
    return title.isEmpty() ? null : title;
  }
}
