package com.flamingo.ai.techdocs.service.ingestion.chunking;

import com.flamingo.ai.techdocs.service.ingestion.model.ProtectedText;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Swaps spans that must never be split (fenced code blocks, markdown tables) for placeholder tokens
 * and puts them back afterwards.
 *
 * <p>Code blocks are protected before tables, so pipe-delimited text inside a code block is never
 * mistaken for a table. Placeholders contain no whitespace, which lets the splitters treat them as
 * ordinary words.
 */
@Component
@Slf4j
public class ContentProtector {

  static final String CODE_BLOCK_PREFIX = "__CODE_BLOCK_";
  static final String TABLE_PREFIX = "__TABLE_";

  /** Matches any placeholder produced by {@link #protect(String)}. */
  public static final Pattern PLACEHOLDER_PATTERN =
      Pattern.compile("__(?:CODE_BLOCK|TABLE)_\\d+__");

  private static final Pattern CODE_BLOCK_PATTERN = Pattern.compile("```[\\s\\S]*?```");

  // Consecutive lines that each start and end with a pipe; the last one may end the text
  private static final Pattern TABLE_PATTERN =
      Pattern.compile("(?:^\\|[^\\n]+\\|(?:\\n|\\z))+", Pattern.MULTILINE);

  /**
   * Replaces protected spans with placeholders.
   *
   * @param text raw document text
   * @return the placeholder text and the placeholder-to-original map
   */
  public ProtectedText protect(String text) {
    Map<String, String> blocks = new LinkedHashMap<>();
    String withoutCode = substitute(text, CODE_BLOCK_PATTERN, CODE_BLOCK_PREFIX, blocks);
    String withoutTables = substitute(withoutCode, TABLE_PATTERN, TABLE_PREFIX, blocks);

    log.debug("Protected {} blocks", blocks.size());
    return new ProtectedText(withoutTables, blocks);
  }

  /**
   * Reinserts every protected span whose placeholder occurs in {@code text}.
   *
   * <p>Placeholders are resolved in reverse protection order: a table may have swallowed a code
   * placeholder, which must still be resolved after the table itself is put back.
   *
   * @param text a segment of protected text
   * @param blocks map returned by {@link #protect(String)}
   * @return the segment with original spans restored
   */
  public String restore(String text, Map<String, String> blocks) {
    if (blocks.isEmpty() || text.indexOf("__") < 0) {
      return text;
    }
    List<Map.Entry<String, String>> entries = new ArrayList<>(blocks.entrySet());
    String restored = text;
    for (int i = entries.size() - 1; i >= 0; i--) {
      Map.Entry<String, String> entry = entries.get(i);
      restored = restored.replace(entry.getKey(), entry.getValue());
    }
    return restored;
  }

  private String substitute(
      String text, Pattern pattern, String placeholderPrefix, Map<String, String> blocks) {
    Matcher matcher = pattern.matcher(text);
    StringBuilder out = new StringBuilder(text.length());
    int index = 0;
    while (matcher.find()) {
      String placeholder = placeholderPrefix + index++ + "__";
      blocks.put(placeholder, matcher.group());
      matcher.appendReplacement(out, Matcher.quoteReplacement(placeholder));
    }
    matcher.appendTail(out);
    return out.toString();
  }
}
