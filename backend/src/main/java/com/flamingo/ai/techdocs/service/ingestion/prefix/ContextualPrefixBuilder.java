package com.flamingo.ai.techdocs.service.ingestion.prefix;

import com.flamingo.ai.techdocs.service.ingestion.model.Chunk;
import com.flamingo.ai.techdocs.service.ingestion.model.SourceType;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Builds the short descriptive header prepended to chunk content before embedding (contextual
 * retrieval).
 *
 * <p>A prefix looks like:
 *
 * <pre>
 * Source: Windows Internals
 * Chapter: Memory Management
 * Section: VAD Trees
 * ---
 * </pre>
 *
 * <p>Each line is present only when enabled in {@link ContextualPrefixConfig} and the value is
 * known. Without any line the prefix is empty.
 */
@Service
@RequiredArgsConstructor
public class ContextualPrefixBuilder {

  private final ContextualPrefixConfig config;

  public String buildPrefix(
      String source, String chapter, String section, Integer page, SourceType sourceType) {
    List<String> lines = new ArrayList<>(4);

    if (config.includeSource() && hasText(source)) {
      SourceType type = sourceType != null ? sourceType : SourceType.BOOK;
      lines.add(type.getLabel() + ": " + source);
    }
    if (config.includeChapter() && hasText(chapter)) {
      lines.add("Chapter: " + chapter);
    }
    if (config.includeSection() && hasText(section)) {
      lines.add("Section: " + section);
    }
    if (config.includePage() && page != null && page > 0) {
      lines.add("Page: " + page);
    }

    if (lines.isEmpty()) {
      return "";
    }

    String prefix = String.join("\n", lines);
    if (prefix.length() > config.maxPrefixLength()) {
      prefix =
          prefix.substring(0, config.maxPrefixLength() - ContextualPrefixConfig.ELLIPSIS.length())
              + ContextualPrefixConfig.ELLIPSIS;
    }
    return prefix + "\n" + config.separator() + "\n";
  }

  /** Prefix computed from the chunk's own fields, ignoring any prefix it already carries. */
  public String buildPrefix(Chunk chunk) {
    return buildPrefix(
        chunk.bookTitle(), chunk.chapter(), chunk.section(), chunk.page(), chunk.sourceType());
  }

  /**
   * Returns {@code chunk} unchanged if it already has a prefix, otherwise a copy carrying one.
   *
   * @param chunk chunk to enrich
   * @return chunk with a contextual prefix (possibly empty if no field is available)
   */
  public Chunk preprocess(Chunk chunk) {
    if (chunk.hasContextualPrefix()) {
      return chunk;
    }
    return chunk.withContextualPrefix(buildPrefix(chunk));
  }

  /** Text handed to the embedding model: prefix followed by content. */
  public String textForEmbedding(Chunk chunk) {
    String prefix = chunk.hasContextualPrefix() ? chunk.contextualPrefix() : buildPrefix(chunk);
    return prefix + chunk.content();
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
