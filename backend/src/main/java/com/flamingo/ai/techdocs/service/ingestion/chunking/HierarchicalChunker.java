package com.flamingo.ai.techdocs.service.ingestion.chunking;

import com.flamingo.ai.techdocs.service.ingestion.model.Chunk;
import com.flamingo.ai.techdocs.service.ingestion.model.ChunkMetadata;
import com.flamingo.ai.techdocs.service.ingestion.model.ChunkingConfig;
import com.flamingo.ai.techdocs.service.ingestion.model.Document;
import com.flamingo.ai.techdocs.service.ingestion.model.ExtractedContent;
import com.flamingo.ai.techdocs.service.ingestion.model.ProtectedText;
import com.flamingo.ai.techdocs.service.ingestion.model.SourceType;
import com.flamingo.ai.techdocs.service.ingestion.prefix.ContextualPrefixBuilder;
import io.micrometer.core.annotation.Timed;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} for technical books that never splits code blocks or tables.
 *
 * <p>Pipeline per document:
 *
 * <ol>
 *   <li>{@link ContentProtector} swaps code blocks and tables for placeholders;
 *   <li>{@link BoundarySplitter} splits along headers, code fences, paragraphs, lines and words,
 *       falling back to {@link HardSplitter};
 *   <li>placeholders are restored and segments shorter than the minimum size are dropped;
 *   <li>{@link ChunkMetadataExtractor} reads headers, and a {@link RunningContext} carries the
 *       latest chapter and section forward to chunks without their own headers;
 *   <li>{@link ContextualPrefixBuilder} builds the prefix stored on each chunk.
 * </ol>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HierarchicalChunker implements DocumentChunker {

  /** Length of the segment head searched for in the original text to estimate its page. */
  private static final int PAGE_ANCHOR_LENGTH = 100;

  private final ChunkingConfig config;
  private final ContentProtector protector;
  private final BoundarySplitter splitter;
  private final ChunkMetadataExtractor metadataExtractor;
  private final ContextualPrefixBuilder prefixBuilder;

  @Override
  public Stream<Chunk> stream(ExtractedContent content) {
    String text = content.markdownContent();
    if (text.isBlank()) {
      log.info("Document '{}' has no text, producing no chunks", content.document().title());
      return Stream.empty();
    }

    ProtectedText protectedText = protector.protect(text);
    List<String> segments =
        splitter.split(
            protectedText.text(),
            config.chunkSizeChars(),
            config.chunkOverlapChars(),
            protectedText.blocks());

    log.debug(
        "Split '{}' into {} raw segments ({} protected blocks)",
        content.document().title(),
        segments.size(),
        protectedText.blockCount());

    Emitter emitter = new Emitter(content, protectedText, segments.iterator());
    return StreamSupport.stream(emitter, false).onClose(emitter::logSummary);
  }

  @Override
  @Timed(value = "document.chunk", description = "Time to chunk a document")
  public List<Chunk> chunk(ExtractedContent content) {
    return DocumentChunker.super.chunk(content);
  }

  /**
   * Builds the chunk id: lower-cased title with spaces replaced by underscores, then the
   * zero-padded sequence number.
   */
  static String chunkId(String title, int chunkIndex) {
    return String.format(
        Locale.ROOT, "%s_%04d", title.toLowerCase(Locale.ROOT).replace(' ', '_'), chunkIndex);
  }

  /** Holds the per-document state of one {@link #stream} call. */
  private final class Emitter extends Spliterators.AbstractSpliterator<Chunk> {

    private final ExtractedContent content;
    private final ProtectedText protectedText;
    private final Iterator<String> segments;

    private RunningContext context = RunningContext.empty();
    private int chunkIndex;
    private int dropped;
    private boolean summaryLogged;

    Emitter(ExtractedContent content, ProtectedText protectedText, Iterator<String> segments) {
      super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
      this.content = content;
      this.protectedText = protectedText;
      this.segments = segments;
    }

    @Override
    public boolean tryAdvance(Consumer<? super Chunk> action) {
      while (segments.hasNext()) {
        String restored = protector.restore(segments.next(), protectedText.blocks());
        String trimmed = restored.trim();
        if (trimmed.length() < config.minChunkSizeChars() || trimmed.isEmpty()) {
          dropped++;
          continue;
        }
        action.accept(toChunk(restored, trimmed));
        return true;
      }
      logSummary();
      return false;
    }

    private Chunk toChunk(String restored, String trimmed) {
      ChunkMetadata metadata = metadataExtractor.extract(restored);
      context = context.advance(metadata);

      Document document = content.document();
      Integer page = estimatePage(restored);
      SourceType sourceType = document.sourceType();
      String prefix =
          prefixBuilder.buildPrefix(
              document.title(), context.chapter(), context.section(), page, sourceType);

      Chunk chunk =
          new Chunk(
              chunkId(document.title(), chunkIndex),
              trimmed,
              prefix,
              sourceType,
              document.title(),
              context.chapter(),
              context.section(),
              page,
              chunkIndex);
      chunkIndex++;
      return chunk;
    }

    private Integer estimatePage(String restored) {
      int position = 0;
      if (restored.length() > PAGE_ANCHOR_LENGTH) {
        position =
            Math.max(
                0, content.markdownContent().indexOf(restored.substring(0, PAGE_ANCHOR_LENGTH)));
      }
      return PageEstimator.estimatePage(position, content.pageMarkers());
    }

    void logSummary() {
      if (summaryLogged) {
        return;
      }
      summaryLogged = true;
      log.info(
          "Created {} chunks from {} ({} segments below minimum size dropped)",
          chunkIndex,
          content.document().title(),
          dropped);
    }
  }
}
