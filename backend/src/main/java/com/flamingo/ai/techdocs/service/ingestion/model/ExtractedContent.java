package com.flamingo.ai.techdocs.service.ingestion.model;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Markdown-like text produced by the extraction collaborator, together with its source document.
 *
 * <p>{@code pageMarkers} maps a page number to the character offset where that page begins. It is
 * used for best-effort page estimation only and is not required to be exact.
 *
 * @param document the source document
 * @param markdownContent full extracted text
 * @param pageMarkers page number to start offset, ordered by page number
 */
public record ExtractedContent(
    Document document, String markdownContent, SortedMap<Integer, Integer> pageMarkers) {

  public ExtractedContent {
    if (document == null) {
      throw new IllegalArgumentException("Extracted content requires a document");
    }
    markdownContent = markdownContent == null ? "" : markdownContent;
    pageMarkers =
        pageMarkers == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(pageMarkers));
  }

  public ExtractedContent(Document document, String markdownContent) {
    this(document, markdownContent, Collections.emptySortedMap());
  }

  public ExtractedContent(
      Document document, String markdownContent, Map<Integer, Integer> pageMarkers) {
    this(document, markdownContent, sorted(pageMarkers));
  }

  private static SortedMap<Integer, Integer> sorted(Map<Integer, Integer> pageMarkers) {
    return pageMarkers == null ? null : new TreeMap<>(pageMarkers);
  }
}
