package com.flamingo.ai.techdocs.service.ingestion.chunking;

import java.util.Map;
import java.util.SortedMap;

/** Best-effort mapping from a character offset to the page it falls on. */
final class PageEstimator {

  private PageEstimator() {}

  /**
   * Returns the last page whose start offset is at or before {@code position}.
   *
   * @param position character offset in the extracted text
   * @param pageMarkers page number to start offset, ordered by page
   * @return estimated page, page 1 when the position precedes every marker, or {@code null} when
   *     there are no markers
   */
  static Integer estimatePage(int position, SortedMap<Integer, Integer> pageMarkers) {
    if (pageMarkers.isEmpty()) {
      return null;
    }
    int currentPage = 1;
    for (Map.Entry<Integer, Integer> marker : pageMarkers.entrySet()) {
      if (position >= marker.getValue()) {
        currentPage = marker.getKey();
      } else {
        break;
      }
    }
    return currentPage;
  }
}
