package com.flamingo.ai.techdocs.service.ingestion.model;

import java.util.List;

/**
 * A source document (typically a book or manual) as described by the extraction step.
 *
 * @param title human-readable title, also the base of every chunk id
 * @param filePath path of the file the text was extracted from
 * @param totalPages number of pages reported or estimated by the extractor
 * @param chapters chapter titles detected by the extractor, in document order
 * @param sourceType kind of source, which selects the label of every chunk prefix
 */
public record Document(
    String title,
    String filePath,
    int totalPages,
    List<String> chapters,
    SourceType sourceType) {

  public Document {
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("Document title must not be blank");
    }
    chapters = chapters == null ? List.of() : List.copyOf(chapters);
    sourceType = sourceType == null ? SourceType.BOOK : sourceType;
  }

  public Document(String title) {
    this(title, "", 0, List.of(), SourceType.BOOK);
  }
}
