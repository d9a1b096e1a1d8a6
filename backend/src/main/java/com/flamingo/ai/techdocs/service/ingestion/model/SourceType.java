package com.flamingo.ai.techdocs.service.ingestion.model;

import java.util.Arrays;

/** Kind of knowledge source a chunk was produced from; drives the contextual prefix label. */
public enum SourceType {
  BOOK("book", "Source"),
  DOC("doc", "Document"),
  ORG("org", "Organization Knowledge"),
  PROCEDURE("procedure", "Procedure");

  private final String tag;
  private final String label;

  SourceType(String tag, String label) {
    this.tag = tag;
    this.label = label;
  }

  public String getTag() {
    return tag;
  }

  public String getLabel() {
    return label;
  }

  /**
   * Resolves a source-type tag, falling back to {@link #BOOK} for unknown or missing tags.
   *
   * @param tag tag such as {@code "book"} or {@code "procedure"}
   * @return the matching source type
   */
  public static SourceType fromTag(String tag) {
    if (tag == null) {
      return BOOK;
    }
    return Arrays.stream(values())
        .filter(type -> type.tag.equalsIgnoreCase(tag.trim()))
        .findFirst()
        .orElse(BOOK);
  }
}
