package com.flamingo.ai.techdocs.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import com.flamingo.ai.techdocs.service.ingestion.model.ExtractedContent;
import com.flamingo.ai.techdocs.service.ingestion.model.SourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ExtractedContentFactory Tests")
class ExtractedContentFactoryTest {

  private final ExtractedContentFactory factory = new ExtractedContentFactory();

  @Test
  @DisplayName("should estimate one page marker per 3000 characters")
  void shouldEstimatePageMarkers() {
    ExtractedContent content =
        factory.fromMarkdown("Book", "book.md", "x".repeat(7000), SourceType.BOOK);

    assertThat(content.pageMarkers())
        .containsExactly(entry(1, 0), entry(2, 3000), entry(3, 6000));
    assertThat(content.document().totalPages()).isEqualTo(3);
    assertThat(content.document().filePath()).isEqualTo("book.md");
  }

  @Test
  @DisplayName("should detect level-1 headers as chapters and skip overly long ones")
  void shouldDetectChapters() {
    String markdown =
        "# Introduction\ntext\n## Not a chapter\n# " + "L".repeat(120) + "\n# Processes\nmore";

    ExtractedContent content = factory.fromMarkdown("Book", "book.md", markdown, SourceType.BOOK);

    assertThat(content.document().chapters()).containsExactly("Introduction", "Processes");
  }

  @Test
  @DisplayName("should keep at most 50 chapters")
  void shouldCapChapters() {
    StringBuilder markdown = new StringBuilder();
    for (int i = 0; i < 60; i++) {
      markdown.append("# Chapter ").append(i).append('\n');
    }

    assertThat(factory.detectChapters(markdown.toString())).hasSize(50).startsWith("Chapter 0");
  }

  @Test
  @DisplayName("should treat missing markdown as empty text without pages")
  void shouldHandleMissingMarkdown() {
    ExtractedContent content = factory.fromMarkdown("Book", "book.md", null, null);

    assertThat(content.markdownContent()).isEmpty();
    assertThat(content.pageMarkers()).isEmpty();
    assertThat(content.document().chapters()).isEmpty();
    assertThat(content.document().sourceType()).isEqualTo(SourceType.BOOK);
  }

  @Test
  @DisplayName("should carry the requested source type on the document")
  void shouldCarrySourceType() {
    ExtractedContent content =
        factory.fromMarkdown("Triage", "triage.md", "# Steps\nIsolate host.", SourceType.PROCEDURE);

    assertThat(content.document().sourceType()).isEqualTo(SourceType.PROCEDURE);
  }
}
