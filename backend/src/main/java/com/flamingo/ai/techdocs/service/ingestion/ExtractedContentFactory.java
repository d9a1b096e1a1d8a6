package com.flamingo.ai.techdocs.service.ingestion;

import com.flamingo.ai.techdocs.service.ingestion.model.Document;
import com.flamingo.ai.techdocs.service.ingestion.model.ExtractedContent;
import com.flamingo.ai.techdocs.service.ingestion.model.SourceType;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Wraps markdown that has already been extracted from a book into {@link ExtractedContent}.
 *
 * <p>Without real page boundaries, pages are estimated at a fixed number of characters per page.
 */
@Component
public class ExtractedContentFactory {

  static final int CHARS_PER_PAGE = 3000;
  static final int MAX_CHAPTERS = 50;
  static final int MAX_CHAPTER_TITLE_LENGTH = 100;

  private static final Pattern CHAPTER_HEADER =
      Pattern.compile("^#\\s+(.+?)$", Pattern.MULTILINE);

  public ExtractedContent fromMarkdown(
      String title, String filePath, String markdown, SourceType sourceType) {
    String text = markdown == null ? "" : markdown;
    SortedMap<Integer, Integer> pageMarkers = estimatePageMarkers(text);
    Document document =
        new Document(title, filePath, pageMarkers.size(), detectChapters(text), sourceType);
    return new ExtractedContent(document, text, pageMarkers);
  }

  SortedMap<Integer, Integer> estimatePageMarkers(String text) {
    SortedMap<Integer, Integer> markers = new TreeMap<>();
    int page = 1;
    for (int position = 0; position < text.length(); position += CHARS_PER_PAGE) {
      markers.put(page++, position);
    }
    return markers;
  }

  List<String> detectChapters(String text) {
    List<String> chapters = new ArrayList<>();
    Matcher matcher = CHAPTER_HEADER.matcher(text);
    while (matcher.find() && chapters.size() < MAX_CHAPTERS) {
      String chapter = matcher.group(1).trim();
      if (chapter.length() < MAX_CHAPTER_TITLE_LENGTH) {
        chapters.add(chapter);
      }
    }
    return chapters;
  }
}
