package com.flamingo.ai.techdocs.service.ingestion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Text in which protected spans have been replaced by placeholders, with the placeholder map needed
 * to restore them. Scoped to one document's chunking pass.
 *
 * @param text text containing placeholders
 * @param blocks placeholder to original span, in protection order
 */
public record ProtectedText(String text, Map<String, String> blocks) {

  public ProtectedText {
    blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
  }

  public int blockCount() {
    return blocks.size();
  }
}
