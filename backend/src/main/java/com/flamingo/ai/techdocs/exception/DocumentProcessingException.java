package com.flamingo.ai.techdocs.exception;

/** Exception thrown when a document cannot be ingested or its chunks cannot be embedded. */
public class DocumentProcessingException extends RuntimeException {

  private final String documentTitle;
  private final String userMessage;

  public DocumentProcessingException(String documentTitle, String message) {
    super(message);
    this.documentTitle = documentTitle;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(String documentTitle, String message, Throwable cause) {
    super(message, cause);
    this.documentTitle = documentTitle;
    this.userMessage = "Failed to process document";
  }

  public String getDocumentTitle() {
    return documentTitle;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
