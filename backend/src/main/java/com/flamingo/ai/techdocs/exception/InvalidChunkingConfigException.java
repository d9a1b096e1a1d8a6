package com.flamingo.ai.techdocs.exception;

/** Exception thrown when chunking or prefix settings are inconsistent. */
public class InvalidChunkingConfigException extends RuntimeException {

  private final String userMessage;

  public InvalidChunkingConfigException(String message) {
    super(message);
    this.userMessage = "Invalid chunking configuration: " + message;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
