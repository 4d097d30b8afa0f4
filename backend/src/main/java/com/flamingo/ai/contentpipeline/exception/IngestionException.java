package com.flamingo.ai.contentpipeline.exception;

/** Exception thrown when a source document cannot be ingested into the corpus. */
public class IngestionException extends RuntimeException {

  private final String sourcePath;
  private final String userMessage;

  public IngestionException(String sourcePath, String message) {
    super(message);
    this.sourcePath = sourcePath;
    this.userMessage = "Failed to ingest document";
  }

  public IngestionException(String sourcePath, String message, Throwable cause) {
    super(message, cause);
    this.sourcePath = sourcePath;
    this.userMessage = "Failed to ingest document";
  }

  public String getSourcePath() {
    return sourcePath;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
