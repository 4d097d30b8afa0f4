package com.flamingo.ai.contentpipeline.exception;

/** Exception thrown when the blog platform rejects or cannot receive a post. */
public class PublishException extends RuntimeException {

  private final boolean transientFailure;

  public PublishException(String message, boolean transientFailure) {
    super(message);
    this.transientFailure = transientFailure;
  }

  public PublishException(String message, boolean transientFailure, Throwable cause) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  public boolean isTransientFailure() {
    return transientFailure;
  }
}
