package com.flamingo.ai.contentpipeline.exception;

/** Exception thrown when run snapshots or the index file cannot be read or written. */
public class SnapshotPersistenceException extends RuntimeException {

  public SnapshotPersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
