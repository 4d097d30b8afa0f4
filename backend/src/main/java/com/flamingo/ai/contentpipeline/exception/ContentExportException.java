package com.flamingo.ai.contentpipeline.exception;

import java.nio.file.Path;

/** Exception thrown when a finished post cannot be written to the output directory. */
public class ContentExportException extends RuntimeException {

  private final transient Path target;

  public ContentExportException(Path target, Throwable cause) {
    super("Failed to export post to " + target, cause);
    this.target = target;
  }

  public Path getTarget() {
    return target;
  }
}
