package com.flamingo.ai.contentpipeline.exception;

/** Exception thrown when a pipeline run is neither in flight nor persisted. */
public class RunNotFoundException extends RuntimeException {

  private final String runId;

  public RunNotFoundException(String runId) {
    super("Run not found: " + runId);
    this.runId = runId;
  }

  public String getRunId() {
    return runId;
  }
}
