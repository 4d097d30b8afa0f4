package com.flamingo.ai.contentpipeline.exception;

/** Exception thrown when a manual follow-up does not apply to the run's current state. */
public class RunNotResumableException extends RuntimeException {

  private final String runId;

  public RunNotResumableException(String runId, String reason) {
    super("Run " + runId + " cannot be resumed: " + reason);
    this.runId = runId;
  }

  public String getRunId() {
    return runId;
  }
}
