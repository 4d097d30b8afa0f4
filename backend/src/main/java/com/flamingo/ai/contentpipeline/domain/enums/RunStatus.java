package com.flamingo.ai.contentpipeline.domain.enums;

/** Lifecycle status of a pipeline run. */
public enum RunStatus {
  RUNNING,
  DONE,
  FAILED,
  ESCALATED,
  CANCELLED;

  public boolean isTerminal() {
    return this != RUNNING;
  }
}
