package com.flamingo.ai.contentpipeline.domain.enums;

/** What the executor does when the critique loop budget runs out without approval. */
public enum ExhaustionPolicy {
  /** End the run in {@link RunStatus#ESCALATED} for human review. */
  ESCALATE,
  /** Continue to optimization with a warning recorded on the run. */
  APPROVE_WITH_WARNING
}
