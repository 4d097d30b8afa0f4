package com.flamingo.ai.contentpipeline.domain.enums;

/** Classification of the error that ended a run or skipped an input. */
public enum ErrorClass {
  /** Network or rate-limit failure of an external capability. Retried with backoff. */
  TRANSIENT,
  /** A source document could not be decoded. Skipped, never aborts a batch. */
  INGESTION,
  /** Capability permanently unavailable, retries exhausted or unusable output. */
  FATAL,
  /** Critique loop budget reached without approval. */
  QUALITY_EXHAUSTED,
  /** Research found nothing to ground the content in. */
  INSUFFICIENT_GROUNDING,
  /** The blog platform rejected or could not receive the post. */
  PUBLISH,
  CANCELLED
}
