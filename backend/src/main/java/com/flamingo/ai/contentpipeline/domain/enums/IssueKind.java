package com.flamingo.ai.contentpipeline.domain.enums;

/** Kinds of problems flagged by the quality scorer. */
public enum IssueKind {
  UNGROUNDED_CLAIM,
  REDUNDANT_CONTENT,
  MISSING_SECTION,
  THIN_SECTION
}
