package com.flamingo.ai.contentpipeline.domain.enums;

/** Publication visibility of a post. */
public enum Visibility {
  DRAFT,
  PUBLISHED,
  SCHEDULED
}
