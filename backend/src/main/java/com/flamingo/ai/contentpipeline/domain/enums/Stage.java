package com.flamingo.ai.contentpipeline.domain.enums;

/** Workflow stages, in graph order. */
public enum Stage {
  RESEARCH,
  OUTLINE,
  WRITE,
  CRITIQUE,
  OPTIMIZE,
  PUBLISH
}
