package com.flamingo.ai.contentpipeline.service.capability;

/** Kinds of text generation the pipeline asks for. */
public enum GenerationTask {
  OUTLINE,
  DRAFT,
  REVISE,
  OPTIMIZE
}
