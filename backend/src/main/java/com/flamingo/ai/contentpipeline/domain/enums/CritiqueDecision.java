package com.flamingo.ai.contentpipeline.domain.enums;

/** Outcome of the quality gate for one critique. */
public enum CritiqueDecision {
  APPROVE,
  REVISE,
  ESCALATE
}
