package com.flamingo.ai.contentpipeline.service.pipeline.stage;

import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.model.CritiqueResult;

/**
 * Structured result of one stage execution. Stages report failures through this type instead of
 * throwing, and the executor decides where the run goes next.
 */
public record StageOutcome(
    Type type, CritiqueResult critique, ErrorClass errorClass, String message) {

  public enum Type {
    SUCCESS,
    CRITIQUE,
    INSUFFICIENT_GROUNDING,
    FAILED
  }

  public static StageOutcome success() {
    return new StageOutcome(Type.SUCCESS, null, null, null);
  }

  public static StageOutcome critique(CritiqueResult critique) {
    return new StageOutcome(Type.CRITIQUE, critique, null, null);
  }

  public static StageOutcome insufficientGrounding(String message) {
    return new StageOutcome(
        Type.INSUFFICIENT_GROUNDING, null, ErrorClass.INSUFFICIENT_GROUNDING, message);
  }

  public static StageOutcome failed(ErrorClass errorClass, String message) {
    return new StageOutcome(Type.FAILED, null, errorClass, message);
  }
}
