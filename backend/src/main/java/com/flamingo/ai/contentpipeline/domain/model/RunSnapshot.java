package com.flamingo.ai.contentpipeline.domain.model;

import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.enums.RunStatus;
import com.flamingo.ai.contentpipeline.domain.enums.Stage;
import java.time.Instant;

/**
 * Durable record of a run, written whenever it reaches a terminal state. Carries enough to explain
 * how the run ended and to resume a failed publish or an escalated draft.
 */
public record RunSnapshot(
    String runId,
    RunStatus status,
    Stage lastStage,
    ErrorClass errorClass,
    String errorMessage,
    CritiqueResult lastCritique,
    Instant savedAt,
    PipelineState state) {

  public static RunSnapshot of(PipelineState state, Instant savedAt) {
    return new RunSnapshot(
        state.getRunId(),
        state.getStatus(),
        state.getCurrentStage(),
        state.getErrorClass(),
        state.getErrorMessage(),
        state.latestCritique().orElse(null),
        savedAt,
        state);
  }
}
