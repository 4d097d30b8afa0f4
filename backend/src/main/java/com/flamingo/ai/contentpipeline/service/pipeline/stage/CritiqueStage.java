package com.flamingo.ai.contentpipeline.service.pipeline.stage;

import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.enums.Stage;
import com.flamingo.ai.contentpipeline.domain.model.CritiqueResult;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.service.pipeline.quality.HeuristicQualityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Scores the current draft. The approve/revise/escalate decision is left to the executor. */
@Component
@RequiredArgsConstructor
@Slf4j
public class CritiqueStage implements StageNode {

  private final HeuristicQualityScorer qualityScorer;

  @Override
  public Stage stage() {
    return Stage.CRITIQUE;
  }

  @Override
  public StageOutcome execute(PipelineState state) {
    if (state.getDraft() == null) {
      return StageOutcome.failed(ErrorClass.FATAL, "No draft to critique");
    }
    CritiqueResult result =
        qualityScorer.score(state.getDraft(), state.getRetrievalContext(), state.getOutline());
    log.info(
        "Run {} critique of draft {}: score {} ({} issues)",
        state.getRunId(),
        state.getDraft().attempt(),
        String.format("%.3f", result.score()),
        result.issues().size());
    return StageOutcome.critique(result);
  }
}
