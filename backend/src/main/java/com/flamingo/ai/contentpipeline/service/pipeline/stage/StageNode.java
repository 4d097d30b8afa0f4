package com.flamingo.ai.contentpipeline.service.pipeline.stage;

import com.flamingo.ai.contentpipeline.domain.enums.Stage;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;

/**
 * One unit of work in the pipeline graph. There is exactly one node per {@link Stage}.
 *
 * <p>A node reads and updates the {@link PipelineState} it is handed, using only the state and the
 * results of the capabilities it calls. It never decides the next stage and never loops on its
 * own; it reports what happened through a {@link StageOutcome}.
 */
public interface StageNode {

  Stage stage();

  StageOutcome execute(PipelineState state);
}
