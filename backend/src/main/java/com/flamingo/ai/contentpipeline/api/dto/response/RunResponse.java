package com.flamingo.ai.contentpipeline.api.dto.response;

import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.enums.RunStatus;
import com.flamingo.ai.contentpipeline.domain.enums.Stage;
import com.flamingo.ai.contentpipeline.domain.model.CritiqueResult;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.domain.model.PublishResult;
import com.flamingo.ai.contentpipeline.domain.model.RunSnapshot;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the status of a pipeline run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResponse {

  private String runId;
  private RunStatus status;
  private Stage stage;
  private ErrorClass errorClass;
  private String errorMessage;
  private String title;
  private boolean lowConfidence;
  private int critiqueIterations;
  private CritiqueResult lastCritique;
  private PublishResult publishResult;
  private String exportPath;
  private List<String> warnings;
  private Instant updatedAt;

  /** Response for a run that has just been accepted. */
  public static RunResponse accepted(String runId) {
    return RunResponse.builder()
        .runId(runId)
        .status(RunStatus.RUNNING)
        .stage(Stage.RESEARCH)
        .warnings(List.of())
        .updatedAt(Instant.now())
        .build();
  }

  /** Creates a RunResponse from a snapshot; live snapshots carry no state. */
  public static RunResponse fromSnapshot(RunSnapshot snapshot) {
    RunResponseBuilder builder =
        RunResponse.builder()
            .runId(snapshot.runId())
            .status(snapshot.status())
            .stage(snapshot.lastStage())
            .errorClass(snapshot.errorClass())
            .errorMessage(snapshot.errorMessage())
            .lastCritique(snapshot.lastCritique())
            .warnings(List.of())
            .updatedAt(snapshot.savedAt());

    PipelineState state = snapshot.state();
    if (state != null) {
      builder
          .title(state.getTopic() != null ? state.getTopic().title() : null)
          .lowConfidence(state.isLowConfidence())
          .critiqueIterations(state.getCritiqueIterations())
          .publishResult(state.getPublishResult())
          .exportPath(state.getExportPath())
          .warnings(List.copyOf(state.getWarnings()));
    }
    return builder.build();
  }
}
