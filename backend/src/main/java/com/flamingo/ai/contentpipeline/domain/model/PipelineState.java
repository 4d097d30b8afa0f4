package com.flamingo.ai.contentpipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.enums.RunStatus;
import com.flamingo.ai.contentpipeline.domain.enums.Stage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * The single mutable aggregate threaded through one pipeline run.
 *
 * <p>Owned by exactly one run at a time: the stage currently executing mutates it, and the
 * executor mutates it between stages. It is never shared between threads while a run is active.
 */
@Getter
@Setter
@NoArgsConstructor
public class PipelineState {

  private String runId;
  private TopicSpec topic;
  private RetrievalContext retrievalContext;
  private Outline outline;
  private DraftContent draft;
  private List<CritiqueResult> critiqueHistory = new ArrayList<>();

  /** Traversals of the Critique to Write edge. Only ever increases. */
  private int critiqueIterations;

  /** Research attempts that came back empty. */
  private int researchAttempts;

  private int draftAttempts;
  private Stage currentStage;
  private RunStatus status = RunStatus.RUNNING;
  private boolean lowConfidence;
  private FinalContent finalContent;
  private PublishResult publishResult;

  /** Markdown copy of the final post, written when the run completes. */
  private String exportPath;

  private List<String> warnings = new ArrayList<>();
  private ErrorClass errorClass;
  private String errorMessage;
  private Instant startedAt;
  private Instant finishedAt;

  /** Whether the latest terminal state reached the snapshot store. */
  @JsonIgnore private boolean persisted;

  public static PipelineState start(String runId, TopicSpec topic) {
    PipelineState state = new PipelineState();
    state.setRunId(runId);
    state.setTopic(topic);
    state.setCurrentStage(Stage.RESEARCH);
    state.setStartedAt(Instant.now());
    return state;
  }

  public Optional<CritiqueResult> latestCritique() {
    return critiqueHistory.isEmpty()
        ? Optional.empty()
        : Optional.of(critiqueHistory.get(critiqueHistory.size() - 1));
  }

  public void recordCritique(CritiqueResult critique) {
    critiqueHistory.add(critique);
  }

  public void incrementCritiqueIterations() {
    critiqueIterations++;
  }

  public void incrementResearchAttempts() {
    researchAttempts++;
  }

  public void addWarning(String warning) {
    warnings.add(warning);
  }

  public void clearFailure() {
    errorClass = null;
    errorMessage = null;
    finishedAt = null;
    persisted = false;
  }
}
