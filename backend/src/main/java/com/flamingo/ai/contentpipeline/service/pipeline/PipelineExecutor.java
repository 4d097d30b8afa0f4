package com.flamingo.ai.contentpipeline.service.pipeline;

import com.flamingo.ai.contentpipeline.config.PipelineConfig;
import com.flamingo.ai.contentpipeline.domain.enums.CritiqueDecision;
import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.enums.ExhaustionPolicy;
import com.flamingo.ai.contentpipeline.domain.enums.RunStatus;
import com.flamingo.ai.contentpipeline.domain.enums.Stage;
import com.flamingo.ai.contentpipeline.domain.model.CritiqueResult;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.exception.ContentExportException;
import com.flamingo.ai.contentpipeline.exception.SnapshotPersistenceException;
import com.flamingo.ai.contentpipeline.service.pipeline.export.MarkdownPostExporter;
import com.flamingo.ai.contentpipeline.service.pipeline.quality.QualityGate;
import com.flamingo.ai.contentpipeline.service.pipeline.snapshot.RunSnapshotStore;
import com.flamingo.ai.contentpipeline.service.pipeline.stage.StageNode;
import com.flamingo.ai.contentpipeline.service.pipeline.stage.StageOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Drives one run through the stage graph. The graph is a fixed transition table with a single
 * cycle (Critique back to Write) bounded by the quality gate, plus a bounded retry edge on
 * Research.
 *
 * <p>Runs on the calling thread. Cancellation is observed between stages; a stage already in
 * progress is allowed to finish.
 */
@Component
@Slf4j
public class PipelineExecutor {

  private final Map<Stage, StageNode> stages = new EnumMap<>(Stage.class);
  private final QualityGate qualityGate;
  private final RunSnapshotStore snapshotStore;
  private final MarkdownPostExporter postExporter;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  public PipelineExecutor(
      List<StageNode> stageNodes,
      QualityGate qualityGate,
      RunSnapshotStore snapshotStore,
      MarkdownPostExporter postExporter,
      PipelineConfig pipelineConfig,
      MeterRegistry meterRegistry) {
    for (StageNode node : stageNodes) {
      if (stages.put(node.stage(), node) != null) {
        throw new IllegalStateException("Duplicate stage node for " + node.stage());
      }
    }
    for (Stage stage : Stage.values()) {
      if (!stages.containsKey(stage)) {
        throw new IllegalStateException("No stage node registered for " + stage);
      }
    }
    this.qualityGate = qualityGate;
    this.snapshotStore = snapshotStore;
    this.postExporter = postExporter;
    this.pipelineConfig = pipelineConfig;
    this.meterRegistry = meterRegistry;
  }

  /** Runs a fresh state from Research to a terminal status. */
  public PipelineState run(PipelineState state, CancellationToken token) {
    return resume(state, Stage.RESEARCH, token);
  }

  public PipelineState resume(PipelineState state, Stage from, CancellationToken token) {
    return resume(state, from, token, progress -> {});
  }

  /**
   * Continues a run from the given stage until it reaches a terminal status, and saves the
   * terminal state. A failed save is recorded on the state as a warning with {@code persisted}
   * left false.
   *
   * @param progress receives an immutable {@link RunProgress} each time a stage starts
   */
  public PipelineState resume(
      PipelineState state, Stage from, CancellationToken token, Consumer<RunProgress> progress) {
    state.setStatus(RunStatus.RUNNING);
    state.clearFailure();
    Stage current = from;
    log.info("Run {} starting at {}", state.getRunId(), from);

    while (current != null) {
      if (token.isCancellationRequested()) {
        log.info("Run {} cancelled before {}", state.getRunId(), current);
        finish(state, RunStatus.CANCELLED, ErrorClass.CANCELLED, "Cancelled before " + current);
        return state;
      }
      state.setCurrentStage(current);
      progress.accept(
          new RunProgress(current, state.latestCritique().orElse(null), Instant.now()));
      StageOutcome outcome = execute(stages.get(current), state);
      current = next(current, outcome, state);
    }
    return state;
  }

  private StageOutcome execute(StageNode node, PipelineState state) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      return node.execute(state);
    } catch (RuntimeException e) {
      log.error("Run {} stage {} threw unexpectedly", state.getRunId(), node.stage(), e);
      return StageOutcome.failed(ErrorClass.FATAL, node.stage() + " failed: " + e.getMessage());
    } finally {
      sample.stop(meterRegistry.timer("pipeline.stage", "stage", node.stage().name()));
    }
  }

  /** Returns the next stage, or {@code null} once the run has reached a terminal status. */
  private Stage next(Stage current, StageOutcome outcome, PipelineState state) {
    if (outcome.type() == StageOutcome.Type.FAILED) {
      finish(state, RunStatus.FAILED, outcome.errorClass(), outcome.message());
      return null;
    }
    return switch (current) {
      case RESEARCH -> afterResearch(outcome, state);
      case OUTLINE -> Stage.WRITE;
      case WRITE -> Stage.CRITIQUE;
      case CRITIQUE -> afterCritique(outcome.critique(), state);
      case OPTIMIZE -> Stage.PUBLISH;
      case PUBLISH -> {
        finish(state, RunStatus.DONE, null, null);
        yield null;
      }
    };
  }

  private Stage afterResearch(StageOutcome outcome, PipelineState state) {
    if (outcome.type() != StageOutcome.Type.INSUFFICIENT_GROUNDING) {
      return Stage.OUTLINE;
    }
    state.incrementResearchAttempts();
    int budget = pipelineConfig.getResearch().getRetryBudget();
    if (state.getResearchAttempts() <= budget) {
      log.info(
          "Run {} found no grounding, broadening research (attempt {}/{})",
          state.getRunId(),
          state.getResearchAttempts(),
          budget);
      return Stage.RESEARCH;
    }
    finish(state, RunStatus.FAILED, ErrorClass.INSUFFICIENT_GROUNDING, outcome.message());
    return null;
  }

  private Stage afterCritique(CritiqueResult critique, PipelineState state) {
    int iteration = state.getCritiqueIterations();
    CritiqueDecision decision = qualityGate.decide(critique.score(), iteration);
    state.recordCritique(critique.withDecision(decision, iteration));
    log.info(
        "Run {} critique decision {} (score {}, iteration {})",
        state.getRunId(),
        decision,
        String.format("%.3f", critique.score()),
        iteration);

    if (decision == CritiqueDecision.APPROVE) {
      return Stage.OPTIMIZE;
    }
    if (decision == CritiqueDecision.REVISE) {
      state.incrementCritiqueIterations();
      meterRegistry.counter("pipeline.critique.loops").increment();
      return Stage.WRITE;
    }

    if (pipelineConfig.getQuality().getOnExhaustion() == ExhaustionPolicy.APPROVE_WITH_WARNING) {
      state.addWarning(
          String.format(
              "Approved below quality threshold after %d revisions (score %.3f)",
              iteration, critique.score()));
      return Stage.OPTIMIZE;
    }
    finish(
        state,
        RunStatus.ESCALATED,
        ErrorClass.QUALITY_EXHAUSTED,
        String.format(
            "Quality threshold not met after %d revisions (score %.3f)",
            iteration, critique.score()));
    return null;
  }

  private void finish(
      PipelineState state, RunStatus status, ErrorClass errorClass, String message) {
    state.setStatus(status);
    state.setErrorClass(errorClass);
    state.setErrorMessage(message);
    state.setFinishedAt(Instant.now());
    meterRegistry.counter("pipeline.runs", "status", status.name()).increment();
    log.info(
        "Run {} finished {} at {}{}",
        state.getRunId(),
        status,
        state.getCurrentStage(),
        message == null ? "" : ": " + message);
    if (status == RunStatus.DONE && state.getFinalContent() != null) {
      export(state);
    }
    try {
      snapshotStore.save(state);
      state.setPersisted(true);
    } catch (SnapshotPersistenceException e) {
      log.error("Run {} finished {} but its snapshot was not saved", state.getRunId(), status, e);
      state.addWarning("Run snapshot could not be saved: " + e.getMessage());
      state.setPersisted(false);
    }
  }

  private void export(PipelineState state) {
    try {
      postExporter
          .export(state.getRunId(), state.getFinalContent(), state.getFinishedAt())
          .ifPresent(path -> state.setExportPath(path.toString()));
    } catch (ContentExportException e) {
      log.warn("Run {} could not be exported: {}", state.getRunId(), e.getMessage(), e);
      state.addWarning("Markdown export failed: " + e.getMessage());
    }
  }
}
