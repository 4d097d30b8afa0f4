package com.flamingo.ai.contentpipeline.service.pipeline;

import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.enums.RunStatus;
import com.flamingo.ai.contentpipeline.domain.enums.Stage;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.domain.model.RunSnapshot;
import com.flamingo.ai.contentpipeline.domain.model.TopicSpec;
import com.flamingo.ai.contentpipeline.exception.RunNotFoundException;
import com.flamingo.ai.contentpipeline.exception.RunNotResumableException;
import com.flamingo.ai.contentpipeline.service.pipeline.snapshot.RunSnapshotStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for starting, inspecting and resuming pipeline runs. Each run executes on a worker
 * thread of its own; distinct runs share only the read-only index and the capabilities.
 *
 * <p>Status readers never touch the state of an active run. They see the {@link RunProgress} the
 * worker last published. A run whose terminal snapshot could not be saved stays readable from
 * memory until a later save succeeds.
 */
@Service
@Slf4j
public class PipelineService {

  private final PipelineExecutor pipelineExecutor;
  private final RunSnapshotStore snapshotStore;
  private final Executor runExecutor;
  private final Map<String, ActiveRun> activeRuns = new ConcurrentHashMap<>();
  private final Map<String, RunSnapshot> unsavedRuns = new ConcurrentHashMap<>();

  public PipelineService(
      PipelineExecutor pipelineExecutor,
      RunSnapshotStore snapshotStore,
      @Qualifier("pipelineRunExecutor") Executor runExecutor) {
    this.pipelineExecutor = pipelineExecutor;
    this.snapshotStore = snapshotStore;
    this.runExecutor = runExecutor;
  }

  /** Starts a run in the background and returns its id immediately. */
  public String start(TopicSpec topic) {
    String runId = UUID.randomUUID().toString();
    PipelineState state = PipelineState.start(runId, topic);
    submit(state, Stage.RESEARCH);
    log.info("Started run {} for '{}'", runId, topic.title());
    return runId;
  }

  /** Runs a topic to completion on the calling thread. */
  public PipelineState runSync(TopicSpec topic) {
    PipelineState state = PipelineState.start(UUID.randomUUID().toString(), topic);
    ActiveRun run = ActiveRun.of(state, Stage.RESEARCH);
    activeRuns.put(state.getRunId(), run);
    try {
      return pipelineExecutor.resume(state, Stage.RESEARCH, run.token(), run.progress()::set);
    } finally {
      release(run);
    }
  }

  /** Requests cancellation; the run stops before its next stage. */
  public void cancel(String runId) {
    ActiveRun run = activeRuns.get(runId);
    if (run != null) {
      run.token().cancel();
      log.info("Cancellation requested for run {}", runId);
      return;
    }
    RunSnapshot snapshot = latestFinished(runId).orElseThrow(() -> new RunNotFoundException(runId));
    throw new RunNotResumableException(
        runId, "already finished with status " + snapshot.status());
  }

  /**
   * Current view of a run. An active run reports its live stage without its state; a finished run
   * reports its latest snapshot.
   */
  public RunSnapshot getRun(String runId) {
    ActiveRun run = activeRuns.get(runId);
    if (run != null) {
      return liveView(run);
    }
    return latestFinished(runId).orElseThrow(() -> new RunNotFoundException(runId));
  }

  /** Active runs first, then persisted runs, newest first. */
  public List<RunSnapshot> listRuns() {
    List<RunSnapshot> runs = new ArrayList<>();
    activeRuns.values().stream()
        .map(PipelineService::liveView)
        .sorted(Comparator.comparing(RunSnapshot::savedAt).reversed())
        .forEach(runs::add);
    unsavedRuns.values().stream()
        .filter(snapshot -> !activeRuns.containsKey(snapshot.runId()))
        .sorted(Comparator.comparing(RunSnapshot::savedAt).reversed())
        .forEach(runs::add);
    snapshotStore.findAllLatest().stream()
        .filter(snapshot -> !activeRuns.containsKey(snapshot.runId()))
        .filter(snapshot -> !unsavedRuns.containsKey(snapshot.runId()))
        .forEach(runs::add);
    return runs;
  }

  /** Re-attempts only the Publish stage of a run that failed while publishing. */
  public String retryPublish(String runId) {
    PipelineState state = finishedState(runId);
    if (state.getStatus() != RunStatus.FAILED || state.getCurrentStage() != Stage.PUBLISH) {
      throw new RunNotResumableException(runId, "only runs that failed at PUBLISH can be retried");
    }
    if (state.getFinalContent() == null) {
      throw new RunNotResumableException(runId, "no final content was saved");
    }
    submit(state, Stage.PUBLISH);
    log.info("Retrying publish for run {}", runId);
    return runId;
  }

  /** Overrides the quality gate for an escalated run and continues from Optimize. */
  public String approveEscalated(String runId) {
    PipelineState state = finishedState(runId);
    if (state.getStatus() != RunStatus.ESCALATED || state.getDraft() == null) {
      throw new RunNotResumableException(runId, "only escalated runs can be approved");
    }
    String score =
        state
            .latestCritique()
            .map(c -> String.format(Locale.ROOT, " (score %.3f)", c.score()))
            .orElse("");
    state.addWarning("Manually approved after escalation" + score);
    submit(state, Stage.OPTIMIZE);
    log.info("Approved escalated run {}", runId);
    return runId;
  }

  /**
   * Publishes a completed run again, updating the existing post in place with the configured
   * visibility.
   */
  public String republish(String runId) {
    PipelineState state = finishedState(runId);
    if (state.getStatus() != RunStatus.DONE || state.getPublishResult() == null) {
      throw new RunNotResumableException(runId, "only published runs can be republished");
    }
    submit(state, Stage.PUBLISH);
    log.info("Republishing run {} as post {}", runId, state.getPublishResult().postId());
    return runId;
  }

  boolean isActive(String runId) {
    return activeRuns.containsKey(runId);
  }

  private PipelineState finishedState(String runId) {
    if (activeRuns.containsKey(runId)) {
      throw new RunNotResumableException(runId, "run is still in progress");
    }
    RunSnapshot snapshot = latestFinished(runId).orElseThrow(() -> new RunNotFoundException(runId));
    if (snapshot.state() == null) {
      throw new RunNotResumableException(runId, "snapshot carries no state");
    }
    return snapshot.state();
  }

  private void submit(PipelineState state, Stage from) {
    String runId = state.getRunId();
    ActiveRun run = ActiveRun.of(state, from);
    if (activeRuns.putIfAbsent(runId, run) != null) {
      throw new RunNotResumableException(runId, "run is still in progress");
    }
    try {
      runExecutor.execute(() -> execute(run, from));
    } catch (RuntimeException e) {
      activeRuns.remove(runId);
      throw e;
    }
  }

  private void execute(ActiveRun run, Stage from) {
    PipelineState state = run.state();
    try {
      pipelineExecutor.resume(state, from, run.token(), run.progress()::set);
    } catch (RuntimeException e) {
      log.error("Run {} aborted: {}", run.runId(), e.getMessage(), e);
      if (state.getStatus() == RunStatus.RUNNING) {
        state.setStatus(RunStatus.FAILED);
        state.setErrorClass(ErrorClass.FATAL);
        state.setErrorMessage("Aborted: " + e.getMessage());
        state.setFinishedAt(Instant.now());
      }
    } finally {
      release(run);
    }
  }

  /** Keeps an unsaved terminal state readable before the run stops being active. */
  private void release(ActiveRun run) {
    PipelineState state = run.state();
    if (state.isPersisted()) {
      unsavedRuns.remove(run.runId());
    } else if (state.getStatus() != RunStatus.RUNNING) {
      log.warn("Run {} ended {} without a saved snapshot", run.runId(), state.getStatus());
      unsavedRuns.put(run.runId(), RunSnapshot.of(state, Instant.now()));
    }
    activeRuns.remove(run.runId());
  }

  private Optional<RunSnapshot> latestFinished(String runId) {
    RunSnapshot unsaved = unsavedRuns.get(runId);
    return unsaved != null ? Optional.of(unsaved) : snapshotStore.findLatest(runId);
  }

  private static RunSnapshot liveView(ActiveRun run) {
    RunProgress progress = run.progress().get();
    return new RunSnapshot(
        run.runId(),
        RunStatus.RUNNING,
        progress.stage(),
        null,
        null,
        progress.lastCritique(),
        progress.updatedAt(),
        null);
  }

  /**
   * Bookkeeping for a run in flight. Only the worker touches {@code state}; readers use the id and
   * the progress reference.
   */
  private record ActiveRun(
      String runId,
      PipelineState state,
      CancellationToken token,
      AtomicReference<RunProgress> progress) {

    static ActiveRun of(PipelineState state, Stage from) {
      RunProgress initial =
          new RunProgress(from, state.latestCritique().orElse(null), Instant.now());
      return new ActiveRun(
          state.getRunId(), state, new CancellationToken(), new AtomicReference<>(initial));
    }
  }
}
