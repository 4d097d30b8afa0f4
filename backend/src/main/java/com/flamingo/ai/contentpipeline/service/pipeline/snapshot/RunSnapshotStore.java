package com.flamingo.ai.contentpipeline.service.pipeline.snapshot;

import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.domain.model.RunSnapshot;
import java.util.List;
import java.util.Optional;

/** Durable storage for the terminal state of pipeline runs. */
public interface RunSnapshotStore {

  /**
   * Persists the state as a new snapshot. Earlier snapshots of the same run are kept.
   *
   * @return the snapshot that was written
   */
  RunSnapshot save(PipelineState state);

  /** Most recent snapshot of the run, if any was ever written. */
  Optional<RunSnapshot> findLatest(String runId);

  /** Most recent snapshot of every persisted run, newest first. */
  List<RunSnapshot> findAllLatest();
}
