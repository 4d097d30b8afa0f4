package com.flamingo.ai.contentpipeline.api.rest;

import com.flamingo.ai.contentpipeline.api.dto.request.StartRunRequest;
import com.flamingo.ai.contentpipeline.api.dto.response.RunResponse;
import com.flamingo.ai.contentpipeline.service.pipeline.PipelineService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for pipeline runs. */
@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
public class PipelineRunController {

  private final PipelineService pipelineService;

  /** Starts a run in the background. */
  @PostMapping
  public ResponseEntity<RunResponse> startRun(@Valid @RequestBody StartRunRequest request) {
    String runId = pipelineService.start(request.toTopic());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(RunResponse.accepted(runId));
  }

  /** Lists active and persisted runs. */
  @GetMapping
  public ResponseEntity<List<RunResponse>> listRuns() {
    return ResponseEntity.ok(
        pipelineService.listRuns().stream().map(RunResponse::fromSnapshot).toList());
  }

  @GetMapping("/{runId}")
  public ResponseEntity<RunResponse> getRun(@PathVariable String runId) {
    return ResponseEntity.ok(RunResponse.fromSnapshot(pipelineService.getRun(runId)));
  }

  @PostMapping("/{runId}/cancel")
  public ResponseEntity<Void> cancelRun(@PathVariable String runId) {
    pipelineService.cancel(runId);
    return ResponseEntity.accepted().build();
  }

  /** Re-attempts publishing for a run that failed at the Publish stage. */
  @PostMapping("/{runId}/retry-publish")
  public ResponseEntity<RunResponse> retryPublish(@PathVariable String runId) {
    pipelineService.retryPublish(runId);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(accepted(runId));
  }

  /** Approves an escalated draft and continues from optimization. */
  @PostMapping("/{runId}/approve")
  public ResponseEntity<RunResponse> approveEscalated(@PathVariable String runId) {
    pipelineService.approveEscalated(runId);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(accepted(runId));
  }

  /** Updates the already published post of a completed run. */
  @PostMapping("/{runId}/republish")
  public ResponseEntity<RunResponse> republish(@PathVariable String runId) {
    pipelineService.republish(runId);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(accepted(runId));
  }

  private RunResponse accepted(String runId) {
    return RunResponse.fromSnapshot(pipelineService.getRun(runId));
  }
}
