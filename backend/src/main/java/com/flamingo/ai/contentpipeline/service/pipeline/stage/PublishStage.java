package com.flamingo.ai.contentpipeline.service.pipeline.stage;

import com.flamingo.ai.contentpipeline.config.PipelineConfig;
import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.enums.Stage;
import com.flamingo.ai.contentpipeline.domain.enums.Visibility;
import com.flamingo.ai.contentpipeline.domain.model.FinalContent;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.domain.model.PublishResult;
import com.flamingo.ai.contentpipeline.exception.FatalCapabilityException;
import com.flamingo.ai.contentpipeline.exception.PublishException;
import com.flamingo.ai.contentpipeline.exception.TransientCapabilityException;
import com.flamingo.ai.contentpipeline.service.capability.CapabilityInvoker;
import com.flamingo.ai.contentpipeline.service.publish.Publisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Publishes the final content, or updates the existing post when the run was already published.
 * Transient platform failures are retried with backoff; anything else fails the run with its state
 * kept for a manual retry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PublishStage implements StageNode {

  private final Publisher publisher;
  private final CapabilityInvoker capabilityInvoker;
  private final PipelineConfig pipelineConfig;

  @Override
  public Stage stage() {
    return Stage.PUBLISH;
  }

  @Override
  public StageOutcome execute(PipelineState state) {
    FinalContent content = state.getFinalContent();
    if (content == null) {
      return StageOutcome.failed(ErrorClass.FATAL, "No final content to publish");
    }
    Visibility visibility = pipelineConfig.getPublish().getVisibility();
    PublishResult existing = state.getPublishResult();

    try {
      PublishResult result =
          capabilityInvoker.invoke(
              "publisher", () -> publishOnce(existing, content, visibility));
      state.setPublishResult(result);
      log.info(
          "Run {} {} as {}: {}",
          state.getRunId(),
          existing == null ? "published" : "updated",
          visibility,
          result.url());
      return StageOutcome.success();
    } catch (FatalCapabilityException e) {
      return StageOutcome.failed(ErrorClass.PUBLISH, "Publishing failed: " + e.getMessage());
    }
  }

  private PublishResult publishOnce(
      PublishResult existing, FinalContent content, Visibility visibility) {
    try {
      return existing == null
          ? publisher.publish(content, visibility)
          : publisher.update(existing.postId(), content, visibility);
    } catch (PublishException e) {
      if (e.isTransientFailure()) {
        throw new TransientCapabilityException("publisher", e.getMessage(), e);
      }
      throw new FatalCapabilityException("publisher", e.getMessage(), e);
    }
  }
}
