package com.flamingo.ai.contentpipeline.service.pipeline.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contentpipeline.config.PipelineConfig;
import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.enums.Visibility;
import com.flamingo.ai.contentpipeline.domain.model.FinalContent;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.domain.model.PublishResult;
import com.flamingo.ai.contentpipeline.domain.model.TopicSpec;
import com.flamingo.ai.contentpipeline.exception.PublishException;
import com.flamingo.ai.contentpipeline.service.capability.CapabilityInvoker;
import com.flamingo.ai.contentpipeline.service.publish.Publisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("PublishStage Tests")
class PublishStageTest {

  private static final PublishResult PUBLISHED =
      new PublishResult("42", "https://blog.example/42", Visibility.DRAFT, Instant.EPOCH);

  @Mock private Publisher publisher;

  private PublishStage stage;
  private PipelineState state;

  @BeforeEach
  void setUp() {
    PipelineConfig config = new PipelineConfig();
    config.getRetry().setMaxAttempts(3);
    config.getRetry().setBackoffBase(Duration.ofMillis(1));
    CapabilityInvoker invoker = new CapabilityInvoker(config, new SimpleMeterRegistry());
    stage = new PublishStage(publisher, invoker, config);
    state = PipelineState.start("run-1", new TopicSpec("Loom", null, null, null, null));
    state.setFinalContent(new FinalContent("Loom", "Body", "Meta", List.of("Java"), "Tech", 1));
  }

  @Test
  @DisplayName("Should retry transient platform failures and record the post")
  void shouldRetryTransientFailures() {
    when(publisher.publish(any(), any()))
        .thenThrow(new PublishException("503 from platform", true))
        .thenReturn(PUBLISHED);

    StageOutcome outcome = stage.execute(state);

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.SUCCESS);
    assertThat(state.getPublishResult()).isEqualTo(PUBLISHED);
    verify(publisher, times(2)).publish(any(), any());
  }

  @Test
  @DisplayName("Should fail without retrying when the platform rejects the post")
  void shouldFailOnRejection() {
    when(publisher.publish(any(), any()))
        .thenThrow(new PublishException("invalid access token", false));

    StageOutcome outcome = stage.execute(state);

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.FAILED);
    assertThat(outcome.errorClass()).isEqualTo(ErrorClass.PUBLISH);
    assertThat(state.getPublishResult()).isNull();
    verify(publisher, times(1)).publish(any(), any());
  }

  @Test
  @DisplayName("Should fail after exhausting retries")
  void shouldFailAfterExhaustingRetries() {
    when(publisher.publish(any(), any())).thenThrow(new PublishException("timeout", true));

    StageOutcome outcome = stage.execute(state);

    assertThat(outcome.errorClass()).isEqualTo(ErrorClass.PUBLISH);
    verify(publisher, times(3)).publish(any(), any());
  }

  @Test
  @DisplayName("Should fail when there is nothing to publish")
  void shouldFailWithoutContent() {
    state.setFinalContent(null);

    StageOutcome outcome = stage.execute(state);

    assertThat(outcome.errorClass()).isEqualTo(ErrorClass.FATAL);
    verifyNoInteractions(publisher);
  }

  @Test
  @DisplayName("Should update the existing post when the run was already published")
  void shouldUpdateExistingPost() {
    state.setPublishResult(PUBLISHED);
    PublishResult updated =
        new PublishResult("42", "https://blog.example/42", Visibility.DRAFT, Instant.now());
    when(publisher.update(eq("42"), any(), any())).thenReturn(updated);

    StageOutcome outcome = stage.execute(state);

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.SUCCESS);
    assertThat(state.getPublishResult()).isEqualTo(updated);
    verify(publisher, never()).publish(any(), any());
  }
}
