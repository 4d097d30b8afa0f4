package com.flamingo.ai.contentpipeline.service.pipeline.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.model.Chunk;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.domain.model.RetrievalContext;
import com.flamingo.ai.contentpipeline.domain.model.ScoredChunk;
import com.flamingo.ai.contentpipeline.domain.model.TopicSpec;
import com.flamingo.ai.contentpipeline.exception.FatalCapabilityException;
import com.flamingo.ai.contentpipeline.service.rag.Retriever;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResearchStage Tests")
class ResearchStageTest {

  private static final TopicSpec TOPIC =
      new TopicSpec(
          "Virtual Threads",
          "How Loom changes server code",
          List.of("java", "loom"),
          null,
          null);

  @Mock private Retriever retriever;

  private ResearchStage stage;
  private PipelineState state;

  @BeforeEach
  void setUp() {
    stage = new ResearchStage(retriever);
    state = PipelineState.start("run-1", TOPIC);
  }

  private static RetrievalContext context(double score, boolean lowConfidence) {
    Chunk chunk = new Chunk("doc#0", "doc", 0, 0, 5, "text");
    return new RetrievalContext("q", List.of(new ScoredChunk(chunk, score)), lowConfidence);
  }

  @Test
  @DisplayName("Should broaden the query on each retry")
  void shouldBroadenQueryOnEachRetry() {
    assertThat(ResearchStage.buildQuery(TOPIC, 0))
        .isEqualTo("Virtual Threads How Loom changes server code java loom");
    assertThat(ResearchStage.buildQuery(TOPIC, 1)).isEqualTo("Virtual Threads java loom");
    assertThat(ResearchStage.buildQuery(TOPIC, 2)).isEqualTo("Virtual Threads");
  }

  @Test
  @DisplayName("Should store the retrieval context on success")
  void shouldStoreContextOnSuccess() {
    RetrievalContext context = context(0.9, false);
    when(retriever.retrieve(anyString())).thenReturn(context);

    StageOutcome outcome = stage.execute(state);

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.SUCCESS);
    assertThat(state.getRetrievalContext()).isSameAs(context);
    assertThat(state.isLowConfidence()).isFalse();
    assertThat(state.getWarnings()).isEmpty();
  }

  @Test
  @DisplayName("Should report insufficient grounding for an empty context")
  void shouldReportInsufficientGrounding() {
    when(retriever.retrieve(anyString())).thenReturn(RetrievalContext.empty("q"));

    StageOutcome outcome = stage.execute(state);

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.INSUFFICIENT_GROUNDING);
    assertThat(outcome.errorClass()).isEqualTo(ErrorClass.INSUFFICIENT_GROUNDING);
  }

  @Test
  @DisplayName("Should continue with a warning on low confidence")
  void shouldWarnOnLowConfidence() {
    when(retriever.retrieve(anyString())).thenReturn(context(0.25, true));

    StageOutcome outcome = stage.execute(state);

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.SUCCESS);
    assertThat(state.isLowConfidence()).isTrue();
    assertThat(state.getWarnings()).hasSize(1);
    assertThat(state.getWarnings().get(0)).contains("Low-confidence");
  }

  @Test
  @DisplayName("Should fail the stage when the embedder is unavailable")
  void shouldFailWhenEmbedderUnavailable() {
    when(retriever.retrieve(anyString()))
        .thenThrow(new FatalCapabilityException("embedder", "quota exceeded"));

    StageOutcome outcome = stage.execute(state);

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.FAILED);
    assertThat(outcome.errorClass()).isEqualTo(ErrorClass.FATAL);
  }
}
