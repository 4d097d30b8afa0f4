package com.flamingo.ai.contentpipeline.service.pipeline.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contentpipeline.config.PipelineConfig;
import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.model.Chunk;
import com.flamingo.ai.contentpipeline.domain.model.Outline;
import com.flamingo.ai.contentpipeline.domain.model.OutlineSection;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.domain.model.RetrievalContext;
import com.flamingo.ai.contentpipeline.domain.model.ScoredChunk;
import com.flamingo.ai.contentpipeline.domain.model.TopicSpec;
import com.flamingo.ai.contentpipeline.service.capability.CapabilityInvoker;
import com.flamingo.ai.contentpipeline.service.capability.Generator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutlineStage Tests")
class OutlineStageTest {

  private static final RetrievalContext CONTEXT =
      new RetrievalContext(
          "virtual threads",
          List.of(
              new ScoredChunk(
                  new Chunk("a#0", "a", 0, 0, 40, "Virtual threads are cheap and scalable."), 0.9),
              new ScoredChunk(
                  new Chunk("b#0", "b", 0, 0, 50, "Pinning occurs inside synchronized blocks."),
                  0.8)),
          false);

  private static final String OUTLINE =
      """
      # Virtual Threads in Practice
      ## Why Virtual Threads (~300 words) [1, 2]
      - cheap
      - scalable
      ## Pinning [9]
      - synchronized blocks
      ## Wrap-up
      """;

  @Mock private Generator generator;

  private OutlineStage stage;

  @BeforeEach
  void setUp() {
    PipelineConfig config = new PipelineConfig();
    config.getRetry().setBackoffBase(Duration.ofMillis(1));
    stage =
        new OutlineStage(generator, new CapabilityInvoker(config, new SimpleMeterRegistry()));
  }

  @Test
  @DisplayName("Should parse title, sections, estimates and key points")
  void shouldParseOutline() {
    Outline outline = OutlineStage.parse(OUTLINE, "Fallback", CONTEXT);

    assertThat(outline.title()).isEqualTo("Virtual Threads in Practice");
    assertThat(outline.sections())
        .extracting(OutlineSection::heading)
        .containsExactly("Why Virtual Threads", "Pinning", "Wrap-up");
    assertThat(outline.sections().get(0).estimatedWords()).isEqualTo(300);
    assertThat(outline.sections().get(0).keyPoints()).containsExactly("cheap", "scalable");
    assertThat(outline.sections().get(1).estimatedWords())
        .isEqualTo(OutlineStage.DEFAULT_SECTION_WORDS);
  }

  @Test
  @DisplayName("Should ground every section in at least one retrieved chunk")
  void shouldGroundEverySection() {
    Outline outline = OutlineStage.parse(OUTLINE, "Fallback", CONTEXT);

    // cited sources
    assertThat(outline.sections().get(0).groundingChunkIds()).containsExactly("a#0", "b#0");
    // out-of-range citation falls back to word overlap
    assertThat(outline.sections().get(1).groundingChunkIds()).containsExactly("b#0");
    // no overlap at all falls back to position
    assertThat(outline.sections().get(2).groundingChunkIds()).containsExactly("a#0");
  }

  @Test
  @DisplayName("Should keep the topic title when the outline has none")
  void shouldKeepTopicTitle() {
    Outline outline = OutlineStage.parse("## Only Section\n- point", "Fallback", CONTEXT);

    assertThat(outline.title()).isEqualTo("Fallback");
    assertThat(outline.sections()).hasSize(1);
  }

  @Test
  @DisplayName("Should store the parsed outline on the state")
  void shouldStoreOutline() {
    when(generator.generate(any())).thenReturn(OUTLINE);
    PipelineState state = stateWithContext();

    StageOutcome outcome = stage.execute(state);

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.SUCCESS);
    assertThat(state.getOutline().sections()).hasSize(3);
  }

  @Test
  @DisplayName("Should fail when the generated outline has no sections")
  void shouldFailWithoutSections() {
    when(generator.generate(any())).thenReturn("I cannot help with that.");
    PipelineState state = stateWithContext();

    StageOutcome outcome = stage.execute(state);

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.FAILED);
    assertThat(outcome.errorClass()).isEqualTo(ErrorClass.FATAL);
    assertThat(state.getOutline()).isNull();
  }

  private static PipelineState stateWithContext() {
    PipelineState state =
        PipelineState.start(
            "run-1", new TopicSpec("Virtual Threads", null, List.of("java"), null, null));
    state.setRetrievalContext(CONTEXT);
    return state;
  }
}
