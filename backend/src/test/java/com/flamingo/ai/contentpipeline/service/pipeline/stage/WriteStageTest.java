package com.flamingo.ai.contentpipeline.service.pipeline.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contentpipeline.config.PipelineConfig;
import com.flamingo.ai.contentpipeline.domain.enums.IssueKind;
import com.flamingo.ai.contentpipeline.domain.model.CritiqueIssue;
import com.flamingo.ai.contentpipeline.domain.model.CritiqueResult;
import com.flamingo.ai.contentpipeline.domain.model.DraftContent;
import com.flamingo.ai.contentpipeline.domain.model.DraftSection;
import com.flamingo.ai.contentpipeline.domain.model.Outline;
import com.flamingo.ai.contentpipeline.domain.model.OutlineSection;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.domain.model.RetrievalContext;
import com.flamingo.ai.contentpipeline.domain.model.TopicSpec;
import com.flamingo.ai.contentpipeline.service.capability.CapabilityInvoker;
import com.flamingo.ai.contentpipeline.service.capability.GenerationTask;
import com.flamingo.ai.contentpipeline.service.capability.Generator;
import com.flamingo.ai.contentpipeline.service.capability.PromptContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("WriteStage Tests")
class WriteStageTest {

  private static final Outline OUTLINE =
      new Outline(
          "Virtual Threads in Practice",
          List.of(
              new OutlineSection("Why Virtual Threads", 300, List.of(), List.of("a#0")),
              new OutlineSection("Pinning", 200, List.of(), List.of("b#0", "b#1"))));

  @Mock private Generator generator;

  private WriteStage stage;

  @BeforeEach
  void setUp() {
    PipelineConfig config = new PipelineConfig();
    config.getRetry().setBackoffBase(Duration.ofMillis(1));
    stage = new WriteStage(generator, new CapabilityInvoker(config, new SimpleMeterRegistry()));
  }

  @Test
  @DisplayName("Should split markdown into sections with outline attributions")
  void shouldSplitIntoAttributedSections() {
    String markdown =
        "# Loom Explained\n## why virtual threads?\nBody one.\n\n## Extra Notes\nBody two.\n";

    DraftContent draft = WriteStage.split(markdown, OUTLINE, 2);

    assertThat(draft.title()).isEqualTo("Loom Explained");
    assertThat(draft.attempt()).isEqualTo(2);
    assertThat(draft.markdown()).isEqualTo(markdown);
    assertThat(draft.sections())
        .extracting(DraftSection::heading, DraftSection::body)
        .containsExactly(
            tuple("why virtual threads?", "Body one."),
            tuple("Extra Notes", "Body two."));
    assertThat(draft.sections().get(0).sourceChunkIds()).containsExactly("a#0");
    assertThat(draft.sections().get(1).sourceChunkIds()).isEmpty();
  }

  @Test
  @DisplayName("Should treat markdown without headings as one section citing every source")
  void shouldTreatUnstructuredMarkdownAsOneSection() {
    DraftContent draft = WriteStage.split("Just a paragraph.", OUTLINE, 1);

    assertThat(draft.title()).isEqualTo("Virtual Threads in Practice");
    assertThat(draft.sections()).hasSize(1);
    assertThat(draft.sections().get(0).sourceChunkIds()).containsExactly("a#0", "b#0", "b#1");
  }

  @Test
  @DisplayName("Should draft from the outline on the first attempt")
  void shouldDraftOnFirstAttempt() {
    when(generator.generate(any())).thenReturn("## Why Virtual Threads\nBody.");
    PipelineState state = state();

    StageOutcome outcome = stage.execute(state);

    assertThat(outcome.type()).isEqualTo(StageOutcome.Type.SUCCESS);
    assertThat(state.getDraftAttempts()).isEqualTo(1);
    assertThat(state.getDraft().attempt()).isEqualTo(1);
    ArgumentCaptor<PromptContext> prompt = ArgumentCaptor.forClass(PromptContext.class);
    verify(generator).generate(prompt.capture());
    assertThat(prompt.getValue().task()).isEqualTo(GenerationTask.DRAFT);
  }

  @Test
  @DisplayName("Should revise the previous draft against the latest critique")
  void shouldReviseAgainstLatestCritique() {
    when(generator.generate(any())).thenReturn("## Why Virtual Threads\nBetter body.");
    PipelineState state = state();
    state.setDraft(WriteStage.split("## Why Virtual Threads\nOld body.", OUTLINE, 1));
    state.setDraftAttempts(1);
    state.recordCritique(
        new CritiqueResult(
            0.5,
            0.5,
            0,
            0.5,
            List.of(new CritiqueIssue(IssueKind.MISSING_SECTION, "section:Pinning", "missing")),
            null,
            0));

    stage.execute(state);

    ArgumentCaptor<PromptContext> prompt = ArgumentCaptor.forClass(PromptContext.class);
    verify(generator).generate(prompt.capture());
    assertThat(prompt.getValue().task()).isEqualTo(GenerationTask.REVISE);
    assertThat(prompt.getValue().variable("feedback")).contains("section:Pinning");
    assertThat(prompt.getValue().variable("draft")).contains("Old body.");
    assertThat(state.getDraft().attempt()).isEqualTo(2);
  }

  private static PipelineState state() {
    PipelineState state =
        PipelineState.start("run-1", new TopicSpec("Virtual Threads", null, null, null, null));
    state.setRetrievalContext(new RetrievalContext("q", List.of(), false));
    state.setOutline(OUTLINE);
    return state;
  }
}
