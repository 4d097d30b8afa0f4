package com.flamingo.ai.contentpipeline.service.pipeline.stage;

import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.enums.Stage;
import com.flamingo.ai.contentpipeline.domain.model.CritiqueResult;
import com.flamingo.ai.contentpipeline.domain.model.DraftContent;
import com.flamingo.ai.contentpipeline.domain.model.DraftSection;
import com.flamingo.ai.contentpipeline.domain.model.Outline;
import com.flamingo.ai.contentpipeline.domain.model.OutlineSection;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.domain.model.TopicSpec;
import com.flamingo.ai.contentpipeline.exception.FatalCapabilityException;
import com.flamingo.ai.contentpipeline.service.capability.CapabilityInvoker;
import com.flamingo.ai.contentpipeline.service.capability.GenerationTask;
import com.flamingo.ai.contentpipeline.service.capability.Generator;
import com.flamingo.ai.contentpipeline.service.capability.PromptContext;
import com.flamingo.ai.contentpipeline.service.pipeline.quality.TextAnalysis;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes the draft. The first attempt drafts from the outline; later attempts revise the previous
 * draft against the issues of the latest critique. Each {@code ## } section of the generated
 * markdown inherits the source attributions of the outline section with the same heading.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WriteStage implements StageNode {

  private final Generator generator;
  private final CapabilityInvoker capabilityInvoker;

  @Override
  public Stage stage() {
    return Stage.WRITE;
  }

  @Override
  public StageOutcome execute(PipelineState state) {
    Outline outline = state.getOutline();
    if (outline == null) {
      return StageOutcome.failed(ErrorClass.FATAL, "No outline to write from");
    }
    int attempt = state.getDraftAttempts() + 1;
    Optional<CritiqueResult> feedback = state.latestCritique();
    boolean revising = feedback.isPresent() && state.getDraft() != null;

    PromptContext prompt = revising ? revisePrompt(state, feedback.get()) : draftPrompt(state);
    String markdown;
    try {
      String capability = "generator." + prompt.task().name().toLowerCase(Locale.ROOT);
      markdown = capabilityInvoker.invoke(capability, () -> generator.generate(prompt));
    } catch (FatalCapabilityException e) {
      return StageOutcome.failed(ErrorClass.FATAL, "Drafting failed: " + e.getMessage());
    }

    DraftContent draft = split(markdown, outline, attempt);
    state.setDraftAttempts(attempt);
    state.setDraft(draft);
    log.info(
        "Run {} wrote draft {} ({} sections, {} words{})",
        state.getRunId(),
        attempt,
        draft.sections().size(),
        TextAnalysis.wordCount(markdown),
        revising ? ", revision" : "");
    return StageOutcome.success();
  }

  private PromptContext draftPrompt(PipelineState state) {
    TopicSpec topic = state.getTopic();
    return new PromptContext(
        GenerationTask.DRAFT,
        Map.of(
            "title", state.getOutline().title(),
            "audience", topic.targetAudience(),
            "tone", topic.tone(),
            "outline", PromptFormatting.outline(state.getOutline()),
            "sources", PromptFormatting.sources(state.getRetrievalContext())));
  }

  private PromptContext revisePrompt(PipelineState state, CritiqueResult critique) {
    return new PromptContext(
        GenerationTask.REVISE,
        Map.of(
            "title", state.getOutline().title(),
            "outline", PromptFormatting.outline(state.getOutline()),
            "feedback", PromptFormatting.feedback(critique.issues()),
            "draft", state.getDraft().markdown(),
            "sources", PromptFormatting.sources(state.getRetrievalContext())));
  }

  /** Splits markdown at {@code ## } headings and attaches outline attributions. */
  static DraftContent split(String markdown, Outline outline, int attempt) {
    Map<String, OutlineSection> planned = new HashMap<>();
    for (OutlineSection section : outline.sections()) {
      planned.putIfAbsent(TextAnalysis.normalizeHeading(section.heading()), section);
    }

    String title = outline.title();
    List<DraftSection> sections = new ArrayList<>();
    String heading = null;
    StringBuilder body = new StringBuilder();
    for (String line : markdown.split("\n")) {
      if (line.startsWith("## ")) {
        if (heading != null) {
          sections.add(section(heading, body, planned));
        }
        heading = line.substring(3).strip();
        body.setLength(0);
      } else if (line.startsWith("# ") && heading == null) {
        title = line.substring(2).strip();
      } else if (heading != null) {
        body.append(line).append('\n');
      }
    }
    if (heading != null) {
      sections.add(section(heading, body, planned));
    }

    if (sections.isEmpty()) {
      Set<String> allSources = new LinkedHashSet<>();
      outline.sections().forEach(s -> allSources.addAll(s.groundingChunkIds()));
      sections.add(new DraftSection(title, markdown.strip(), List.copyOf(allSources)));
    }
    return new DraftContent(title, markdown, sections, attempt);
  }

  private static DraftSection section(
      String heading, StringBuilder body, Map<String, OutlineSection> planned) {
    OutlineSection source = planned.get(TextAnalysis.normalizeHeading(heading));
    List<String> attributions = source == null ? List.of() : source.groundingChunkIds();
    return new DraftSection(heading, body.toString().strip(), attributions);
  }
}
