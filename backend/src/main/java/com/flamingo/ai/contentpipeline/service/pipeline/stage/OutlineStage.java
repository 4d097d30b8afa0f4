package com.flamingo.ai.contentpipeline.service.pipeline.stage;

import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.enums.Stage;
import com.flamingo.ai.contentpipeline.domain.model.Outline;
import com.flamingo.ai.contentpipeline.domain.model.OutlineSection;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.domain.model.RetrievalContext;
import com.flamingo.ai.contentpipeline.domain.model.ScoredChunk;
import com.flamingo.ai.contentpipeline.domain.model.TopicSpec;
import com.flamingo.ai.contentpipeline.exception.FatalCapabilityException;
import com.flamingo.ai.contentpipeline.service.capability.CapabilityInvoker;
import com.flamingo.ai.contentpipeline.service.capability.GenerationTask;
import com.flamingo.ai.contentpipeline.service.capability.Generator;
import com.flamingo.ai.contentpipeline.service.capability.PromptContext;
import com.flamingo.ai.contentpipeline.service.pipeline.quality.TextAnalysis;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Asks the generator for an outline and grounds each section in the retrieved chunks it cites.
 * Sections that cite nothing usable are grounded in the chunks sharing the most words with their
 * heading and key points.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutlineStage implements StageNode {

  static final int DEFAULT_SECTION_WORDS = 250;
  static final int FALLBACK_CHUNKS_PER_SECTION = 2;

  private static final Pattern TITLE = Pattern.compile("^#\\s+(.+?)\\s*$");
  private static final Pattern SECTION =
      Pattern.compile(
          "^##\\s+(.+?)\\s*(?:\\(~?\\s*(\\d+)\\s*words?\\))?\\s*(?:\\[([\\d,\\s]*)\\])?\\s*$");
  private static final Pattern BULLET = Pattern.compile("^\\s*[-*]\\s+(.+?)\\s*$");

  private final Generator generator;
  private final CapabilityInvoker capabilityInvoker;

  @Override
  public Stage stage() {
    return Stage.OUTLINE;
  }

  @Override
  public StageOutcome execute(PipelineState state) {
    TopicSpec topic = state.getTopic();
    RetrievalContext context = state.getRetrievalContext();
    PromptContext prompt =
        new PromptContext(
            GenerationTask.OUTLINE,
            Map.of(
                "title", topic.title(),
                "description", nullToEmpty(topic.description()),
                "keywords", String.join(", ", topic.keywords()),
                "audience", topic.targetAudience(),
                "tone", topic.tone(),
                "confidenceNote",
                    state.isLowConfidence()
                        ? "Note: the sources are only loosely related. Keep the scope narrow."
                        : "",
                "sources", PromptFormatting.sources(context)));

    String text;
    try {
      text = capabilityInvoker.invoke("generator.outline", () -> generator.generate(prompt));
    } catch (FatalCapabilityException e) {
      return StageOutcome.failed(ErrorClass.FATAL, "Outline generation failed: " + e.getMessage());
    }

    Outline outline = parse(text, topic.title(), context);
    if (outline.sections().isEmpty()) {
      return StageOutcome.failed(ErrorClass.FATAL, "Generated outline has no sections");
    }
    state.setOutline(outline);
    log.info(
        "Run {} outlined {} sections (~{} words)",
        state.getRunId(),
        outline.sections().size(),
        outline.estimatedWords());
    return StageOutcome.success();
  }

  static Outline parse(String text, String fallbackTitle, RetrievalContext context) {
    String title = fallbackTitle;
    List<SectionDraft> drafts = new ArrayList<>();

    for (String line : text.split("\n")) {
      Matcher section = SECTION.matcher(line);
      if (section.matches()) {
        drafts.add(new SectionDraft(section.group(1), section.group(2), section.group(3)));
        continue;
      }
      Matcher heading = TITLE.matcher(line);
      if (heading.matches() && drafts.isEmpty()) {
        title = heading.group(1);
        continue;
      }
      Matcher bullet = BULLET.matcher(line);
      if (bullet.matches() && !drafts.isEmpty()) {
        drafts.get(drafts.size() - 1).keyPoints.add(bullet.group(1));
      }
    }

    List<OutlineSection> sections = new ArrayList<>();
    for (int i = 0; i < drafts.size(); i++) {
      SectionDraft draft = drafts.get(i);
      int words =
          draft.words == null ? DEFAULT_SECTION_WORDS : Integer.parseInt(draft.words.strip());
      sections.add(
          new OutlineSection(
              draft.heading, words, draft.keyPoints, ground(draft, i, context)));
    }
    return new Outline(title, sections);
  }

  private static List<String> ground(SectionDraft draft, int index, RetrievalContext context) {
    List<ScoredChunk> entries = context.entries();
    if (entries.isEmpty()) {
      return List.of();
    }

    Set<String> cited = new LinkedHashSet<>();
    if (draft.citations != null) {
      for (String number : draft.citations.split(",")) {
        String trimmed = number.strip();
        if (trimmed.isEmpty()) {
          continue;
        }
        int position = Integer.parseInt(trimmed);
        if (position >= 1 && position <= entries.size()) {
          cited.add(entries.get(position - 1).chunk().id());
        }
      }
    }
    if (!cited.isEmpty()) {
      return List.copyOf(cited);
    }

    Set<String> sectionTokens =
        TextAnalysis.contentTokens(draft.heading + " " + String.join(" ", draft.keyPoints));
    List<String> byOverlap =
        IntStream.range(0, entries.size())
            .boxed()
            .map(
                i ->
                    new Overlap(
                        i,
                        TextAnalysis.coverage(
                            sectionTokens,
                            TextAnalysis.contentTokens(entries.get(i).chunk().text()))))
            .filter(o -> o.coverage() > 0)
            .sorted(Comparator.comparingDouble(Overlap::coverage).reversed())
            .limit(FALLBACK_CHUNKS_PER_SECTION)
            .map(o -> entries.get(o.position()).chunk().id())
            .toList();
    if (!byOverlap.isEmpty()) {
      return byOverlap;
    }
    return List.of(entries.get(index % entries.size()).chunk().id());
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private record Overlap(int position, double coverage) {}

  private static final class SectionDraft {
    private final String heading;
    private final String words;
    private final String citations;
    private final List<String> keyPoints = new ArrayList<>();

    private SectionDraft(String heading, String words, String citations) {
      this.heading = heading;
      this.words = words;
      this.citations = citations;
    }
  }
}
