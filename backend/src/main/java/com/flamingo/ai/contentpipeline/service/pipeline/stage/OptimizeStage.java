package com.flamingo.ai.contentpipeline.service.pipeline.stage;

import com.flamingo.ai.contentpipeline.config.PipelineConfig;
import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.enums.Stage;
import com.flamingo.ai.contentpipeline.domain.model.DraftContent;
import com.flamingo.ai.contentpipeline.domain.model.FinalContent;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.exception.FatalCapabilityException;
import com.flamingo.ai.contentpipeline.service.capability.CapabilityInvoker;
import com.flamingo.ai.contentpipeline.service.capability.GenerationTask;
import com.flamingo.ai.contentpipeline.service.capability.Generator;
import com.flamingo.ai.contentpipeline.service.capability.PromptContext;
import com.flamingo.ai.contentpipeline.service.pipeline.quality.TextAnalysis;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Polishes the approved draft and derives the publishing metadata. If the generator fails, the
 * approved draft is published as is and a warning is recorded.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OptimizeStage implements StageNode {

  static final int META_DESCRIPTION_LENGTH = 155;

  private static final Pattern MARKDOWN_LINK = Pattern.compile("!?\\[([^\\]]*)\\]\\([^)]*\\)");

  private final Generator generator;
  private final CapabilityInvoker capabilityInvoker;
  private final PipelineConfig pipelineConfig;

  @Override
  public Stage stage() {
    return Stage.OPTIMIZE;
  }

  @Override
  public StageOutcome execute(PipelineState state) {
    DraftContent draft = state.getDraft();
    if (draft == null) {
      return StageOutcome.failed(ErrorClass.FATAL, "No draft to optimize");
    }

    String markdown;
    try {
      PromptContext prompt =
          new PromptContext(
              GenerationTask.OPTIMIZE,
              Map.of(
                  "keywords", String.join(", ", state.getTopic().keywords()),
                  "draft", draft.markdown()));
      markdown = capabilityInvoker.invoke("generator.optimize", () -> generator.generate(prompt));
    } catch (FatalCapabilityException e) {
      log.warn(
          "Run {} optimization failed, using approved draft: {}",
          state.getRunId(),
          e.getMessage());
      state.addWarning("Optimization failed, published the approved draft: " + e.getMessage());
      markdown = draft.markdown();
    }

    FinalContent content = finalContent(markdown, draft.title(), state.getTopic().keywords());
    state.setFinalContent(content);
    log.info(
        "Run {} optimized '{}' ({} words)",
        state.getRunId(),
        content.title(),
        content.wordCount());
    return StageOutcome.success();
  }

  FinalContent finalContent(String markdown, String fallbackTitle, List<String> keywords) {
    String title = fallbackTitle;
    String body = markdown.strip();
    if (body.startsWith("# ")) {
      int lineEnd = body.indexOf('\n');
      title = (lineEnd < 0 ? body.substring(2) : body.substring(2, lineEnd)).strip();
      body = lineEnd < 0 ? "" : body.substring(lineEnd + 1).strip();
    }

    Set<String> tags = new LinkedHashSet<>(keywords);
    tags.addAll(pipelineConfig.getPublish().getDefaultTags());

    return new FinalContent(
        title,
        body,
        metaDescription(body),
        List.copyOf(tags),
        pipelineConfig.getPublish().getDefaultCategory(),
        TextAnalysis.wordCount(body));
  }

  /** First prose paragraph, without markdown markup, cut at a word boundary. */
  static String metaDescription(String body) {
    for (String paragraph : body.split("\\n\\s*\\n")) {
      String text = paragraph.strip();
      if (text.isEmpty() || text.startsWith("#") || text.startsWith("```")) {
        continue;
      }
      text =
          MARKDOWN_LINK
              .matcher(text)
              .replaceAll("$1")
              .replaceAll("[*_`>#]", "")
              .replaceAll("\\s+", " ")
              .strip();
      if (text.length() <= META_DESCRIPTION_LENGTH) {
        return text;
      }
      int cut = text.lastIndexOf(' ', META_DESCRIPTION_LENGTH - 3);
      return text.substring(0, cut > 0 ? cut : META_DESCRIPTION_LENGTH - 3) + "...";
    }
    return "";
  }
}
