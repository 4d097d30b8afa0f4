package com.flamingo.ai.contentpipeline.service.pipeline.stage;

import com.flamingo.ai.contentpipeline.domain.model.CritiqueIssue;
import com.flamingo.ai.contentpipeline.domain.model.Outline;
import com.flamingo.ai.contentpipeline.domain.model.OutlineSection;
import com.flamingo.ai.contentpipeline.domain.model.RetrievalContext;
import com.flamingo.ai.contentpipeline.domain.model.ScoredChunk;
import java.util.List;

/** Renders pipeline state into the text blocks the writing agents read. */
final class PromptFormatting {

  private PromptFormatting() {}

  /** Numbered sources, {@code [1]} being the best match. */
  static String sources(RetrievalContext context) {
    StringBuilder sb = new StringBuilder();
    List<ScoredChunk> entries = context.entries();
    for (int i = 0; i < entries.size(); i++) {
      sb.append('[').append(i + 1).append("] ").append(entries.get(i).chunk().text().strip());
      sb.append("\n\n");
    }
    return sb.toString().strip();
  }

  static String outline(Outline outline) {
    StringBuilder sb = new StringBuilder("# ").append(outline.title()).append('\n');
    for (OutlineSection section : outline.sections()) {
      sb.append("## ")
          .append(section.heading())
          .append(" (~")
          .append(section.estimatedWords())
          .append(" words)\n");
      section.keyPoints().forEach(point -> sb.append("- ").append(point).append('\n'));
    }
    return sb.toString().strip();
  }

  static String feedback(List<CritiqueIssue> issues) {
    if (issues.isEmpty()) {
      return "- Overall quality is below the bar. Tighten the prose and ground it in the sources.";
    }
    StringBuilder sb = new StringBuilder();
    for (CritiqueIssue issue : issues) {
      sb.append("- ")
          .append(issue.kind())
          .append(" at ")
          .append(issue.location())
          .append(": ")
          .append(issue.detail())
          .append('\n');
    }
    return sb.toString().strip();
  }
}
