package com.flamingo.ai.contentpipeline.domain.model;

import java.util.List;

/**
 * A complete draft of the post.
 *
 * @param title post title
 * @param markdown full markdown text as generated
 * @param sections the text split into sections with per-section source attributions
 * @param attempt 1-based write attempt that produced this draft
 */
public record DraftContent(
    String title, String markdown, List<DraftSection> sections, int attempt) {

  public DraftContent {
    sections = sections == null ? List.of() : List.copyOf(sections);
  }
}
