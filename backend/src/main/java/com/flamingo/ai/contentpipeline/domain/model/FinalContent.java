package com.flamingo.ai.contentpipeline.domain.model;

import java.util.List;

/** Optimized, publish-ready content. */
public record FinalContent(
    String title,
    String body,
    String metaDescription,
    List<String> tags,
    String category,
    int wordCount) {

  public FinalContent {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }
}
