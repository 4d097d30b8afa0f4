package com.flamingo.ai.contentpipeline.domain.model;

import java.util.List;

/** Ordered plan of the post produced by the outline stage. */
public record Outline(String title, List<OutlineSection> sections) {

  public Outline {
    sections = sections == null ? List.of() : List.copyOf(sections);
  }

  public int estimatedWords() {
    return sections.stream().mapToInt(OutlineSection::estimatedWords).sum();
  }
}
