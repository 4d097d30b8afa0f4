package com.flamingo.ai.contentpipeline.domain.model;

import java.util.List;

/** The immutable input of a run: what to write about and for whom. Blank keywords are dropped. */
public record TopicSpec(
    String title, String description, List<String> keywords, String targetAudience, String tone) {

  public static final String DEFAULT_AUDIENCE = "technical readers";
  public static final String DEFAULT_TONE = "informative and engaging";

  public TopicSpec {
    keywords =
        keywords == null
            ? List.of()
            : keywords.stream().filter(k -> k != null && !k.isBlank()).map(String::strip).toList();
    targetAudience =
        targetAudience == null || targetAudience.isBlank() ? DEFAULT_AUDIENCE : targetAudience;
    tone = tone == null || tone.isBlank() ? DEFAULT_TONE : tone;
  }
}
