package com.flamingo.ai.contentpipeline.domain.model;

import java.util.List;

/** A written section with the chunk ids it inherits from its outline section. */
public record DraftSection(String heading, String body, List<String> sourceChunkIds) {

  public DraftSection {
    sourceChunkIds = sourceChunkIds == null ? List.of() : List.copyOf(sourceChunkIds);
  }
}
