package com.flamingo.ai.contentpipeline.domain.model;

import java.util.List;

/**
 * One planned section of the post.
 *
 * @param heading section heading
 * @param estimatedWords target length in words
 * @param keyPoints points the section should cover
 * @param groundingChunkIds ids of the retrieved chunks this section is grounded in
 */
public record OutlineSection(
    String heading, int estimatedWords, List<String> keyPoints, List<String> groundingChunkIds) {

  public OutlineSection {
    keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
    groundingChunkIds = groundingChunkIds == null ? List.of() : List.copyOf(groundingChunkIds);
  }
}
