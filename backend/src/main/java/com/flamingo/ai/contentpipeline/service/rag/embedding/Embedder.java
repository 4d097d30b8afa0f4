package com.flamingo.ai.contentpipeline.service.rag.embedding;

import com.flamingo.ai.contentpipeline.exception.TransientCapabilityException;

/**
 * Embedding capability: maps text to a fixed-length vector. Queries and passages are embedded
 * asymmetrically so retrieval matches questions against document passages.
 */
public interface Embedder {

  /**
   * @throws TransientCapabilityException on network or rate-limit failures
   */
  float[] embedQuery(String query);

  /**
   * @throws TransientCapabilityException on network or rate-limit failures
   */
  float[] embedPassage(String passage);
}
