package com.flamingo.ai.contentpipeline.service.rag.chunking;

import com.flamingo.ai.contentpipeline.config.RagConfig;
import com.flamingo.ai.contentpipeline.domain.model.Chunk;
import com.flamingo.ai.contentpipeline.domain.model.SourceDocument;
import java.util.List;

/**
 * Splits a {@link SourceDocument} into {@link Chunk}s ready for embedding.
 *
 * <p>Implementations must be stateless, deterministic and safe for concurrent use: chunking an
 * unchanged document with the same configuration always yields the same spans.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from the document text.
   *
   * @param document the decoded document
   * @param config RAG configuration (chunk size and overlap)
   * @return ordered list of chunks, empty for an empty document
   */
  List<Chunk> chunk(SourceDocument document, RagConfig config);
}
