package com.flamingo.ai.contentpipeline.service.rag.ingestion;

import java.util.List;

/**
 * Outcome of one ingestion or rebuild.
 *
 * @param ingested documents newly added to the corpus
 * @param duplicates files skipped because their content hash was already ingested
 * @param failed files skipped because they could not be decoded or embedded
 * @param chunksAdded chunks added to the index
 * @param totalChunks chunks in the active index afterwards
 */
public record IngestionReport(
    int ingested, int duplicates, List<String> failed, int chunksAdded, int totalChunks) {

  public IngestionReport {
    failed = failed == null ? List.of() : List.copyOf(failed);
  }
}
