package com.flamingo.ai.contentpipeline.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for corpus and index statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorpusStatsResponse {

  private int documentCount;
  private int chunkCount;
  private int indexedChunks;
  private int dimension;
  private boolean ingestionInProgress;
}
