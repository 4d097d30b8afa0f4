package com.flamingo.ai.contentpipeline.api.dto.response;

import com.flamingo.ai.contentpipeline.service.rag.ingestion.IngestionReport;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an ingestion or rebuild. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionReportResponse {

  private int ingested;
  private int duplicates;
  private List<String> failed;
  private int chunksAdded;
  private int totalChunks;

  public static IngestionReportResponse from(IngestionReport report) {
    return IngestionReportResponse.builder()
        .ingested(report.ingested())
        .duplicates(report.duplicates())
        .failed(report.failed())
        .chunksAdded(report.chunksAdded())
        .totalChunks(report.totalChunks())
        .build();
  }
}
