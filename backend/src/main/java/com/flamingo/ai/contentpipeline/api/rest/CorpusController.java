package com.flamingo.ai.contentpipeline.api.rest;

import com.flamingo.ai.contentpipeline.api.dto.request.IngestRequest;
import com.flamingo.ai.contentpipeline.api.dto.response.CorpusStatsResponse;
import com.flamingo.ai.contentpipeline.api.dto.response.IngestionReportResponse;
import com.flamingo.ai.contentpipeline.service.rag.index.IndexSnapshot;
import com.flamingo.ai.contentpipeline.service.rag.index.VectorIndex;
import com.flamingo.ai.contentpipeline.service.rag.ingestion.CorpusIngestionService;
import com.flamingo.ai.contentpipeline.service.rag.ingestion.CorpusStore;
import jakarta.validation.Valid;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the knowledge corpus. */
@RestController
@RequestMapping("/api/corpus")
@RequiredArgsConstructor
public class CorpusController {

  private final CorpusIngestionService ingestionService;
  private final CorpusStore corpusStore;
  private final VectorIndex vectorIndex;

  /** Ingests a file or directory; already ingested content is skipped. */
  @PostMapping("/ingest")
  public ResponseEntity<IngestionReportResponse> ingest(@Valid @RequestBody IngestRequest request) {
    return ResponseEntity.ok(
        IngestionReportResponse.from(ingestionService.ingest(Path.of(request.getPath()))));
  }

  /** Re-chunks and re-embeds the whole corpus. */
  @PostMapping("/rebuild")
  public ResponseEntity<IngestionReportResponse> rebuild() {
    return ResponseEntity.ok(IngestionReportResponse.from(ingestionService.rebuild()));
  }

  @GetMapping("/stats")
  public ResponseEntity<CorpusStatsResponse> stats() {
    IndexSnapshot snapshot = vectorIndex.snapshot();
    return ResponseEntity.ok(
        CorpusStatsResponse.builder()
            .documentCount(corpusStore.documentCount())
            .chunkCount(corpusStore.chunkCount())
            .indexedChunks(snapshot.size())
            .dimension(snapshot.dimension())
            .ingestionInProgress(corpusStore.isIngestionLocked())
            .build());
  }
}
