package com.flamingo.ai.contentpipeline.config;

import com.flamingo.ai.contentpipeline.exception.IngestionException;
import com.flamingo.ai.contentpipeline.exception.SnapshotPersistenceException;
import com.flamingo.ai.contentpipeline.service.rag.ingestion.CorpusIngestionService;
import com.flamingo.ai.contentpipeline.service.rag.ingestion.IngestionReport;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Startup bean that restores the persisted corpus and, when enabled, ingests the configured
 * knowledge directory.
 *
 * <p>Failures are logged and never stop the application: an empty corpus is still usable, runs
 * simply fail with insufficient grounding until something is ingested.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CorpusStartupBean implements CommandLineRunner {

  private final CorpusIngestionService ingestionService;
  private final RagConfig ragConfig;

  @Override
  public void run(String... args) {
    try {
      if (!ingestionService.restore()) {
        log.info("Starting with an empty corpus");
      }
    } catch (SnapshotPersistenceException e) {
      log.error("Failed to restore persisted index, starting empty: {}", e.getMessage(), e);
    }

    if (!ragConfig.getCorpus().isIngestOnStartup()) {
      return;
    }
    Path sourceDir = Path.of(ragConfig.getCorpus().getSourceDir());
    if (!Files.exists(sourceDir)) {
      log.warn("Knowledge directory {} does not exist, skipping startup ingestion", sourceDir);
      return;
    }
    try {
      IngestionReport report = ingestionService.ingest(sourceDir);
      log.info(
          "Startup ingestion complete: {} ingested, {} duplicates, {} failed",
          report.ingested(),
          report.duplicates(),
          report.failed().size());
    } catch (IngestionException | SnapshotPersistenceException e) {
      log.error("Startup ingestion of {} failed: {}", sourceDir, e.getMessage(), e);
    }
  }
}
