package com.flamingo.ai.contentpipeline.service.rag.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.contentpipeline.config.RagConfig;
import com.flamingo.ai.contentpipeline.domain.model.SourceDocument;
import com.flamingo.ai.contentpipeline.exception.SnapshotPersistenceException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Saves and loads the corpus and its vectors as one JSON file. Writes go to a temporary file that
 * is then moved over the target, so a crash never leaves a half-written index behind.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IndexFileStore {

  private final ObjectMapper objectMapper;
  private final RagConfig ragConfig;

  public synchronized void save(List<SourceDocument> documents, IndexSnapshot snapshot) {
    Path target = indexPath();
    try {
      Path parent = target.toAbsolutePath().getParent();
      Files.createDirectories(parent);
      Path temp = Files.createTempFile(parent, "corpus-index", ".tmp");
      objectMapper.writeValue(
          temp.toFile(),
          new PersistedIndex(PersistedIndex.CURRENT_VERSION, documents, snapshot.entries()));
      Files.move(
          temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.info(
          "Saved index to {} ({} documents, {} chunks)",
          target,
          documents.size(),
          snapshot.size());
    } catch (IOException e) {
      throw new SnapshotPersistenceException("Failed to save index to " + target, e);
    }
  }

  public Optional<PersistedIndex> load() {
    Path source = indexPath();
    if (!Files.exists(source)) {
      log.info("No persisted index at {}", source);
      return Optional.empty();
    }
    try {
      PersistedIndex persisted = objectMapper.readValue(source.toFile(), PersistedIndex.class);
      if (persisted.version() != PersistedIndex.CURRENT_VERSION) {
        log.warn(
            "Ignoring index at {} with unsupported version {}", source, persisted.version());
        return Optional.empty();
      }
      return Optional.of(persisted);
    } catch (IOException e) {
      throw new SnapshotPersistenceException("Failed to load index from " + source, e);
    }
  }

  private Path indexPath() {
    return Path.of(ragConfig.getIndex().getPath());
  }
}
