package com.flamingo.ai.contentpipeline.service.pipeline.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.contentpipeline.config.PipelineConfig;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.domain.model.RunSnapshot;
import com.flamingo.ai.contentpipeline.exception.SnapshotPersistenceException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stores each snapshot as {@code <runId>_<timestamp>.json} under the runs directory. The
 * timestamp sorts lexically, so the latest snapshot of a run is the last file name in order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonFileRunSnapshotStore implements RunSnapshotStore {

  private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9-]+");
  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSS").withZone(ZoneOffset.UTC);

  private final ObjectMapper objectMapper;
  private final PipelineConfig pipelineConfig;

  @Override
  public synchronized RunSnapshot save(PipelineState state) {
    String runId = validRunId(state.getRunId());
    Instant savedAt = Instant.now();
    RunSnapshot snapshot = RunSnapshot.of(state, savedAt);
    Path dir = runsDir();
    Path target = dir.resolve(runId + "_" + FILE_TIMESTAMP.format(savedAt) + ".json");
    try {
      Files.createDirectories(dir);
      Path temp = Files.createTempFile(dir, runId, ".tmp");
      objectMapper.writeValue(temp.toFile(), snapshot);
      Files.move(
          temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new SnapshotPersistenceException("Failed to save snapshot of run " + runId, e);
    }
    log.info("Saved snapshot of run {} ({}) to {}", runId, snapshot.status(), target);
    return snapshot;
  }

  @Override
  public Optional<RunSnapshot> findLatest(String runId) {
    if (runId == null || !RUN_ID.matcher(runId).matches()) {
      return Optional.empty();
    }
    String prefix = runId + "_";
    return snapshotFiles()
        .filter(file -> file.getFileName().toString().startsWith(prefix))
        .max(Comparator.comparing(file -> file.getFileName().toString()))
        .map(this::read);
  }

  @Override
  public List<RunSnapshot> findAllLatest() {
    Map<String, Path> latestByRun = new LinkedHashMap<>();
    snapshotFiles()
        .sorted(Comparator.comparing(file -> file.getFileName().toString()))
        .forEach(file -> latestByRun.put(runIdOf(file), file));
    return latestByRun.values().stream()
        .map(this::read)
        .sorted(Comparator.comparing(RunSnapshot::savedAt).reversed())
        .toList();
  }

  private Stream<Path> snapshotFiles() {
    Path dir = runsDir();
    if (!Files.isDirectory(dir)) {
      return Stream.empty();
    }
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(file -> file.getFileName().toString().endsWith(".json"))
          .toList()
          .stream();
    } catch (IOException e) {
      throw new SnapshotPersistenceException("Failed to list snapshots in " + dir, e);
    }
  }

  private RunSnapshot read(Path file) {
    try {
      return objectMapper.readValue(file.toFile(), RunSnapshot.class);
    } catch (IOException e) {
      throw new SnapshotPersistenceException("Failed to read snapshot " + file, e);
    }
  }

  private static String runIdOf(Path file) {
    String name = file.getFileName().toString();
    int separator = name.lastIndexOf('_');
    return separator < 0 ? name : name.substring(0, separator);
  }

  private static String validRunId(String runId) {
    if (runId == null || !RUN_ID.matcher(runId).matches()) {
      throw new IllegalArgumentException("Invalid run id: " + runId);
    }
    return runId;
  }

  private Path runsDir() {
    return Path.of(pipelineConfig.getPersistence().getRunsDir());
  }
}
