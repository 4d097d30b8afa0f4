package com.flamingo.ai.contentpipeline.service.rag.ingestion;

import com.flamingo.ai.contentpipeline.config.RagConfig;
import com.flamingo.ai.contentpipeline.domain.model.Chunk;
import com.flamingo.ai.contentpipeline.domain.model.SourceDocument;
import com.flamingo.ai.contentpipeline.exception.FatalCapabilityException;
import com.flamingo.ai.contentpipeline.exception.IngestionException;
import com.flamingo.ai.contentpipeline.service.capability.CapabilityInvoker;
import com.flamingo.ai.contentpipeline.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.contentpipeline.service.rag.embedding.Embedder;
import com.flamingo.ai.contentpipeline.service.rag.index.IndexEntry;
import com.flamingo.ai.contentpipeline.service.rag.index.IndexFileStore;
import com.flamingo.ai.contentpipeline.service.rag.index.IndexSnapshot;
import com.flamingo.ai.contentpipeline.service.rag.index.PersistedIndex;
import com.flamingo.ai.contentpipeline.service.rag.index.VectorIndex;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds the knowledge corpus: load, deduplicate by content hash, chunk, embed and index.
 *
 * <p>A file that cannot be decoded is logged and skipped; it never aborts the batch. Embedding
 * happens outside the corpus ingestion lock, and new entries reach readers through a single swap of
 * the active index snapshot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorpusIngestionService {

  static final Set<String> SUPPORTED_EXTENSIONS = Set.of("md", "markdown", "txt", "pdf");

  private final DocumentLoader documentLoader;
  private final DocumentChunker documentChunker;
  private final Embedder embedder;
  private final CapabilityInvoker capabilityInvoker;
  private final CorpusStore corpusStore;
  private final VectorIndex vectorIndex;
  private final IndexFileStore indexFileStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Ingests a directory (recursively) or a single file. Re-ingesting a file whose content hash is
   * already in the corpus is a no-op.
   *
   * @param source directory or file
   * @return what was ingested, skipped and failed
   * @throws IngestionException if the source does not exist or cannot be listed
   */
  @Timed(value = "corpus.ingest", description = "Time to ingest a corpus source")
  public IngestionReport ingest(Path source) {
    List<Path> files = listFiles(source);
    log.info("Ingesting {} files from {}", files.size(), source);

    int ingested = 0;
    int duplicates = 0;
    int chunksAdded = 0;
    List<String> failed = new ArrayList<>();

    for (Path file : files) {
      try {
        Optional<SourceDocument> claimed = corpusStore.claim(documentLoader.load(file));
        if (claimed.isEmpty()) {
          log.debug("Skipping {}: content already ingested", file);
          duplicates++;
          continue;
        }
        chunksAdded += indexDocument(claimed.get());
        ingested++;
      } catch (IngestionException e) {
        log.warn("Skipping {}: {}", file, e.getMessage());
        meterRegistry.counter("corpus.ingest.failed", "reason", "decode").increment();
        failed.add(file.toString());
      } catch (FatalCapabilityException e) {
        log.error("Skipping {}: embedding failed: {}", file, e.getMessage());
        meterRegistry.counter("corpus.ingest.failed", "reason", "embedding").increment();
        failed.add(file.toString());
      }
    }

    if (ingested > 0) {
      persistIndex();
    }
    meterRegistry.counter("corpus.documents.ingested").increment(ingested);

    IngestionReport report =
        new IngestionReport(ingested, duplicates, failed, chunksAdded, vectorIndex.chunkCount());
    log.info(
        "Ingestion of {} finished: {} ingested, {} duplicates, {} failed, {} chunks added",
        source,
        ingested,
        duplicates,
        failed.size(),
        chunksAdded);
    return report;
  }

  /**
   * Re-chunks and re-embeds every stored document into a fresh snapshot and swaps it in. Documents
   * ingested while the rebuild runs keep their entries. If any embedding fails the active index is
   * left untouched.
   *
   * @throws FatalCapabilityException if embedding fails after retries
   */
  @Timed(value = "corpus.rebuild", description = "Time to rebuild the vector index")
  public IngestionReport rebuild() {
    List<SourceDocument> documents = corpusStore.documents();
    log.info("Rebuilding vector index from {} documents", documents.size());

    List<IndexEntry> entries = new ArrayList<>();
    Map<String, List<Chunk>> chunksByDocument = new HashMap<>();
    for (SourceDocument document : documents) {
      List<Chunk> chunks = documentChunker.chunk(document, ragConfig);
      chunksByDocument.put(document.id(), chunks);
      entries.addAll(embed(document, chunks));
    }

    IndexSnapshot rebuilt = IndexSnapshot.of(entries);
    IndexSnapshot active = vectorIndex.publishRebuild(rebuilt);
    chunksByDocument.forEach(corpusStore::attachChunks);
    persistIndex();

    return new IngestionReport(documents.size(), 0, List.of(), rebuilt.size(), active.size());
  }

  /** Loads the persisted corpus and index, if any, and makes it active. */
  public boolean restore() {
    Optional<PersistedIndex> persisted = indexFileStore.load();
    if (persisted.isEmpty()) {
      return false;
    }
    PersistedIndex index = persisted.get();
    IndexSnapshot snapshot = IndexSnapshot.of(index.entries());

    Map<String, List<Chunk>> chunksByDocument = new HashMap<>();
    for (IndexEntry entry : index.entries()) {
      chunksByDocument
          .computeIfAbsent(entry.chunk().documentId(), id -> new ArrayList<>())
          .add(entry.chunk());
    }
    for (SourceDocument document : index.documents()) {
      chunksByDocument.putIfAbsent(document.id(), List.of());
    }

    corpusStore.restore(index.documents(), chunksByDocument);
    vectorIndex.swap(snapshot);
    log.info(
        "Restored corpus: {} documents, {} chunks", index.documents().size(), snapshot.size());
    return true;
  }

  private int indexDocument(SourceDocument document) {
    List<Chunk> chunks = documentChunker.chunk(document, ragConfig);
    List<IndexEntry> entries;
    try {
      entries = embed(document, chunks);
    } catch (RuntimeException e) {
      corpusStore.release(document.id());
      throw e;
    }
    vectorIndex.merge(entries);
    corpusStore.attachChunks(document.id(), chunks);
    log.info("Indexed {} ({} chunks)", document.sourcePath(), chunks.size());
    return chunks.size();
  }

  private List<IndexEntry> embed(SourceDocument document, List<Chunk> chunks) {
    List<IndexEntry> entries = new ArrayList<>(chunks.size());
    for (Chunk chunk : chunks) {
      float[] vector =
          capabilityInvoker.invoke("embedder", () -> embedder.embedPassage(chunk.text()));
      entries.add(new IndexEntry(chunk, vector, document.ingestionOrder()));
    }
    return entries;
  }

  private synchronized void persistIndex() {
    indexFileStore.save(corpusStore.documents(), vectorIndex.snapshot());
  }

  private List<Path> listFiles(Path source) {
    if (!Files.exists(source)) {
      throw new IngestionException(source.toString(), "Source does not exist: " + source);
    }
    if (Files.isRegularFile(source)) {
      return List.of(source);
    }
    try (Stream<Path> walk = Files.walk(source)) {
      return walk.filter(Files::isRegularFile).filter(this::isSupported).sorted().toList();
    } catch (IOException e) {
      throw new IngestionException(source.toString(), "Cannot list " + source, e);
    }
  }

  private boolean isSupported(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0
        && SUPPORTED_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
  }
}
