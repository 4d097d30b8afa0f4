package com.flamingo.ai.contentpipeline.service.rag.index;

import com.flamingo.ai.contentpipeline.domain.model.ScoredChunk;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Holds the active {@link IndexSnapshot}. Reads are lock-free against whichever snapshot is active
 * when they start. Writers build a new snapshot off to the side and publish it with one atomic
 * reference update, so no reader observes a partially built index.
 */
@Component
@Slf4j
public class VectorIndex {

  private final AtomicReference<IndexSnapshot> active =
      new AtomicReference<>(IndexSnapshot.empty());

  public IndexSnapshot snapshot() {
    return active.get();
  }

  public List<ScoredChunk> search(float[] query, int k) {
    return active.get().search(query, k);
  }

  /**
   * Adds entries to the active snapshot. Concurrent merges are applied one after the other through
   * compare-and-set, so none is lost.
   *
   * @return the snapshot that became active
   */
  public IndexSnapshot merge(List<IndexEntry> entries) {
    IndexSnapshot next = active.updateAndGet(current -> current.withEntries(entries));
    log.debug("Merged {} entries, index now holds {} chunks", entries.size(), next.size());
    return next;
  }

  /**
   * Publishes a rebuilt snapshot. Entries of documents the rebuild did not cover, such as those
   * merged while it was embedding, are carried over from the active snapshot.
   *
   * @return the snapshot that became active
   */
  public IndexSnapshot publishRebuild(IndexSnapshot rebuilt) {
    IndexSnapshot previous = active.get();
    IndexSnapshot next = active.updateAndGet(current -> rebuilt.withEntries(current.entries()));
    log.info(
        "Published rebuilt vector index: {} -> {} chunks ({} carried over)",
        previous.size(),
        next.size(),
        next.size() - rebuilt.size());
    return next;
  }

  /** Replaces the active snapshot, e.g. when loading from disk. */
  public void swap(IndexSnapshot next) {
    IndexSnapshot previous = active.getAndSet(next);
    log.info("Swapped vector index: {} -> {} chunks", previous.size(), next.size());
  }

  public int chunkCount() {
    return active.get().size();
  }
}
