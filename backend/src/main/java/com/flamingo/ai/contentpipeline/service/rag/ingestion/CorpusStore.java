package com.flamingo.ai.contentpipeline.service.rag.ingestion;

import com.flamingo.ai.contentpipeline.domain.model.Chunk;
import com.flamingo.ai.contentpipeline.domain.model.SourceDocument;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * In-memory store of the corpus documents and their chunks, keyed by content hash.
 *
 * <p>All mutations happen under the ingestion lock. Callers must never hold it across an embedding
 * call: they claim a document, release the lock, embed, and come back to attach the chunks.
 */
@Component
public class CorpusStore {

  private final ReentrantLock ingestionLock = new ReentrantLock();
  private final Map<String, SourceDocument> documents = new LinkedHashMap<>();
  private final Map<String, List<Chunk>> chunksByDocument = new HashMap<>();
  private long nextIngestionOrder;

  /**
   * Reserves a document for ingestion.
   *
   * @return the document with its ingestion order assigned, or empty if a document with the same
   *     content hash is already present
   */
  public Optional<SourceDocument> claim(SourceDocument document) {
    ingestionLock.lock();
    try {
      if (documents.containsKey(document.id())) {
        return Optional.empty();
      }
      SourceDocument accepted = document.withIngestionOrder(nextIngestionOrder++);
      documents.put(accepted.id(), accepted);
      return Optional.of(accepted);
    } finally {
      ingestionLock.unlock();
    }
  }

  /** Drops a claimed document whose ingestion did not complete, so it can be retried. */
  public void release(String documentId) {
    ingestionLock.lock();
    try {
      documents.remove(documentId);
      chunksByDocument.remove(documentId);
    } finally {
      ingestionLock.unlock();
    }
  }

  public void attachChunks(String documentId, List<Chunk> chunks) {
    ingestionLock.lock();
    try {
      if (documents.containsKey(documentId)) {
        chunksByDocument.put(documentId, List.copyOf(chunks));
      }
    } finally {
      ingestionLock.unlock();
    }
  }

  /** Replaces the whole corpus, e.g. with the contents of the persisted index. */
  public void restore(List<SourceDocument> restored, Map<String, List<Chunk>> restoredChunks) {
    ingestionLock.lock();
    try {
      documents.clear();
      chunksByDocument.clear();
      long maxOrder = -1;
      for (SourceDocument document : restored) {
        documents.put(document.id(), document);
        maxOrder = Math.max(maxOrder, document.ingestionOrder());
      }
      restoredChunks.forEach((id, chunks) -> chunksByDocument.put(id, List.copyOf(chunks)));
      nextIngestionOrder = maxOrder + 1;
    } finally {
      ingestionLock.unlock();
    }
  }

  /** Documents with attached chunks, in ingestion order. */
  public List<SourceDocument> documents() {
    ingestionLock.lock();
    try {
      return documents.values().stream()
          .filter(d -> chunksByDocument.containsKey(d.id()))
          .sorted(Comparator.comparingLong(SourceDocument::ingestionOrder))
          .toList();
    } finally {
      ingestionLock.unlock();
    }
  }

  public List<Chunk> chunks(String documentId) {
    ingestionLock.lock();
    try {
      return chunksByDocument.getOrDefault(documentId, List.of());
    } finally {
      ingestionLock.unlock();
    }
  }

  public boolean contains(String documentId) {
    ingestionLock.lock();
    try {
      return documents.containsKey(documentId);
    } finally {
      ingestionLock.unlock();
    }
  }

  public int documentCount() {
    return documents().size();
  }

  public int chunkCount() {
    ingestionLock.lock();
    try {
      return chunksByDocument.values().stream().mapToInt(List::size).sum();
    } finally {
      ingestionLock.unlock();
    }
  }

  /** True while some thread holds the ingestion lock. */
  public boolean isIngestionLocked() {
    return ingestionLock.isLocked();
  }
}
