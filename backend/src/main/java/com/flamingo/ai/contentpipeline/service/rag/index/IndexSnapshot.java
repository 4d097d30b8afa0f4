package com.flamingo.ai.contentpipeline.service.rag.index;

import com.flamingo.ai.contentpipeline.domain.model.ScoredChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable set of (chunk, vector) pairs. All vectors share one dimension. Changes produce a new
 * snapshot, so a reader holding a snapshot never sees it change underneath it.
 */
public final class IndexSnapshot {

  private static final IndexSnapshot EMPTY = new IndexSnapshot(List.of(), 0, Set.of());

  private static final Comparator<Scored> RANKING =
      Comparator.comparingDouble(Scored::score)
          .reversed()
          .thenComparingLong(s -> s.entry().ingestionOrder())
          .thenComparingInt(s -> s.entry().chunk().ordinal());

  private final List<IndexEntry> entries;
  private final int dimension;
  private final Set<String> documentIds;

  private IndexSnapshot(List<IndexEntry> entries, int dimension, Set<String> documentIds) {
    this.entries = entries;
    this.dimension = dimension;
    this.documentIds = documentIds;
  }

  public static IndexSnapshot empty() {
    return EMPTY;
  }

  /**
   * Builds a snapshot from scratch.
   *
   * @throws IllegalArgumentException if the vectors do not all have the same dimension
   */
  public static IndexSnapshot of(List<IndexEntry> entries) {
    return EMPTY.withEntries(entries);
  }

  /**
   * Returns a new snapshot holding this snapshot's entries plus {@code added}. Entries of
   * documents this snapshot already holds are skipped.
   *
   * @throws IllegalArgumentException if an added vector does not match the index dimension
   */
  public IndexSnapshot withEntries(List<IndexEntry> added) {
    List<IndexEntry> merged = new ArrayList<>(entries);
    Set<String> mergedDocuments = new HashSet<>(documentIds);
    int mergedDimension = dimension;

    for (IndexEntry entry : added) {
      String documentId = entry.chunk().documentId();
      if (documentIds.contains(documentId)) {
        continue;
      }
      int length = entry.vector().length;
      if (length == 0) {
        throw new IllegalArgumentException("Empty vector for chunk " + entry.chunk().id());
      }
      if (mergedDimension == 0) {
        mergedDimension = length;
      } else if (length != mergedDimension) {
        throw new IllegalArgumentException(
            "Vector dimension "
                + length
                + " of chunk "
                + entry.chunk().id()
                + " does not match index dimension "
                + mergedDimension);
      }
      merged.add(entry);
      mergedDocuments.add(documentId);
    }

    if (merged.size() == entries.size()) {
      return this;
    }
    return new IndexSnapshot(List.copyOf(merged), mergedDimension, Set.copyOf(mergedDocuments));
  }

  /**
   * Returns the {@code k} entries most similar to the query by cosine similarity, best first. Equal
   * scores are ordered by document ingestion order, then chunk ordinal.
   *
   * @throws IllegalArgumentException if the query dimension does not match the index dimension
   */
  public List<ScoredChunk> search(float[] query, int k) {
    if (entries.isEmpty() || k <= 0) {
      return List.of();
    }
    if (query.length != dimension) {
      throw new IllegalArgumentException(
          "Query dimension " + query.length + " does not match index dimension " + dimension);
    }

    double queryNorm = norm(query);
    List<Scored> scored = new ArrayList<>(entries.size());
    for (IndexEntry entry : entries) {
      scored.add(new Scored(entry, cosine(query, queryNorm, entry.vector())));
    }
    scored.sort(RANKING);

    return scored.stream()
        .limit(k)
        .map(s -> new ScoredChunk(s.entry().chunk(), s.score()))
        .toList();
  }

  public List<IndexEntry> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  public int dimension() {
    return dimension;
  }

  public int documentCount() {
    return documentIds.size();
  }

  public boolean containsDocument(String documentId) {
    return documentIds.contains(documentId);
  }

  static double cosine(float[] query, double queryNorm, float[] vector) {
    double vectorNorm = norm(vector);
    if (queryNorm == 0 || vectorNorm == 0) {
      return 0;
    }
    double dot = 0;
    for (int i = 0; i < query.length; i++) {
      dot += query[i] * vector[i];
    }
    return dot / (queryNorm * vectorNorm);
  }

  private static double norm(float[] vector) {
    double sum = 0;
    for (float v : vector) {
      sum += v * v;
    }
    return Math.sqrt(sum);
  }

  private record Scored(IndexEntry entry, double score) {}
}
