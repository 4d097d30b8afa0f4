package com.flamingo.ai.contentpipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Optional;

/**
 * Ranked chunks retrieved for one query, ordered by score descending. An empty context means the
 * corpus holds nothing relevant enough to ground the content.
 */
public record RetrievalContext(String query, List<ScoredChunk> entries, boolean lowConfidence) {

  public RetrievalContext {
    entries = entries == null ? List.of() : List.copyOf(entries);
  }

  public static RetrievalContext empty(String query) {
    return new RetrievalContext(query, List.of(), true);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public Optional<ScoredChunk> findChunk(String chunkId) {
    return entries.stream().filter(e -> e.chunk().id().equals(chunkId)).findFirst();
  }
}
