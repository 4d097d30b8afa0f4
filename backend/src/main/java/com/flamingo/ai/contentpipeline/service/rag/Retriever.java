package com.flamingo.ai.contentpipeline.service.rag;

import com.flamingo.ai.contentpipeline.config.RagConfig;
import com.flamingo.ai.contentpipeline.domain.model.RetrievalContext;
import com.flamingo.ai.contentpipeline.domain.model.ScoredChunk;
import com.flamingo.ai.contentpipeline.service.capability.CapabilityInvoker;
import com.flamingo.ai.contentpipeline.service.rag.embedding.Embedder;
import com.flamingo.ai.contentpipeline.service.rag.index.VectorIndex;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a text query into a {@link RetrievalContext}.
 *
 * <p>Over-fetches {@code topK * candidatesMultiplier} nearest chunks, drops those below the
 * similarity floor, keeps at most {@code perSourceCap} of the best chunks per document and
 * truncates to {@code topK}. The result keeps the index's score-descending order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Retriever {

  private final Embedder embedder;
  private final VectorIndex vectorIndex;
  private final CapabilityInvoker capabilityInvoker;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "retriever.retrieve", description = "Time to retrieve context")
  public RetrievalContext retrieve(String query) {
    RagConfig.Retrieval settings = ragConfig.getRetrieval();
    if (vectorIndex.chunkCount() == 0) {
      log.warn("Vector index is empty, nothing to retrieve for '{}'", query);
      meterRegistry.counter("retriever.empty", "reason", "empty_index").increment();
      return RetrievalContext.empty(query);
    }

    float[] queryVector = capabilityInvoker.invoke("embedder", () -> embedder.embedQuery(query));
    List<ScoredChunk> candidates =
        vectorIndex.search(queryVector, settings.getTopK() * settings.getCandidatesMultiplier());

    List<ScoredChunk> selected = new ArrayList<>();
    Map<String, Integer> perSource = new HashMap<>();
    int belowFloor = 0;
    for (ScoredChunk candidate : candidates) {
      if (selected.size() >= settings.getTopK()) {
        break;
      }
      if (candidate.score() < settings.getMinSimilarity()) {
        belowFloor++;
        continue;
      }
      String documentId = candidate.chunk().documentId();
      int taken = perSource.getOrDefault(documentId, 0);
      if (taken >= settings.getPerSourceCap()) {
        continue;
      }
      perSource.put(documentId, taken + 1);
      selected.add(candidate);
    }

    boolean lowConfidence =
        selected.isEmpty()
            || selected.get(0).score() < settings.getLowConfidenceScore()
            || perSource.size() < settings.getMinSources();

    log.debug(
        "Retrieved {} chunks from {} documents for '{}' ({} below floor, lowConfidence={})",
        selected.size(),
        perSource.size(),
        query,
        belowFloor,
        lowConfidence);
    if (selected.isEmpty()) {
      meterRegistry.counter("retriever.empty", "reason", "below_floor").increment();
    }
    return new RetrievalContext(query, selected, lowConfidence);
  }
}
