package com.flamingo.ai.contentpipeline.service.rag.embedding;

import com.flamingo.ai.contentpipeline.exception.FatalCapabilityException;
import com.flamingo.ai.contentpipeline.service.capability.CapabilityFailures;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link Embedder} backed by the configured LangChain4j embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService implements Embedder {

  // text-embedding-3-small accepts 8192 tokens; 5000 chars stays well below it even for CJK text
  static final int MAX_CHARS_PER_EMBEDDING = 5000;

  // Instruction prefixes for better semantic matching
  static final String QUERY_PREFIX =
      "Represent this question for retrieving relevant document passages: ";
  static final String PASSAGE_PREFIX = "Represent this document passage for retrieval: ";

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a query text with query-specific instruction prefix for better retrieval matching.
   *
   * @param query the query text
   * @return embedding vector
   */
  @Override
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  public float[] embedQuery(String query) {
    return embed(QUERY_PREFIX + query, "query");
  }

  /**
   * Embeds a passage text with passage-specific instruction prefix for better retrieval matching.
   *
   * @param passage the passage text
   * @return embedding vector
   */
  @Override
  @Timed(value = "embedding.embedPassage", description = "Time to embed passage")
  public float[] embedPassage(String passage) {
    return embed(PASSAGE_PREFIX + passage, "passage");
  }

  private float[] embed(String prefixedText, String type) {
    if (prefixedText.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "{} too long for embedding, truncating from {} chars to {} chars",
          type,
          prefixedText.length(),
          MAX_CHARS_PER_EMBEDDING);
      prefixedText = prefixedText.substring(0, MAX_CHARS_PER_EMBEDDING);
    }

    Response<Embedding> response;
    try {
      response = embeddingModel.embed(prefixedText);
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", type).increment();
      throw CapabilityFailures.classify("embedder", e);
    }

    if (response == null || response.content() == null) {
      throw new FatalCapabilityException("embedder", "Embedding model returned no vector");
    }
    meterRegistry.counter("embedding.requests.success", "type", type).increment();
    return response.content().vector();
  }
}
