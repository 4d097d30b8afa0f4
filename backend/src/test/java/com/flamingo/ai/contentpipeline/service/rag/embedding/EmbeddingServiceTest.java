package com.flamingo.ai.contentpipeline.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contentpipeline.exception.FatalCapabilityException;
import com.flamingo.ai.contentpipeline.exception.TransientCapabilityException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);

    embeddingService = new EmbeddingService(embeddingModel, meterRegistry);
  }

  @Test
  @DisplayName("Should embed query with query prefix")
  void shouldEmbedQueryWithQueryPrefix() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.1f, 0.2f, 0.3f));

    float[] result = embeddingService.embedQuery("What is a virtual thread?");

    assertThat(result).containsExactly(0.1f, 0.2f, 0.3f);
    verify(embeddingModel).embed(EmbeddingService.QUERY_PREFIX + "What is a virtual thread?");
    verify(meterRegistry.counter("embedding.requests.success", "type", "query")).increment();
  }

  @Test
  @DisplayName("Should embed passage with passage prefix")
  void shouldEmbedPassageWithPassagePrefix() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.4f, 0.5f));

    float[] result = embeddingService.embedPassage("Virtual threads are cheap.");

    assertThat(result).containsExactly(0.4f, 0.5f);
    verify(embeddingModel).embed(EmbeddingService.PASSAGE_PREFIX + "Virtual threads are cheap.");
  }

  @Test
  @DisplayName("Should truncate very long passage text")
  void shouldTruncateVeryLongPassageText() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.3f, 0.4f));

    embeddingService.embedPassage("b".repeat(6000));

    ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel).embed(captor.capture());
    assertThat(captor.getValue()).hasSize(EmbeddingService.MAX_CHARS_PER_EMBEDDING);
  }

  @Test
  @DisplayName("Should classify rate limiting as transient")
  void shouldClassifyRateLimitAsTransient() {
    when(embeddingModel.embed(anyString())).thenThrow(new HttpException(429, "rate limited"));

    assertThatThrownBy(() -> embeddingService.embedQuery("query"))
        .isInstanceOf(TransientCapabilityException.class);
    verify(meterRegistry.counter("embedding.requests.failure", "type", "query")).increment();
  }

  @Test
  @DisplayName("Should classify authentication failure as fatal")
  void shouldClassifyAuthenticationFailureAsFatal() {
    when(embeddingModel.embed(anyString())).thenThrow(new HttpException(401, "bad key"));

    assertThatThrownBy(() -> embeddingService.embedPassage("passage"))
        .isInstanceOf(FatalCapabilityException.class);
  }

  @Test
  @DisplayName("Should fail when the model returns no vector")
  void shouldFailWhenModelReturnsNoVector() {
    when(embeddingModel.embed(anyString())).thenReturn(null);

    assertThatThrownBy(() -> embeddingService.embedQuery("query"))
        .isInstanceOf(FatalCapabilityException.class)
        .hasMessageContaining("no vector");
  }

  private static Response<Embedding> createResponse(float... vector) {
    return Response.from(Embedding.from(vector));
  }
}
