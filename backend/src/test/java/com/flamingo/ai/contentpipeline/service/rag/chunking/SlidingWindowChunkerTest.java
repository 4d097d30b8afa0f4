package com.flamingo.ai.contentpipeline.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.contentpipeline.config.RagConfig;
import com.flamingo.ai.contentpipeline.domain.model.Chunk;
import com.flamingo.ai.contentpipeline.domain.model.SourceDocument;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SlidingWindowChunker Tests")
class SlidingWindowChunkerTest {

  private SlidingWindowChunker chunker;
  private RagConfig config;

  @BeforeEach
  void setUp() {
    chunker = new SlidingWindowChunker();
    config = new RagConfig();
    config.getChunking().setSize(1000);
    config.getChunking().setOverlapFraction(0.2);
  }

  private static SourceDocument document(String text) {
    return new SourceDocument("doc", "doc.md", "text/markdown", text, 0);
  }

  private static String words(int length) {
    StringBuilder sb = new StringBuilder();
    int i = 0;
    while (sb.length() < length) {
      sb.append("word").append(i++).append(' ');
    }
    return sb.substring(0, length);
  }

  private static List<String> spans(List<Chunk> chunks) {
    return chunks.stream()
        .map(c -> c.id() + "[" + c.startOffset() + "," + c.endOffset() + ")")
        .toList();
  }

  @Test
  @DisplayName("Should return no chunks for empty text")
  void shouldReturnNoChunksForEmptyText() {
    assertThat(chunker.chunk(document(""), config)).isEmpty();
  }

  @Test
  @DisplayName("Should return a single chunk when text fits in one window")
  void shouldReturnSingleChunkForShortText() {
    String text = words(1000);

    List<Chunk> chunks = chunker.chunk(document(text), config);

    assertThat(chunks).hasSize(1);
    assertThat(chunks.get(0).startOffset()).isZero();
    assertThat(chunks.get(0).endOffset()).isEqualTo(1000);
    assertThat(chunks.get(0).id()).isEqualTo("doc#0");
  }

  @Nested
  @DisplayName("Long documents")
  class LongDocuments {

    @Test
    @DisplayName("Should cover the whole text with monotonic, overlapping spans")
    void shouldCoverWholeTextWithMonotonicSpans() {
      String text = words(5200);

      List<Chunk> chunks = chunker.chunk(document(text), config);

      assertThat(chunks.size()).isGreaterThan(5);
      assertThat(chunks.get(0).startOffset()).isZero();
      assertThat(chunks.get(chunks.size() - 1).endOffset()).isEqualTo(text.length());
      for (int i = 0; i < chunks.size(); i++) {
        Chunk chunk = chunks.get(i);
        assertThat(chunk.ordinal()).isEqualTo(i);
        assertThat(chunk.id()).isEqualTo("doc#" + i);
        assertThat(chunk.text()).isEqualTo(text.substring(chunk.startOffset(), chunk.endOffset()));
        assertThat(chunk.endOffset() - chunk.startOffset()).isLessThanOrEqualTo(1000);
        if (i > 0) {
          Chunk previous = chunks.get(i - 1);
          assertThat(chunk.startOffset()).isGreaterThan(previous.startOffset());
          assertThat(chunk.endOffset()).isGreaterThan(previous.endOffset());
          assertThat(chunk.startOffset()).isLessThan(previous.endOffset());
        }
      }
    }

    @Test
    @DisplayName("Should end windows on a word boundary")
    void shouldEndWindowsOnWordBoundary() {
      String text = words(4000);

      List<Chunk> chunks = chunker.chunk(document(text), config);

      for (Chunk chunk : chunks.subList(0, chunks.size() - 1)) {
        assertThat(text.charAt(chunk.endOffset() - 1)).isEqualTo(' ');
      }
    }

    @Test
    @DisplayName("Should prefer a paragraph break near the end of the window")
    void shouldPreferParagraphBreak() {
      String text = words(900) + "\n\n" + words(1500);

      List<Chunk> chunks = chunker.chunk(document(text), config);

      assertThat(chunks.get(0).endOffset()).isEqualTo(902);
      assertThat(chunks.get(0).text()).endsWith("\n\n");
    }

    @Test
    @DisplayName("Should produce contiguous chunks without overlap when fraction is zero")
    void shouldProduceContiguousChunksWithoutOverlap() {
      config.getChunking().setOverlapFraction(0.0);
      String text = words(3500);

      List<Chunk> chunks = chunker.chunk(document(text), config);

      for (int i = 1; i < chunks.size(); i++) {
        assertThat(chunks.get(i).startOffset()).isEqualTo(chunks.get(i - 1).endOffset());
      }
    }

    @Test
    @DisplayName("Should hard-cut text without separators at the window size")
    void shouldHardCutTextWithoutSeparators() {
      String text = "x".repeat(2500);

      List<Chunk> chunks = chunker.chunk(document(text), config);

      assertThat(chunks.get(0).endOffset()).isEqualTo(1000);
      assertThat(chunks.get(1).startOffset()).isEqualTo(800);
      assertThat(chunks.get(chunks.size() - 1).endOffset()).isEqualTo(2500);
    }
  }

  @Test
  @DisplayName("Should yield identical chunks when the same document is chunked again")
  void shouldBeDeterministicAcrossRuns() {
    StringBuilder text = new StringBuilder();
    for (int paragraph = 0; paragraph < 12; paragraph++) {
      text.append("Paragraph ").append(paragraph).append(". ").append(words(370 + paragraph * 17));
      text.append(paragraph % 3 == 0 ? "\n\n" : "\n");
    }
    SourceDocument document = document(text.toString());

    List<Chunk> first = chunker.chunk(document, config);
    List<Chunk> second = chunker.chunk(document, config);

    assertThat(first).hasSizeGreaterThan(3);
    assertThat(second).isEqualTo(first);
    assertThat(spans(second)).isEqualTo(spans(first));
    assertThat(chunker.chunk(document(text.toString()), config)).isEqualTo(first);
  }

  @Test
  @DisplayName("Should clamp overlap below the chunk size")
  void shouldClampOverlap() {
    assertThat(SlidingWindowChunker.overlapChars(1000, 0.2)).isEqualTo(200);
    assertThat(SlidingWindowChunker.overlapChars(1000, 0.0)).isZero();
    assertThat(SlidingWindowChunker.overlapChars(10, 0.99)).isEqualTo(9);
  }
}
