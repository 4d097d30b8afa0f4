package com.flamingo.ai.contentpipeline.service.rag.chunking;

import com.flamingo.ai.contentpipeline.config.RagConfig;
import com.flamingo.ai.contentpipeline.domain.model.Chunk;
import com.flamingo.ai.contentpipeline.domain.model.SourceDocument;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that slides a fixed-size window over the document text.
 *
 * <p>Each window ends at the last paragraph break, line break or space in its final fifth, and the
 * next window starts {@code round(size * overlapFraction)} characters before that end. Spans are
 * therefore contiguous with strictly increasing starts and ends, the first starts at 0 and the last
 * ends at the document length. A document no longer than the chunk size yields a single chunk.
 */
@Service
@Slf4j
public class SlidingWindowChunker implements DocumentChunker {

  private static final String[] SEPARATORS = {"\n\n", "\n", " "};

  /** Fraction of the window, counted from its end, searched for a natural boundary. */
  private static final double BOUNDARY_SEARCH_FRACTION = 0.2;

  @Override
  public List<Chunk> chunk(SourceDocument document, RagConfig config) {
    String text = document.text() == null ? "" : document.text();
    int size = config.getChunking().getSize();
    int overlap = overlapChars(size, config.getChunking().getOverlapFraction());

    List<Chunk> chunks = new ArrayList<>();
    if (text.isEmpty()) {
      return chunks;
    }
    if (text.length() <= size) {
      chunks.add(newChunk(document, 0, 0, text.length(), text));
      return chunks;
    }

    int start = 0;
    int previousEnd = 0;
    while (true) {
      int end = Math.min(start + size, text.length());
      if (end < text.length()) {
        int lowerBound =
            Math.max(
                start + (int) Math.ceil(size * (1 - BOUNDARY_SEARCH_FRACTION)), previousEnd + 1);
        end = snapToBoundary(text, lowerBound, end);
      }
      chunks.add(newChunk(document, chunks.size(), start, end, text));
      if (end == text.length()) {
        break;
      }
      previousEnd = end;
      start = Math.max(end - overlap, start + 1);
    }

    log.debug(
        "Chunked document {} ({} chars) into {} chunks",
        document.id(),
        text.length(),
        chunks.size());
    return chunks;
  }

  static int overlapChars(int size, double overlapFraction) {
    int overlap = (int) Math.round(size * overlapFraction);
    return Math.max(0, Math.min(overlap, size - 1));
  }

  /** Moves {@code end} back to just after the best separator in {@code [lowerBound, end]}. */
  private int snapToBoundary(String text, int lowerBound, int end) {
    if (lowerBound >= end) {
      return end;
    }
    for (String separator : SEPARATORS) {
      int index = text.lastIndexOf(separator, end - separator.length());
      int candidate = index + separator.length();
      if (index >= 0 && candidate >= lowerBound) {
        return candidate;
      }
    }
    return end;
  }

  private Chunk newChunk(SourceDocument document, int ordinal, int start, int end, String text) {
    return new Chunk(
        Chunk.idFor(document.id(), ordinal),
        document.id(),
        ordinal,
        start,
        end,
        text.substring(start, end));
  }
}
