package com.flamingo.ai.contentpipeline.service.rag.ingestion;

import com.flamingo.ai.contentpipeline.domain.model.SourceDocument;
import com.flamingo.ai.contentpipeline.exception.IngestionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Service;

/**
 * Reads a file from disk and turns it into a {@link SourceDocument}.
 *
 * <p>The MIME type is detected with Tika from the leading bytes and the file name, then routed to
 * the first {@link DocumentTextExtractor} (in {@code @Order}) that supports it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentLoader {

  private static final Tika TIKA = new Tika();

  private final List<DocumentTextExtractor> extractors;

  /**
   * Loads and decodes a document.
   *
   * @param path file to load
   * @return the document, not yet accepted by the corpus store
   * @throws IngestionException if the file cannot be read, cannot be decoded as text, or holds no
   *     text
   */
  public SourceDocument load(Path path) {
    String sourcePath = path.toString();
    byte[] content;
    try {
      content = Files.readAllBytes(path);
    } catch (IOException e) {
      throw new IngestionException(sourcePath, "Cannot read " + sourcePath, e);
    }

    String mimeType = TIKA.detect(content, path.getFileName().toString());
    DocumentTextExtractor extractor =
        extractors.stream()
            .filter(e -> e.supports(mimeType))
            .findFirst()
            .orElseThrow(
                () ->
                    new IngestionException(
                        sourcePath, "Unsupported document type " + mimeType + ": " + sourcePath));

    String text = extractor.extract(content, sourcePath);
    if (text.isBlank()) {
      throw new IngestionException(sourcePath, "No text content in " + sourcePath);
    }
    log.debug("Loaded {} as {} ({} chars)", sourcePath, mimeType, text.length());
    return new SourceDocument(
        contentHash(content), sourcePath, mimeType, text, SourceDocument.NOT_INGESTED);
  }

  static String contentHash(byte[] content) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
