package com.flamingo.ai.contentpipeline.service.rag.ingestion;

import com.flamingo.ai.contentpipeline.exception.IngestionException;

/** Decodes the raw bytes of one document format into plain text. */
public interface DocumentTextExtractor {

  /**
   * Returns true if this extractor handles the given MIME type.
   *
   * @param mimeType detected MIME type (e.g. {@code application/pdf})
   */
  boolean supports(String mimeType);

  /**
   * Extracts the document text.
   *
   * @param content raw file bytes
   * @param sourcePath path reported in errors
   * @return decoded text
   * @throws IngestionException if the bytes cannot be decoded as text
   */
  String extract(byte[] content, String sourcePath);
}
