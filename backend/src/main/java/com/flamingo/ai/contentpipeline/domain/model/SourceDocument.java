package com.flamingo.ai.contentpipeline.domain.model;

/**
 * A decoded source document of the knowledge corpus. Identity is the content hash, so two files
 * with identical bytes are the same document.
 *
 * @param id SHA-256 hex digest of the raw file bytes
 * @param sourcePath path the document was loaded from
 * @param mimeType detected MIME type
 * @param text decoded plain text
 * @param ingestionOrder monotonic sequence number assigned by the corpus store, {@code -1} before
 *     the document has been accepted
 */
public record SourceDocument(
    String id, String sourcePath, String mimeType, String text, long ingestionOrder) {

  public static final long NOT_INGESTED = -1L;

  public SourceDocument withIngestionOrder(long order) {
    return new SourceDocument(id, sourcePath, mimeType, text, order);
  }
}
