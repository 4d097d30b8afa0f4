package com.flamingo.ai.contentpipeline.domain.model;

/**
 * A contiguous slice of a {@link SourceDocument}.
 *
 * @param id {@code <documentId>#<ordinal>}
 * @param documentId content hash of the owning document
 * @param ordinal 0-based position within the document
 * @param startOffset inclusive character offset into the document text
 * @param endOffset exclusive character offset into the document text
 * @param text the slice itself
 */
public record Chunk(
    String id, String documentId, int ordinal, int startOffset, int endOffset, String text) {

  public static String idFor(String documentId, int ordinal) {
    return documentId + "#" + ordinal;
  }
}
