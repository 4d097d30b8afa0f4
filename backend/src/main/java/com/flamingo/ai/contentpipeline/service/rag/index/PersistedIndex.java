package com.flamingo.ai.contentpipeline.service.rag.index;

import com.flamingo.ai.contentpipeline.domain.model.SourceDocument;
import java.util.List;

/** On-disk form of the corpus and its index. */
public record PersistedIndex(
    int version, List<SourceDocument> documents, List<IndexEntry> entries) {

  public static final int CURRENT_VERSION = 1;
}
