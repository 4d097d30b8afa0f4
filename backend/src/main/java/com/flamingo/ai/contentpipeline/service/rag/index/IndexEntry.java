package com.flamingo.ai.contentpipeline.service.rag.index;

import com.flamingo.ai.contentpipeline.domain.model.Chunk;

/**
 * A chunk with its embedding vector.
 *
 * @param chunk the embedded chunk
 * @param vector embedding of the chunk text
 * @param ingestionOrder ingestion order of the owning document, used to break score ties
 */
public record IndexEntry(Chunk chunk, float[] vector, long ingestionOrder) {}
