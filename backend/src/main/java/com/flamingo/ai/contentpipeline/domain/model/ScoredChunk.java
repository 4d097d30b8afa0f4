package com.flamingo.ai.contentpipeline.domain.model;

/** A retrieved chunk with its cosine similarity to the query. */
public record ScoredChunk(Chunk chunk, double score) {}
