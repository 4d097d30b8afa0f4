package com.flamingo.ai.contentpipeline.domain.model;

import com.flamingo.ai.contentpipeline.domain.enums.Visibility;
import java.time.Instant;

/** Identity of a post on the blog platform. */
public record PublishResult(
    String postId, String url, Visibility visibility, Instant publishedAt) {}
