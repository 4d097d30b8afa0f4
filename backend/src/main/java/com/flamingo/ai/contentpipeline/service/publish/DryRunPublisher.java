package com.flamingo.ai.contentpipeline.service.publish;

import com.flamingo.ai.contentpipeline.domain.enums.Visibility;
import com.flamingo.ai.contentpipeline.domain.model.FinalContent;
import com.flamingo.ai.contentpipeline.domain.model.PublishResult;
import java.time.Instant;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** {@link Publisher} that only logs what would be published. The default mode. */
@Component
@ConditionalOnProperty(
    name = "pipeline.publish.mode",
    havingValue = "dry-run",
    matchIfMissing = true)
@Slf4j
public class DryRunPublisher implements Publisher {

  @Override
  public PublishResult publish(FinalContent content, Visibility visibility) {
    String postId = "dry-run-" + UUID.randomUUID().toString().substring(0, 8);
    log.info(
        "[DRY RUN] Would publish '{}' as {} ({} words, tags: {}, category: {})",
        content.title(),
        visibility,
        content.wordCount(),
        String.join(", ", content.tags()),
        content.category());
    return new PublishResult(
        postId, "https://example.tistory.com/" + postId, visibility, Instant.now());
  }

  @Override
  public PublishResult update(String postId, FinalContent content, Visibility visibility) {
    log.info(
        "[DRY RUN] Would update post {} with '{}' as {} ({} words)",
        postId,
        content.title(),
        visibility,
        content.wordCount());
    return new PublishResult(
        postId, "https://example.tistory.com/" + postId, visibility, Instant.now());
  }
}
