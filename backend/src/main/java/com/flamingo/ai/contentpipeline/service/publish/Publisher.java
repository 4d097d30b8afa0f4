package com.flamingo.ai.contentpipeline.service.publish;

import com.flamingo.ai.contentpipeline.domain.enums.Visibility;
import com.flamingo.ai.contentpipeline.domain.model.FinalContent;
import com.flamingo.ai.contentpipeline.domain.model.PublishResult;
import com.flamingo.ai.contentpipeline.exception.PublishException;

/** Blog platform capability. */
public interface Publisher {

  /**
   * Publishes the post.
   *
   * @param content optimized content
   * @param visibility draft, published or scheduled
   * @return id and URL of the post
   * @throws PublishException if the platform rejects the post or cannot be reached
   */
  PublishResult publish(FinalContent content, Visibility visibility);

  /**
   * Replaces title, body, tags and visibility of a post that was published before.
   *
   * @param postId id returned by an earlier {@link #publish}
   * @throws PublishException if the platform rejects the update or cannot be reached
   */
  PublishResult update(String postId, FinalContent content, Visibility visibility);
}
