package com.flamingo.ai.contentpipeline.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that polishes an approved draft for readability without changing its facts. */
public interface ContentOptimizerAgent {

  @SystemMessage(
      """
        You are an editor preparing an approved blog post for publication.
        Improve readability and flow, tighten wording and make headings descriptive.
        Do not add new facts, remove sections or change the meaning of any statement.
        Return only the complete post in markdown.
        """)
  @UserMessage("""
        Keywords: {{keywords}}

        Post:
        {{draft}}
        """)
  String optimize(@V("keywords") String keywords, @V("draft") String draft);
}
