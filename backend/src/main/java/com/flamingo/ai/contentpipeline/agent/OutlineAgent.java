package com.flamingo.ai.contentpipeline.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that plans a blog post from the topic and the numbered research sources.
 *
 * <p>The reply is markdown: one {@code # Title} line, then one {@code ## Heading (~N words) [1, 3]}
 * line per section followed by {@code - key point} bullets. Bracketed numbers cite the sources the
 * section draws on.
 */
public interface OutlineAgent {

  @SystemMessage(
      """
        You are a content strategist planning a long-form technical blog post.
        Plan 4 to 7 sections that build on each other. Only plan sections the
        numbered sources can support.

        Reply in exactly this format and nothing else:
        # <post title>
        ## <section heading> (~<estimated words> words) [<source numbers, comma separated>]
        - <key point>
        - <key point>
        """)
  @UserMessage(
      """
        Title: {{title}}
        Description: {{description}}
        Keywords: {{keywords}}
        Target audience: {{audience}}
        Tone: {{tone}}
        {{confidenceNote}}

        Sources:
        {{sources}}
        """)
  String outline(
      @V("title") String title,
      @V("description") String description,
      @V("keywords") String keywords,
      @V("audience") String audience,
      @V("tone") String tone,
      @V("confidenceNote") String confidenceNote,
      @V("sources") String sources);
}
