package com.flamingo.ai.contentpipeline.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that writes a markdown draft section by section from an outline. */
public interface DraftWriterAgent {

  @SystemMessage(
      """
        You are a technical writer. Write the blog post described by the outline in markdown.
        Use exactly one "## " heading per outline section, in outline order, with the same
        heading text. Base every factual statement on the provided sources and do not
        repeat the same material in different sections. Do not add a conclusion section
        unless the outline has one.
        """)
  @UserMessage(
      """
        Title: {{title}}
        Target audience: {{audience}}
        Tone: {{tone}}

        Outline:
        {{outline}}

        Sources:
        {{sources}}
        """)
  String write(
      @V("title") String title,
      @V("audience") String audience,
      @V("tone") String tone,
      @V("outline") String outline,
      @V("sources") String sources);

  @SystemMessage(
      """
        You are a technical writer revising a blog post after an editorial review.
        Fix every listed issue. Keep exactly one "## " heading per outline section, in outline
        order, with the same heading text. Ground claims in the provided sources and remove
        material that repeats across sections. Return the complete revised post in markdown.
        """)
  @UserMessage(
      """
        Title: {{title}}

        Outline:
        {{outline}}

        Review issues:
        {{feedback}}

        Previous draft:
        {{draft}}

        Sources:
        {{sources}}
        """)
  String revise(
      @V("title") String title,
      @V("outline") String outline,
      @V("feedback") String feedback,
      @V("draft") String draft,
      @V("sources") String sources);
}
