package com.flamingo.ai.contentpipeline.service.capability;

import com.flamingo.ai.contentpipeline.agent.ContentOptimizerAgent;
import com.flamingo.ai.contentpipeline.agent.DraftWriterAgent;
import com.flamingo.ai.contentpipeline.agent.OutlineAgent;
import com.flamingo.ai.contentpipeline.exception.FatalCapabilityException;
import io.micrometer.core.annotation.Timed;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link Generator} backed by the LangChain4j writing agents. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LangChain4jGenerator implements Generator {

  private final OutlineAgent outlineAgent;
  private final DraftWriterAgent draftWriterAgent;
  private final ContentOptimizerAgent contentOptimizerAgent;

  @Override
  @Timed(value = "generator.generate", description = "Time to generate text")
  public String generate(PromptContext context) {
    String capability = "generator." + context.task().name().toLowerCase(Locale.ROOT);
    log.debug("Generating {} with {} variables", context.task(), context.variables().size());

    String text;
    try {
      text =
          switch (context.task()) {
            case OUTLINE -> outlineAgent.outline(
                context.variable("title"),
                context.variable("description"),
                context.variable("keywords"),
                context.variable("audience"),
                context.variable("tone"),
                context.variable("confidenceNote"),
                context.variable("sources"));
            case DRAFT -> draftWriterAgent.write(
                context.variable("title"),
                context.variable("audience"),
                context.variable("tone"),
                context.variable("outline"),
                context.variable("sources"));
            case REVISE -> draftWriterAgent.revise(
                context.variable("title"),
                context.variable("outline"),
                context.variable("feedback"),
                context.variable("draft"),
                context.variable("sources"));
            case OPTIMIZE -> contentOptimizerAgent.optimize(
                context.variable("keywords"), context.variable("draft"));
          };
    } catch (RuntimeException e) {
      throw CapabilityFailures.classify(capability, e);
    }

    if (text == null || text.isBlank()) {
      throw new FatalCapabilityException(capability, "Model returned an empty response");
    }
    return text.strip();
  }
}
