package com.flamingo.ai.contentpipeline.service.capability;

import com.flamingo.ai.contentpipeline.exception.FatalCapabilityException;
import com.flamingo.ai.contentpipeline.exception.TransientCapabilityException;

/** Natural-language generation capability used by the outline, write and optimize stages. */
public interface Generator {

  /**
   * Generates text for the given prompt context.
   *
   * @param context task and prompt variables
   * @return generated text, never blank
   * @throws TransientCapabilityException on network or rate-limit failures
   * @throws FatalCapabilityException when the model is unavailable or returns unusable output
   */
  String generate(PromptContext context);
}
