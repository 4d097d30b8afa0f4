package com.flamingo.ai.contentpipeline.service.capability;

import java.util.Map;

/** A generation request: which task to run and the named values to fill its prompt with. */
public record PromptContext(GenerationTask task, Map<String, String> variables) {

  public PromptContext {
    variables = variables == null ? Map.of() : Map.copyOf(variables);
  }

  /** Returns the named variable, or an empty string when it was not supplied. */
  public String variable(String name) {
    return variables.getOrDefault(name, "");
  }
}
