package com.flamingo.ai.contentpipeline.service.pipeline.stage;

import com.flamingo.ai.contentpipeline.domain.enums.ErrorClass;
import com.flamingo.ai.contentpipeline.domain.enums.Stage;
import com.flamingo.ai.contentpipeline.domain.model.PipelineState;
import com.flamingo.ai.contentpipeline.domain.model.RetrievalContext;
import com.flamingo.ai.contentpipeline.domain.model.TopicSpec;
import com.flamingo.ai.contentpipeline.exception.FatalCapabilityException;
import com.flamingo.ai.contentpipeline.service.rag.Retriever;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Retrieves grounding material for the topic. Each retry after an empty result uses a broader
 * query: title, description and keywords first, then title and keywords, then the title alone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchStage implements StageNode {

  private final Retriever retriever;

  @Override
  public Stage stage() {
    return Stage.RESEARCH;
  }

  @Override
  public StageOutcome execute(PipelineState state) {
    String query = buildQuery(state.getTopic(), state.getResearchAttempts());
    log.info(
        "Run {} researching (attempt {}): {}",
        state.getRunId(),
        state.getResearchAttempts() + 1,
        query);

    RetrievalContext context;
    try {
      context = retriever.retrieve(query);
    } catch (FatalCapabilityException e) {
      return StageOutcome.failed(ErrorClass.FATAL, "Research failed: " + e.getMessage());
    }
    state.setRetrievalContext(context);

    if (context.isEmpty()) {
      return StageOutcome.insufficientGrounding("No relevant sources found for '" + query + "'");
    }
    state.setLowConfidence(context.lowConfidence());
    if (context.lowConfidence()) {
      state.addWarning(
          "Low-confidence research: best similarity "
              + String.format("%.2f", context.entries().get(0).score())
              + " across "
              + context.entries().size()
              + " sources");
    }
    return StageOutcome.success();
  }

  static String buildQuery(TopicSpec topic, int attempt) {
    List<String> parts = new ArrayList<>();
    parts.add(topic.title());
    if (attempt == 0 && topic.description() != null && !topic.description().isBlank()) {
      parts.add(topic.description());
    }
    if (attempt <= 1 && !topic.keywords().isEmpty()) {
      parts.add(String.join(" ", topic.keywords()));
    }
    return String.join(" ", parts).strip();
  }
}
