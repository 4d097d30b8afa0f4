package com.flamingo.ai.contentpipeline.domain.model;

import com.flamingo.ai.contentpipeline.domain.enums.CritiqueDecision;
import java.util.List;

/**
 * Quality assessment of one draft.
 *
 * @param score combined quality score in [0, 1]
 * @param groundedness fraction of claims traceable to the retrieval context
 * @param redundancy fraction of shingles repeated across sections (lower is better)
 * @param structuralCompleteness fraction of outline sections present with content
 * @param issues flagged problems, fed back to the writer on revision
 * @param decision quality gate decision, {@code null} until the executor has decided
 * @param iteration critique-loop iteration count at the time the draft was judged
 */
public record CritiqueResult(
    double score,
    double groundedness,
    double redundancy,
    double structuralCompleteness,
    List<CritiqueIssue> issues,
    CritiqueDecision decision,
    int iteration) {

  public CritiqueResult {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }

  public CritiqueResult withDecision(CritiqueDecision newDecision, int atIteration) {
    return new CritiqueResult(
        score, groundedness, redundancy, structuralCompleteness, issues, newDecision, atIteration);
  }
}
