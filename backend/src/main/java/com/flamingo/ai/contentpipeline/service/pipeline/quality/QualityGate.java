package com.flamingo.ai.contentpipeline.service.pipeline.quality;

import com.flamingo.ai.contentpipeline.config.PipelineConfig;
import com.flamingo.ai.contentpipeline.domain.enums.CritiqueDecision;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides what happens to a critiqued draft. Total and deterministic: every (score, iteration)
 * pair maps to exactly one decision, and a NaN score never approves.
 */
@Component
public class QualityGate {

  private final double approvalThreshold;
  private final int maxIterations;

  @Autowired
  public QualityGate(PipelineConfig pipelineConfig) {
    this(
        pipelineConfig.getQuality().getApprovalThreshold(),
        pipelineConfig.getQuality().getMaxIterations());
  }

  public QualityGate(double approvalThreshold, int maxIterations) {
    if (approvalThreshold < 0 || approvalThreshold > 1) {
      throw new IllegalArgumentException("approvalThreshold must be in [0, 1]");
    }
    if (maxIterations < 1) {
      throw new IllegalArgumentException("maxIterations must be at least 1");
    }
    this.approvalThreshold = approvalThreshold;
    this.maxIterations = maxIterations;
  }

  /**
   * @param score combined quality score of the draft
   * @param iteration traversals of the Critique to Write edge so far
   */
  public CritiqueDecision decide(double score, int iteration) {
    if (score >= approvalThreshold) {
      return CritiqueDecision.APPROVE;
    }
    if (iteration < maxIterations) {
      return CritiqueDecision.REVISE;
    }
    return CritiqueDecision.ESCALATE;
  }

  public int maxIterations() {
    return maxIterations;
  }
}
