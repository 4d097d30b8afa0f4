package com.flamingo.ai.contentpipeline.service.pipeline.quality;

import com.flamingo.ai.contentpipeline.config.PipelineConfig;
import com.flamingo.ai.contentpipeline.domain.enums.IssueKind;
import com.flamingo.ai.contentpipeline.domain.model.CritiqueIssue;
import com.flamingo.ai.contentpipeline.domain.model.CritiqueResult;
import com.flamingo.ai.contentpipeline.domain.model.DraftContent;
import com.flamingo.ai.contentpipeline.domain.model.DraftSection;
import com.flamingo.ai.contentpipeline.domain.model.Outline;
import com.flamingo.ai.contentpipeline.domain.model.OutlineSection;
import com.flamingo.ai.contentpipeline.domain.model.RetrievalContext;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Scores a draft without calling a model, so the same draft always gets the same score.
 *
 * <ul>
 *   <li><b>groundedness</b>: share of claims (sentences of five or more words) whose content
 *       words mostly occur in a single retrieved chunk
 *   <li><b>redundancy</b>: share of word trigrams that appear in more than one section
 *   <li><b>structural completeness</b>: share of outline sections written with enough words
 * </ul>
 *
 * <p>The combined score is the weighted mean of groundedness, {@code 1 - redundancy} and
 * structural completeness.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HeuristicQualityScorer {

  static final int MIN_CLAIM_WORDS = 5;
  static final double REDUNDANT_PAIR_SIMILARITY = 0.3;

  private final PipelineConfig pipelineConfig;

  public CritiqueResult score(DraftContent draft, RetrievalContext context, Outline outline) {
    PipelineConfig.Quality quality = pipelineConfig.getQuality();
    List<DraftSection> sections = sectionsOf(draft);
    List<CritiqueIssue> issues = new ArrayList<>();

    double groundedness = groundedness(sections, context, quality.getGroundingOverlap(), issues);
    double redundancy = redundancy(sections, issues);
    double structure =
        structuralCompleteness(sections, outline, quality.getMinSectionWords(), issues);

    double weightSum =
        quality.getGroundednessWeight()
            + quality.getRedundancyWeight()
            + quality.getStructureWeight();
    double score =
        weightSum <= 0
            ? 0
            : (quality.getGroundednessWeight() * groundedness
                    + quality.getRedundancyWeight() * (1 - redundancy)
                    + quality.getStructureWeight() * structure)
                / weightSum;
    score = Math.max(0, Math.min(1, score));

    log.debug(
        "Scored draft {}: score={}, groundedness={}, redundancy={}, structure={}, issues={}",
        draft.attempt(),
        score,
        groundedness,
        redundancy,
        structure,
        issues.size());
    return new CritiqueResult(score, groundedness, redundancy, structure, issues, null, 0);
  }

  private double groundedness(
      List<DraftSection> sections,
      RetrievalContext context,
      double requiredOverlap,
      List<CritiqueIssue> issues) {
    List<Set<String>> chunkTokens =
        context.entries().stream()
            .map(entry -> TextAnalysis.contentTokens(entry.chunk().text()))
            .toList();

    int claims = 0;
    int grounded = 0;
    for (DraftSection section : sections) {
      int sectionClaims = 0;
      int sectionGrounded = 0;
      for (String sentence : TextAnalysis.sentences(section.body())) {
        Set<String> tokens = TextAnalysis.contentTokens(sentence);
        if (TextAnalysis.wordCount(sentence) < MIN_CLAIM_WORDS || tokens.isEmpty()) {
          continue;
        }
        sectionClaims++;
        boolean traceable =
            chunkTokens.stream()
                .anyMatch(chunk -> TextAnalysis.coverage(tokens, chunk) >= requiredOverlap);
        if (traceable) {
          sectionGrounded++;
        }
      }
      if (sectionGrounded < sectionClaims) {
        issues.add(
            new CritiqueIssue(
                IssueKind.UNGROUNDED_CLAIM,
                location(section.heading()),
                (sectionClaims - sectionGrounded)
                    + " of "
                    + sectionClaims
                    + " claims are not traceable to the research sources"));
      }
      claims += sectionClaims;
      grounded += sectionGrounded;
    }
    return claims == 0 ? 0 : (double) grounded / claims;
  }

  private double redundancy(List<DraftSection> sections, List<CritiqueIssue> issues) {
    if (sections.size() < 2) {
      return 0;
    }
    List<Set<String>> shingles =
        sections.stream().map(s -> TextAnalysis.shingles(s.body())).toList();

    Map<String, Integer> sectionsPerShingle = new HashMap<>();
    for (Set<String> sectionShingles : shingles) {
      for (String shingle : sectionShingles) {
        sectionsPerShingle.merge(shingle, 1, Integer::sum);
      }
    }

    for (int i = 0; i < sections.size(); i++) {
      for (int j = i + 1; j < sections.size(); j++) {
        double similarity = jaccard(shingles.get(i), shingles.get(j));
        if (similarity > REDUNDANT_PAIR_SIMILARITY) {
          issues.add(
              new CritiqueIssue(
                  IssueKind.REDUNDANT_CONTENT,
                  location(sections.get(i).heading()) + "|" + location(sections.get(j).heading()),
                  String.format("Sections repeat each other (%.0f%% shared)", similarity * 100)));
        }
      }
    }

    if (sectionsPerShingle.isEmpty()) {
      return 0;
    }
    long repeated = sectionsPerShingle.values().stream().filter(count -> count > 1).count();
    return (double) repeated / sectionsPerShingle.size();
  }

  private double structuralCompleteness(
      List<DraftSection> sections,
      Outline outline,
      int minSectionWords,
      List<CritiqueIssue> issues) {
    if (outline == null || outline.sections().isEmpty()) {
      return sections.isEmpty() ? 0 : 1;
    }
    Map<String, DraftSection> byHeading = new HashMap<>();
    for (DraftSection section : sections) {
      byHeading.putIfAbsent(TextAnalysis.normalizeHeading(section.heading()), section);
    }

    int complete = 0;
    for (OutlineSection planned : outline.sections()) {
      DraftSection written = byHeading.get(TextAnalysis.normalizeHeading(planned.heading()));
      if (written == null) {
        issues.add(
            new CritiqueIssue(
                IssueKind.MISSING_SECTION, location(planned.heading()), "Section is missing"));
        continue;
      }
      int words = TextAnalysis.wordCount(written.body());
      if (words < minSectionWords) {
        issues.add(
            new CritiqueIssue(
                IssueKind.THIN_SECTION,
                location(planned.heading()),
                "Section has " + words + " words, expected about " + planned.estimatedWords()));
        continue;
      }
      complete++;
    }
    return (double) complete / outline.sections().size();
  }

  private List<DraftSection> sectionsOf(DraftContent draft) {
    if (!draft.sections().isEmpty()) {
      return draft.sections();
    }
    return List.of(new DraftSection(draft.title(), draft.markdown(), List.of()));
  }

  private static double jaccard(Set<String> a, Set<String> b) {
    if (a.isEmpty() && b.isEmpty()) {
      return 0;
    }
    Set<String> intersection = new HashSet<>(a);
    intersection.retainAll(b);
    int union = a.size() + b.size() - intersection.size();
    return (double) intersection.size() / union;
  }

  private static String location(String heading) {
    return "section:" + heading;
  }
}
