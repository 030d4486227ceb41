package com.scholary.lecture.corrector.scoring;

import com.scholary.lecture.corrector.correction.CorrectionCategory;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Shared shape of both scoring formulas.
 *
 * <p>score = base + category bonus + length adjustment + improvement bonus - deterioration
 * penalty, clamped to [0, 1]. Subclasses supply the base and the category bonus.
 */
public abstract class AbstractQualityScorer implements QualityScorer {

  static final double IMPROVEMENT_BONUS = 0.15;
  static final double DETERIORATION_PENALTY = 0.3;

  @Override
  public double score(
      String original, String corrected, Collection<CorrectionCategory> corrections) {
    Set<CorrectionCategory> distinct = EnumSet.noneOf(CorrectionCategory.class);
    distinct.addAll(corrections);

    double score = baseScore() + categoryBonus(distinct);
    score += QualityHeuristics.lengthAdjustment(original, corrected);

    if (QualityHeuristics.hasObviousImprovement(original, corrected)) {
      score += IMPROVEMENT_BONUS;
    }
    if (QualityHeuristics.hasDeterioration(original, corrected)) {
      score -= DETERIORATION_PENALTY;
    }

    return clamp(score);
  }

  protected abstract double baseScore();

  protected abstract double categoryBonus(Set<CorrectionCategory> categories);

  static double clamp(double score) {
    return Math.min(Math.max(score, 0.0), 1.0);
  }
}
