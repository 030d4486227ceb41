package com.scholary.lecture.corrector.scoring;

import com.scholary.lecture.corrector.correction.CorrectionCategory;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Base 0.5, plus a weight per distinct category.
 *
 * <p>Weights reflect how much each kind of fix helps a reader: a wrong technical term is worse
 * than a leftover filler. Categories without a weight (context correction) add 0.02.
 */
public class WeightedQualityScorer extends AbstractQualityScorer {

  private static final double BASE = 0.5;
  private static final double DEFAULT_WEIGHT = 0.02;

  private static final Map<CorrectionCategory, Double> WEIGHTS =
      new EnumMap<>(CorrectionCategory.class);

  static {
    WEIGHTS.put(CorrectionCategory.TECHNICAL_TERM, 0.20);
    WEIGHTS.put(CorrectionCategory.REPETITION_REMOVAL, 0.15);
    WEIGHTS.put(CorrectionCategory.ENDING_FIX, 0.15);
    WEIGHTS.put(CorrectionCategory.PUNCTUATION, 0.10);
    WEIGHTS.put(CorrectionCategory.NATURALIZATION, 0.10);
    WEIGHTS.put(CorrectionCategory.FILLER_REMOVAL, 0.05);
  }

  @Override
  protected double baseScore() {
    return BASE;
  }

  @Override
  protected double categoryBonus(Set<CorrectionCategory> categories) {
    double bonus = 0.0;
    for (CorrectionCategory category : categories) {
      bonus += WEIGHTS.getOrDefault(category, DEFAULT_WEIGHT);
    }
    return bonus;
  }

  @Override
  public ScoringVariant getVariant() {
    return ScoringVariant.WEIGHTED;
  }
}
