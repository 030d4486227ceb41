package com.scholary.lecture.corrector.scoring;

import com.scholary.lecture.corrector.correction.CorrectionCategory;
import java.util.Set;

/** Base 0.3, plus 0.2 for each distinct category, with the bonus capped at 0.7. */
public class SimpleQualityScorer extends AbstractQualityScorer {

  private static final double BASE = 0.3;
  private static final double PER_CATEGORY = 0.2;
  private static final double MAX_BONUS = 0.7;

  @Override
  protected double baseScore() {
    return BASE;
  }

  @Override
  protected double categoryBonus(Set<CorrectionCategory> categories) {
    return Math.min(MAX_BONUS, categories.size() * PER_CATEGORY);
  }

  @Override
  public ScoringVariant getVariant() {
    return ScoringVariant.SIMPLE;
  }
}
