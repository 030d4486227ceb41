package com.scholary.lecture.corrector.scoring;

import com.scholary.lecture.corrector.correction.CorrectionCategory;
import java.util.Collection;

/**
 * Strategy interface for scoring a corrected segment.
 *
 * <p>Implementations must always return a value in [0, 1].
 */
public interface QualityScorer {

  /**
   * Score a segment.
   *
   * @param original the text before correction
   * @param corrected the text after correction
   * @param corrections the categories applied, duplicates allowed
   * @return quality in [0, 1]
   */
  double score(String original, String corrected, Collection<CorrectionCategory> corrections);

  /**
   * Get the variant implemented by this scorer.
   *
   * @return the scoring variant
   */
  ScoringVariant getVariant();
}
