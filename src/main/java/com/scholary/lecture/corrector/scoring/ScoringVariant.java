package com.scholary.lecture.corrector.scoring;

/**
 * Quality scoring formula.
 */
public enum ScoringVariant {
  /**
   * Count-based heuristic.
   *
   * <p>Base 0.3 plus a flat bonus per distinct correction category.
   */
  SIMPLE,

  /**
   * Weighted heuristic.
   *
   * <p>Base 0.5 plus a per-category weight. Used by the audit report regardless of configuration.
   */
  WEIGHTED
}
