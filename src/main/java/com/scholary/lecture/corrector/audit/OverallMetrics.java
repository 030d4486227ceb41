package com.scholary.lecture.corrector.audit;

/**
 * Whole-transcript change metrics.
 *
 * @param characterReduction characters removed (negative when the text grew)
 * @param characterReductionRatio reduction relative to the original length, 0 for an empty original
 * @param sentenceCountChange sentence terminators added
 * @param punctuationDensityImprovement change in {@code 。、} per whitespace token, 0 when either
 *     side has no tokens
 */
public record OverallMetrics(
    int characterReduction,
    double characterReductionRatio,
    int sentenceCountChange,
    double punctuationDensityImprovement) {}
