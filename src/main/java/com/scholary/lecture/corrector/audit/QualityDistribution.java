package com.scholary.lecture.corrector.audit;

/** Segment counts per quality band. */
public record QualityDistribution(int excellent, int good, int fair, int poor) {

  public static final double EXCELLENT = 0.8;
  public static final double GOOD = 0.6;
  public static final double FAIR = 0.4;

  public static QualityDistribution empty() {
    return new QualityDistribution(0, 0, 0, 0);
  }

  public QualityDistribution add(double score) {
    if (score >= EXCELLENT) {
      return new QualityDistribution(excellent + 1, good, fair, poor);
    }
    if (score >= GOOD) {
      return new QualityDistribution(excellent, good + 1, fair, poor);
    }
    if (score >= FAIR) {
      return new QualityDistribution(excellent, good, fair + 1, poor);
    }
    return new QualityDistribution(excellent, good, fair, poor + 1);
  }

  public int total() {
    return excellent + good + fair + poor;
  }
}
