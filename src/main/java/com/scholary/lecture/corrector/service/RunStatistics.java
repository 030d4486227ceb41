package com.scholary.lecture.corrector.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.scholary.lecture.corrector.config.CostProperties;
import com.scholary.lecture.corrector.llm.RunAccounting;
import com.scholary.lecture.corrector.segment.Segment;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Summary of one correction run, persisted next to the corrected transcripts.
 *
 * @param totalSegments segments produced
 * @param llmUsage segments whose text the LLM changed
 * @param averageQuality mean quality score, 0 when there are no segments
 * @param highQualityCount segments scoring above {@value #HIGH_QUALITY_THRESHOLD}
 * @param totalCost LLM cost in the display currency
 * @param inputTokens LLM input tokens
 * @param outputTokens LLM output tokens
 * @param processingTimestamp local time the statistics were taken
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunStatistics(
    int totalSegments,
    long llmUsage,
    double averageQuality,
    long highQualityCount,
    double totalCost,
    long inputTokens,
    long outputTokens,
    String processingTimestamp) {

  public static final double HIGH_QUALITY_THRESHOLD = 0.7;

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  public static RunStatistics of(
      List<Segment> segments, RunAccounting accounting, CostProperties costProperties) {
    return of(segments, accounting, costProperties, LocalDateTime.now());
  }

  static RunStatistics of(
      List<Segment> segments,
      RunAccounting accounting,
      CostProperties costProperties,
      LocalDateTime timestamp) {
    long llmUsage = segments.stream().filter(Segment::llmUsed).count();
    double averageQuality =
        segments.stream().mapToDouble(Segment::qualityScore).average().orElse(0.0);
    long highQuality =
        segments.stream().filter(s -> s.qualityScore() > HIGH_QUALITY_THRESHOLD).count();

    return new RunStatistics(
        segments.size(),
        llmUsage,
        averageQuality,
        highQuality,
        costProperties.toDisplayCurrency(accounting.totalCost()),
        accounting.totalInputTokens(),
        accounting.totalOutputTokens(),
        timestamp.format(TIMESTAMP_FORMAT));
  }
}
