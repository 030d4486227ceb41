package com.scholary.lecture.corrector.audit;

import com.scholary.lecture.corrector.correction.CorrectionCategory;
import com.scholary.lecture.corrector.correction.CorrectionRule;
import com.scholary.lecture.corrector.correction.CorrectionRules;
import com.scholary.lecture.corrector.scoring.QualityScorer;
import com.scholary.lecture.corrector.scoring.WeightedQualityScorer;
import com.scholary.lecture.corrector.segment.TranscriptBlock;
import com.scholary.lecture.corrector.segment.TranscriptSegmenter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compares an original transcript with its corrected version.
 *
 * <p>Both texts are split with the same {@link TranscriptSegmenter} used for correction and paired
 * by position. For every pair it records the detected corrections, a weighted quality score,
 * readability change, edit-distance similarity and a list of notable changes. Results are
 * aggregated into a quality distribution, per-category totals and whole-transcript metrics.
 *
 * <p>Segment counts that differ are not an error. The extra segments are left out and the report
 * states how many.
 */
@Component
public class DiffAnalyzer {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiffAnalyzer.class);

  static final int PREVIEW_LENGTH = 100;

  private static final Pattern SENTENCE_END = Pattern.compile("[。！？]");
  private static final Pattern COMMA_OR_STOP = Pattern.compile("[。、]");

  private final TranscriptSegmenter segmenter;
  private final CorrectionDetector detector;
  private final QualityScorer scorer = new WeightedQualityScorer();

  public DiffAnalyzer(TranscriptSegmenter segmenter, CorrectionDetector detector) {
    this.segmenter = segmenter;
    this.detector = detector;
  }

  public AuditReport analyze(String originalText, String correctedText) {
    List<TranscriptBlock> originals = segmenter.split(originalText);
    List<TranscriptBlock> corrections = segmenter.split(correctedText);

    int paired = Math.min(originals.size(), corrections.size());
    int unpaired = Math.max(originals.size(), corrections.size()) - paired;
    if (unpaired > 0) {
      LOGGER.warn(
          "Segment count mismatch, comparing first {} pairs: original={}, corrected={}",
          paired,
          originals.size(),
          corrections.size());
    }

    List<SegmentAudit> audits = new ArrayList<>(paired);
    Map<String, Integer> totals = new LinkedHashMap<>();
    for (CorrectionCategory category : CorrectionCategory.values()) {
      if (category.isLogged()) {
        totals.put(category.label(), 0);
      }
    }
    QualityDistribution distribution = QualityDistribution.empty();

    for (int i = 0; i < paired; i++) {
      SegmentAudit audit = analyzeSegment(i + 1, originals.get(i), corrections.get(i));
      audits.add(audit);
      for (CorrectionCategory category : audit.corrections()) {
        totals.merge(category.label(), 1, Integer::sum);
      }
      distribution = distribution.add(audit.qualityScore());
    }

    double averageQuality =
        audits.stream().mapToDouble(SegmentAudit::qualityScore).average().orElse(0.0);
    double averageReadability =
        audits.stream().mapToDouble(SegmentAudit::readabilityImprovement).average().orElse(0.0);

    LOGGER.info(
        "Audit complete: pairs={}, unpaired={}, averageQuality={}",
        paired,
        unpaired,
        String.format("%.3f", averageQuality));

    return new AuditReport(
        originals.size(),
        corrections.size(),
        unpaired,
        overallMetrics(joinText(originals), joinText(corrections)),
        audits,
        Collections.unmodifiableMap(totals),
        distribution,
        averageQuality,
        averageReadability);
  }

  SegmentAudit analyzeSegment(int id, TranscriptBlock original, TranscriptBlock corrected) {
    String before = original.text();
    String after = corrected.text();

    List<CorrectionCategory> detected = detector.detect(before, after);

    return new SegmentAudit(
        id,
        original.startTime(),
        original.endTime(),
        before.length(),
        after.length(),
        detected,
        scorer.score(before, after, detected),
        ReadabilityScorer.improvement(before, after),
        TextSimilarity.ratio(before, after),
        preview(before),
        preview(after),
        significantChanges(before, after));
  }

  List<String> significantChanges(String original, String corrected) {
    List<String> changes = new ArrayList<>();

    Matcher duplicate = CorrectionRules.DUPLICATED_PHRASE.matcher(original);
    while (duplicate.find()) {
      String phrase = duplicate.group();
      String kept = duplicate.group(1);
      if (!corrected.contains(phrase) && corrected.contains(kept)) {
        changes.add("duplicate phrase removed: 「" + phrase + "」→「" + kept + "」");
      }
    }

    for (CorrectionRule rule : detector.resolvedTermRules(original, corrected)) {
      Matcher term = rule.pattern().matcher(original);
      if (term.find()) {
        String replacement = rule.apply(term.group());
        if (corrected.contains(replacement)) {
          changes.add("term corrected: 「" + term.group() + "」→「" + replacement + "」");
        }
      }
    }

    int sentencesBefore = sentenceCount(original);
    int sentencesAfter = sentenceCount(corrected);
    if (sentencesAfter > sentencesBefore) {
      changes.add(
          "sentence breaks improved: " + sentencesBefore + " → " + sentencesAfter + " sentences");
    }

    return changes;
  }

  static OverallMetrics overallMetrics(String original, String corrected) {
    int reduction = original.length() - corrected.length();
    double reductionRatio = original.isEmpty() ? 0.0 : (double) reduction / original.length();

    int sentenceChange =
        ReadabilityScorer.count(SENTENCE_END, corrected)
            - ReadabilityScorer.count(SENTENCE_END, original);

    int originalTokens = ReadabilityScorer.tokenCount(original);
    int correctedTokens = ReadabilityScorer.tokenCount(corrected);
    double densityChange =
        originalTokens == 0 || correctedTokens == 0
            ? 0.0
            : (double) ReadabilityScorer.count(COMMA_OR_STOP, corrected) / correctedTokens
                - (double) ReadabilityScorer.count(COMMA_OR_STOP, original) / originalTokens;

    return new OverallMetrics(reduction, reductionRatio, sentenceChange, densityChange);
  }

  private static int sentenceCount(String text) {
    return (int) Arrays.stream(SENTENCE_END.split(text)).filter(s -> !s.isBlank()).count();
  }

  private static String preview(String text) {
    return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
  }

  private static String joinText(List<TranscriptBlock> blocks) {
    return blocks.stream().map(TranscriptBlock::text).collect(Collectors.joining("\n"));
  }
}
