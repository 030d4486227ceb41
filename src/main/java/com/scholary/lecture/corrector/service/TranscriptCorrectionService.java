package com.scholary.lecture.corrector.service;

import com.scholary.lecture.corrector.config.CorrectionProperties;
import com.scholary.lecture.corrector.config.CorrectionProperties.EscalationProperties;
import com.scholary.lecture.corrector.correction.CorrectionCategory;
import com.scholary.lecture.corrector.correction.CorrectionResult;
import com.scholary.lecture.corrector.correction.RuleCorrectionPipeline;
import com.scholary.lecture.corrector.llm.EscalationGate;
import com.scholary.lecture.corrector.llm.LlmCorrectionAdapter;
import com.scholary.lecture.corrector.llm.RunAccounting;
import com.scholary.lecture.corrector.logging.StructuredLogger;
import com.scholary.lecture.corrector.scoring.QualityScorer;
import com.scholary.lecture.corrector.segment.Segment;
import com.scholary.lecture.corrector.segment.TranscriptBlock;
import com.scholary.lecture.corrector.segment.TranscriptSegmenter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Corrects a whole transcript.
 *
 * <p>For each block, in source order:
 *
 * <ol>
 *   <li>Run the rule pipeline
 *   <li>Score the rule result
 *   <li>If escalation is on, the score is at most the use threshold, and the gate flags the text,
 *       ask the LLM
 *   <li>If the LLM changed the text, record a context correction and boost the score
 * </ol>
 *
 * <p>Blocks are independent. A failed LLM call only affects its own segment.
 */
@Service
public class TranscriptCorrectionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptCorrectionService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final TranscriptSegmenter segmenter;
  private final RuleCorrectionPipeline pipeline;
  private final QualityScorer scorer;
  private final EscalationGate gate;
  private final LlmCorrectionAdapter llmAdapter;
  private final EscalationProperties escalation;

  public TranscriptCorrectionService(
      TranscriptSegmenter segmenter,
      RuleCorrectionPipeline pipeline,
      QualityScorer scorer,
      EscalationGate gate,
      LlmCorrectionAdapter llmAdapter,
      CorrectionProperties properties) {
    this.segmenter = segmenter;
    this.pipeline = pipeline;
    this.scorer = scorer;
    this.gate = gate;
    this.llmAdapter = llmAdapter;
    this.escalation = properties.escalation();
  }

  /**
   * Correct a raw transcript.
   *
   * @param rawText transcript in the timestamped block format
   * @param enableLlm whether flagged segments may be sent to the LLM
   * @param accounting counters of the current session
   * @return corrected segments in source order, ids starting at 1
   * @throws CorrectionCancelledException if the thread is interrupted between segments
   */
  public List<Segment> correct(String rawText, boolean enableLlm, RunAccounting accounting) {
    List<TranscriptBlock> blocks = segmenter.split(rawText);
    boolean escalate = enableLlm && escalation.enabled() && llmAdapter.isAvailable();

    LOGGER.info(
        "Correcting transcript: blocks={}, scorer={}, llm={}",
        blocks.size(),
        scorer.getVariant(),
        escalate);

    List<Segment> segments = new ArrayList<>(blocks.size());
    for (TranscriptBlock block : blocks) {
      if (Thread.currentThread().isInterrupted()) {
        throw new CorrectionCancelledException(
            "Correction interrupted after " + segments.size() + " segments");
      }
      segments.add(correctBlock(segments.size() + 1, block, escalate, accounting));
    }

    return segments;
  }

  private Segment correctBlock(
      int id, TranscriptBlock block, boolean escalate, RunAccounting accounting) {
    CorrectionResult ruleResult = pipeline.correct(block.text());
    List<CorrectionCategory> corrections = new ArrayList<>(ruleResult.corrections());
    String corrected = ruleResult.text();
    if (corrected.isBlank()) {
      // An emptied segment would vanish when the transcript is read back
      LOGGER.debug("Rules emptied segment {}, keeping original text", id);
      corrected = block.text();
      corrections.clear();
    }
    double score = scorer.score(block.text(), corrected, corrections);
    boolean llmUsed = false;

    if (escalate && score <= escalation.useThreshold() && gate.requiresEscalation(corrected)) {
      STRUCTURED_LOGGER.logEscalation(id, gate.matchingDetectors(corrected));

      Optional<String> llmText = llmAdapter.correct(corrected, accounting);
      if (llmText.isPresent()) {
        corrected = llmText.get();
        corrections.add(CorrectionCategory.CONTEXT_CORRECTION);
        score = Math.min(1.0, score + escalation.qualityBoost());
        llmUsed = true;
      }
    }

    Segment segment =
        new Segment(
            id,
            block.startTime(),
            block.endTime(),
            block.text(),
            corrected,
            corrections,
            score,
            llmUsed);

    STRUCTURED_LOGGER.logSegmentCorrected(
        id, block.startTime(), corrections.size(), segment.qualityScore(), llmUsed);
    return segment;
  }
}
