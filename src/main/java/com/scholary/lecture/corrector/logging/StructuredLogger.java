package com.scholary.lecture.corrector.logging;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log correction events with structured fields, so per-segment decisions
 * and LLM spend can be filtered by field in the log aggregator.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a finished segment. */
  public void logSegmentCorrected(
      int segmentId, String startTime, int corrections, double quality, boolean llmUsed) {
    try {
      MDC.put("event_type", "segment_corrected");
      MDC.put("segment_id", String.valueOf(segmentId));
      MDC.put("startTime", startTime);
      MDC.put("corrections", String.valueOf(corrections));
      MDC.put("quality", String.format("%.3f", quality));
      MDC.put("llmUsed", String.valueOf(llmUsed));

      logger.debug(
          "Segment corrected: id={}, start={}, corrections={}, quality={}, llm={}",
          segmentId,
          startTime,
          corrections,
          String.format("%.3f", quality),
          llmUsed);
    } finally {
      clearEventFields();
    }
  }

  /** Log a segment flagged for the LLM. */
  public void logEscalation(int segmentId, List<String> detectors) {
    try {
      MDC.put("event_type", "segment_escalated");
      MDC.put("segment_id", String.valueOf(segmentId));
      MDC.put("detectors", String.join(",", detectors));

      logger.info("Segment escalated to LLM: id={}, detectors={}", segmentId, detectors);
    } finally {
      clearEventFields();
    }
  }

  /** Log a completed LLM call. */
  public void logLlmCall(int inputTokens, int outputTokens, double displayCost) {
    try {
      MDC.put("event_type", "llm_call");
      MDC.put("inputTokens", String.valueOf(inputTokens));
      MDC.put("outputTokens", String.valueOf(outputTokens));
      MDC.put("cost", String.format("%.3f", displayCost));

      logger.info(
          "LLM call: inputTokens={}, outputTokens={}, cost={}",
          inputTokens,
          outputTokens,
          String.format("%.3f", displayCost));
    } finally {
      clearEventFields();
    }
  }

  /** Log an LLM call that produced nothing usable. */
  public void logLlmFailed(String errorType, String message) {
    try {
      MDC.put("event_type", "llm_failed");
      MDC.put("errorType", errorType);

      logger.warn(
          "LLM correction failed, keeping rule result: error={}, message={}", errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a session crossing its cost alert threshold. */
  public void logCostAlert(double displayCost, double threshold) {
    try {
      MDC.put("event_type", "cost_alert");
      MDC.put("cost", String.format("%.3f", displayCost));
      MDC.put("threshold", String.valueOf(threshold));

      logger.warn(
          "LLM cost alert: session cost {} reached threshold {}",
          String.format("%.2f", displayCost),
          threshold);
    } finally {
      clearEventFields();
    }
  }

  /** Log one batch file finished. */
  public void logBatchFileProcessed(
      String file, int segments, double averageQuality, long llmUsed, long elapsedMs) {
    try {
      MDC.put("event_type", "batch_file_processed");
      MDC.put("file", file);
      MDC.put("segments", String.valueOf(segments));
      MDC.put("quality", String.format("%.3f", averageQuality));
      MDC.put("llmUsed", String.valueOf(llmUsed));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Batch file processed: file={}, segments={}, quality={}, llm={}, elapsed={}ms",
          file,
          segments,
          String.format("%.3f", averageQuality),
          llmUsed,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log one batch file skipped. */
  public void logBatchFileFailed(String file, String errorType, String message) {
    try {
      MDC.put("event_type", "batch_file_failed");
      MDC.put("file", file);
      MDC.put("errorType", errorType);

      logger.error(
          "Batch file skipped: file={}, error={}, message={}", file, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String inputDir) {
    MDC.put("jobId", jobId);
    MDC.put("inputDir", inputDir);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("inputDir");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("segment_id");
    MDC.remove("startTime");
    MDC.remove("corrections");
    MDC.remove("quality");
    MDC.remove("llmUsed");
    MDC.remove("detectors");
    MDC.remove("inputTokens");
    MDC.remove("outputTokens");
    MDC.remove("cost");
    MDC.remove("errorType");
    MDC.remove("threshold");
    MDC.remove("file");
    MDC.remove("segments");
    MDC.remove("elapsedMs");
  }
}
