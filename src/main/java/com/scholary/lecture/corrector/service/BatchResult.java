package com.scholary.lecture.corrector.service;

import java.util.List;

/**
 * Outcome of a batch run.
 *
 * @param outputDir where corrected files and statistics were written
 * @param processedFiles input file names that were corrected
 * @param failedFiles input file names that were skipped
 * @param statistics totals over every processed file
 */
public record BatchResult(
    String outputDir,
    List<String> processedFiles,
    List<String> failedFiles,
    RunStatistics statistics) {

  public BatchResult {
    processedFiles = List.copyOf(processedFiles);
    failedFiles = List.copyOf(failedFiles);
  }
}
