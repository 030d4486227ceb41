package com.scholary.lecture.corrector.job;

import com.scholary.lecture.corrector.service.BatchResult;
import java.time.Instant;

/**
 * Represents an async batch correction job.
 *
 * <p>Tracks the job's state and result. Stored in memory using Caffeine cache.
 */
public class BatchJob {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }

  private final String jobId;
  private final String inputDir;
  private final String outputDir;
  private final boolean enableLlm;
  private final Instant createdAt;

  private volatile Status status;
  private volatile BatchResult result;
  private volatile String error;

  public BatchJob(String jobId, String inputDir, String outputDir, boolean enableLlm) {
    this.jobId = jobId;
    this.inputDir = inputDir;
    this.outputDir = outputDir;
    this.enableLlm = enableLlm;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
  }

  public String getJobId() {
    return jobId;
  }

  public String getInputDir() {
    return inputDir;
  }

  /** Requested output directory, or null for the default. */
  public String getOutputDir() {
    return outputDir;
  }

  public boolean isEnableLlm() {
    return enableLlm;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public BatchResult getResult() {
    return result;
  }

  public void setResult(BatchResult result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
