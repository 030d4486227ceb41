package com.scholary.lecture.corrector.llm;

/**
 * Token and cost counters for one processing session.
 *
 * <p>One instance is created per run (a single request or a batch job) and passed to every LLM
 * call of that run. Counters only grow. All access is synchronized so concurrent calls within a
 * run cannot lose updates.
 */
public class RunAccounting {

  private long totalInputTokens;
  private long totalOutputTokens;
  private double totalCost;
  private boolean costAlertRaised;

  /**
   * Record one call.
   *
   * @param inputTokens tokens sent
   * @param outputTokens tokens received
   * @param inputRatePer1k price per 1,000 input tokens
   * @param outputRatePer1k price per 1,000 output tokens
   * @return the cost of this call
   */
  public synchronized double record(
      int inputTokens, int outputTokens, double inputRatePer1k, double outputRatePer1k) {
    if (inputTokens < 0 || outputTokens < 0) {
      throw new IllegalArgumentException("Token counts cannot be negative");
    }

    double callCost =
        inputTokens * inputRatePer1k / 1000.0 + outputTokens * outputRatePer1k / 1000.0;

    totalInputTokens += inputTokens;
    totalOutputTokens += outputTokens;
    totalCost += callCost;
    return callCost;
  }

  public synchronized long totalInputTokens() {
    return totalInputTokens;
  }

  public synchronized long totalOutputTokens() {
    return totalOutputTokens;
  }

  public synchronized double totalCost() {
    return totalCost;
  }

  /**
   * Latch the cost alert.
   *
   * @return true only the first time it is called in this session
   */
  public synchronized boolean raiseCostAlert() {
    if (costAlertRaised) {
      return false;
    }
    costAlertRaised = true;
    return true;
  }
}
