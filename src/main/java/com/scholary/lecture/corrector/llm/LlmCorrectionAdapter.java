package com.scholary.lecture.corrector.llm;

import com.scholary.lecture.corrector.cache.LlmReplyCache;
import com.scholary.lecture.corrector.config.CostProperties;
import com.scholary.lecture.corrector.logging.StructuredLogger;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends one rule-corrected segment to the LLM and returns its rewrite.
 *
 * <p>The adapter never fails the caller. An unavailable client, an exhausted session budget, a
 * failed call, or a reply that is blank or unchanged all yield an empty result, and the caller
 * keeps the rule-corrected text.
 *
 * <p>Every billed call is recorded in the session's {@link RunAccounting}. Cache hits are free.
 */
@Component
public class LlmCorrectionAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(LlmCorrectionAdapter.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final LlmClient llmClient;
  private final LlmReplyCache cache;
  private final CorrectionPromptBuilder promptBuilder;
  private final LlmProperties llmProperties;
  private final CostProperties costProperties;

  public LlmCorrectionAdapter(
      LlmClient llmClient,
      LlmReplyCache cache,
      CorrectionPromptBuilder promptBuilder,
      LlmProperties llmProperties,
      CostProperties costProperties) {
    this.llmClient = llmClient;
    this.cache = cache;
    this.promptBuilder = promptBuilder;
    this.llmProperties = llmProperties;
    this.costProperties = costProperties;
  }

  public boolean isAvailable() {
    return llmClient.isAvailable();
  }

  /**
   * Ask the LLM to correct a segment.
   *
   * @param text the rule-corrected text
   * @param accounting counters of the current session
   * @return the rewritten text, only when it differs from the input
   */
  public Optional<String> correct(String text, RunAccounting accounting) {
    if (!llmClient.isAvailable()) {
      return Optional.empty();
    }

    String instruction = promptBuilder.build(text);
    String cacheKey = LlmReplyCache.generateKey(llmProperties.modelId(), instruction);

    Optional<String> cached = cache.get(cacheKey);
    if (cached.isPresent()) {
      LOGGER.debug("LLM cache hit: chars={}", text.length());
      return changedOnly(text, cached.get());
    }

    if (costProperties.isSessionBudgetExhausted(accounting.totalCost())) {
      LOGGER.warn(
          "Session LLM budget exhausted, skipping call: spent={}, limit={}",
          String.format("%.2f", costProperties.toDisplayCurrency(accounting.totalCost())),
          costProperties.maxCostPerSession());
      return Optional.empty();
    }

    LlmReply reply;
    try {
      reply =
          llmClient.generate(
              new LlmRequest(
                  instruction,
                  llmProperties.temperature(),
                  llmProperties.topP(),
                  llmProperties.maxTokens()));
    } catch (RuntimeException e) {
      STRUCTURED_LOGGER.logLlmFailed(e.getClass().getSimpleName(), e.getMessage());
      return Optional.empty();
    }

    int inputTokens = Math.max(0, reply.inputTokens());
    int outputTokens = Math.max(0, reply.outputTokens());
    double callCost =
        accounting.record(
            inputTokens,
            outputTokens,
            llmProperties.inputRatePer1k(),
            llmProperties.outputRatePer1k());
    STRUCTURED_LOGGER.logLlmCall(
        inputTokens, outputTokens, costProperties.toDisplayCurrency(callCost));

    if (costProperties.isAlertThresholdReached(accounting.totalCost())
        && accounting.raiseCostAlert()) {
      STRUCTURED_LOGGER.logCostAlert(
          costProperties.toDisplayCurrency(accounting.totalCost()),
          costProperties.alertThreshold());
    }

    String corrected = reply.text() == null ? "" : reply.text().strip();
    if (corrected.isEmpty()) {
      STRUCTURED_LOGGER.logLlmFailed("EmptyReply", "LLM returned no text");
      return Optional.empty();
    }

    cache.put(cacheKey, corrected);
    return changedOnly(text, corrected);
  }

  private static Optional<String> changedOnly(String original, String corrected) {
    return corrected.equals(original) ? Optional.empty() : Optional.of(corrected);
  }
}
