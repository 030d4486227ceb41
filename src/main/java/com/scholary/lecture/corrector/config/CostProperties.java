package com.scholary.lecture.corrector.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for LLM cost control.
 *
 * <p>Accounting is kept in USD; ceilings and reports use the display currency (JPY by default).
 * A ceiling or threshold of 0 disables that check.
 *
 * @param displayCurrencyRate display-currency units per USD
 * @param maxCostPerSession stop escalating once a session has spent this much
 * @param alertThreshold warn once when a session has spent this much
 * @param tracking whether the ceiling and alert are enforced
 */
@ConfigurationProperties(prefix = "cost")
@Validated
public record CostProperties(
    @Positive double displayCurrencyRate,
    @PositiveOrZero double maxCostPerSession,
    @PositiveOrZero double alertThreshold,
    boolean tracking) {

  public double toDisplayCurrency(double usd) {
    return usd * displayCurrencyRate;
  }

  public boolean isSessionBudgetExhausted(double spentUsd) {
    return tracking && maxCostPerSession > 0 && toDisplayCurrency(spentUsd) >= maxCostPerSession;
  }

  public boolean isAlertThresholdReached(double spentUsd) {
    return tracking && alertThreshold > 0 && toDisplayCurrency(spentUsd) >= alertThreshold;
  }
}
