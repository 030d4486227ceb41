package com.scholary.lecture.corrector.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.lecture.corrector.llm.LlmProperties;
import com.scholary.lecture.corrector.llm.NoopLlmClient;
import com.scholary.lecture.corrector.scoring.ScoringVariant;
import com.scholary.lecture.corrector.scoring.SimpleQualityScorer;
import com.scholary.lecture.corrector.scoring.WeightedQualityScorer;
import org.junit.jupiter.api.Test;

class CorrectorConfigTest {

  private final CorrectorConfig config = new CorrectorConfig();

  @Test
  void qualityScorer_shouldFollowConfiguredVariant() {
    CorrectionProperties defaults = CorrectionProperties.defaults();
    CorrectionProperties simple =
        new CorrectionProperties(
            defaults.stages(),
            ScoringVariant.SIMPLE,
            defaults.escalation(),
            defaults.customTerms(),
            defaults.batch());

    assertThat(config.qualityScorer(defaults)).isInstanceOf(WeightedQualityScorer.class);
    assertThat(config.qualityScorer(simple)).isInstanceOf(SimpleQualityScorer.class);
  }

  @Test
  void llmClient_shouldBeNoopWhenDisabled() {
    LlmProperties disabled =
        new LlmProperties(
            false,
            "us-east-1",
            "amazon.nova-micro-v1:0",
            0.1,
            0.9,
            1000,
            60,
            0.000035,
            0.00014,
            new LlmProperties.CacheProperties(10, 1));

    assertThat(config.llmClient(disabled, new ObjectMapper()))
        .isInstanceOf(NoopLlmClient.class)
        .satisfies(client -> assertThat(client.isAvailable()).isFalse());
  }

  @Test
  void costProperties_shouldConvertAndCompareInDisplayCurrency() {
    CostProperties cost = new CostProperties(150, 100, 50, true);

    assertThat(cost.toDisplayCurrency(1.0)).isEqualTo(150.0);
    assertThat(cost.isAlertThresholdReached(0.3)).isFalse();
    assertThat(cost.isAlertThresholdReached(0.34)).isTrue();
    assertThat(cost.isSessionBudgetExhausted(0.6)).isFalse();
    assertThat(cost.isSessionBudgetExhausted(0.7)).isTrue();
  }

  @Test
  void costProperties_shouldTreatZeroLimitAsDisabled() {
    CostProperties unlimited = new CostProperties(150, 0, 0, true);

    assertThat(unlimited.isSessionBudgetExhausted(1_000_000)).isFalse();
    assertThat(unlimited.isAlertThresholdReached(1_000_000)).isFalse();
  }
}
