package com.scholary.lecture.corrector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.lecture.corrector.llm.BedrockNovaClient;
import com.scholary.lecture.corrector.llm.LlmClient;
import com.scholary.lecture.corrector.llm.LlmProperties;
import com.scholary.lecture.corrector.llm.NoopLlmClient;
import com.scholary.lecture.corrector.scoring.QualityScorer;
import com.scholary.lecture.corrector.scoring.SimpleQualityScorer;
import com.scholary.lecture.corrector.scoring.WeightedQualityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for correction beans.
 *
 * <p>Loads the corrector, LLM and cost properties from application.yml, picks the quality scorer
 * variant, and wires the LLM client. With {@code llm.enabled=false} the service runs rule-only.
 */
@Configuration
@EnableConfigurationProperties({
  CorrectionProperties.class,
  LlmProperties.class,
  CostProperties.class
})
public class CorrectorConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(CorrectorConfig.class);

  @Bean
  public QualityScorer qualityScorer(CorrectionProperties properties) {
    return switch (properties.scoring()) {
      case SIMPLE -> new SimpleQualityScorer();
      case WEIGHTED -> new WeightedQualityScorer();
    };
  }

  @Bean
  public LlmClient llmClient(LlmProperties properties, ObjectMapper objectMapper) {
    if (!properties.enabled()) {
      LOGGER.info("LLM escalation disabled, running rule-only");
      return new NoopLlmClient();
    }

    try {
      return new BedrockNovaClient(properties, objectMapper);
    } catch (RuntimeException e) {
      LOGGER.warn(
          "Failed to create Bedrock client, running rule-only: region={}, error={}",
          properties.region(),
          e.getMessage());
      return new NoopLlmClient();
    }
  }
}
