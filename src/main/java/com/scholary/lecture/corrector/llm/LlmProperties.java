package com.scholary.lecture.corrector.llm;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the LLM client.
 *
 * <p>Rates are in USD per 1,000 tokens, as published for the model.
 */
@ConfigurationProperties(prefix = "llm")
@Validated
public record LlmProperties(
    boolean enabled,
    @NotBlank String region,
    @NotBlank String modelId,
    @DecimalMin("0.0") @DecimalMax("1.0") double temperature,
    @DecimalMin("0.0") @DecimalMax("1.0") double topP,
    @Positive int maxTokens,
    @Positive int apiCallTimeoutSeconds,
    @PositiveOrZero double inputRatePer1k,
    @PositiveOrZero double outputRatePer1k,
    @Valid @NotNull CacheProperties cache) {

  public record CacheProperties(@Positive int maxSize, @Positive int ttlHours) {}
}
