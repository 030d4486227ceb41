package com.scholary.lecture.corrector.llm;

/**
 * Interface for text-generation services.
 *
 * <p>{@link BedrockNovaClient} talks to Amazon Bedrock; {@link NoopLlmClient} is used when
 * escalation is disabled.
 */
public interface LlmClient {

  /**
   * Generate a reply.
   *
   * @param request the prompt and generation parameters
   * @return the reply text and token usage
   * @throws LlmException if the service is unavailable or returns no usable reply
   */
  LlmReply generate(LlmRequest request);

  /**
   * Whether calls can be attempted at all.
   *
   * @return false when escalation is disabled or the client could not be initialized
   */
  boolean isAvailable();
}
