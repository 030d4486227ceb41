package com.scholary.lecture.corrector.llm;

/**
 * Reply from the LLM service.
 *
 * <p>Token counts are what the service reports for this call and drive cost accounting.
 */
public record LlmReply(String text, int inputTokens, int outputTokens) {}
