package com.scholary.lecture.corrector.llm;

/**
 * A generation request sent to the LLM service.
 *
 * @param instruction the full prompt, including the text to correct
 * @param temperature sampling randomness
 * @param topP nucleus-sampling cutoff
 * @param maxTokens maximum output length
 */
public record LlmRequest(String instruction, double temperature, double topP, int maxTokens) {}
