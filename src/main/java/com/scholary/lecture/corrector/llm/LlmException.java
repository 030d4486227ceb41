package com.scholary.lecture.corrector.llm;

/**
 * Exception thrown when an LLM call fails.
 *
 * <p>This could be due to a disabled or unconfigured client, network issues, throttling, or a reply
 * without usable text. Callers treat every case the same way: keep the rule-corrected text.
 */
public class LlmException extends RuntimeException {

  public LlmException(String message) {
    super(message);
  }

  public LlmException(String message, Throwable cause) {
    super(message, cause);
  }
}
