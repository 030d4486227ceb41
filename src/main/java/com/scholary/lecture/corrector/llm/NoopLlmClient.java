package com.scholary.lecture.corrector.llm;

/** Client used in rule-only mode. Never available; every call fails. */
public class NoopLlmClient implements LlmClient {

  @Override
  public LlmReply generate(LlmRequest request) {
    throw new LlmException("LLM escalation is disabled");
  }

  @Override
  public boolean isAvailable() {
    return false;
  }
}
