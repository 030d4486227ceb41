package com.scholary.lecture.corrector.cache;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class InMemoryLlmReplyCacheTest {

  private final InMemoryLlmReplyCache cache = new InMemoryLlmReplyCache(10, 1);

  @Test
  void get_shouldReturnStoredReply() {
    String key = LlmReplyCache.generateKey("model-a", "prompt");
    cache.put(key, "修正後");

    assertThat(cache.get(key)).contains("修正後");
  }

  @Test
  void generateKey_shouldSeparateModels() {
    cache.put(LlmReplyCache.generateKey("model-a", "prompt"), "a");

    assertThat(cache.get(LlmReplyCache.generateKey("model-b", "prompt"))).isEmpty();
  }

  @Test
  void clear_shouldDropEntries() {
    String key = LlmReplyCache.generateKey("model-a", "prompt");
    cache.put(key, "a");

    cache.clear();

    assertThat(cache.get(key)).isEmpty();
  }
}
