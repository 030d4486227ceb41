package com.scholary.lecture.corrector.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.lecture.corrector.llm.LlmProperties;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * In-memory implementation of LlmReplyCache using Caffeine.
 *
 * <p>Size and lifetime are bounded by {@code llm.cache.*}. Oldest entries are evicted when the
 * limit is reached.
 */
@Component
public class InMemoryLlmReplyCache implements LlmReplyCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryLlmReplyCache.class);

  private final Cache<String, String> cache;

  @Autowired
  public InMemoryLlmReplyCache(LlmProperties properties) {
    this(properties.cache().maxSize(), properties.cache().ttlHours());
  }

  public InMemoryLlmReplyCache(int maxSize, int ttlHours) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofHours(ttlHours))
            .build();

    LOGGER.info("Initialized LLM reply cache: maxSize={}, ttlHours={}", maxSize, ttlHours);
  }

  @Override
  public void put(String cacheKey, String correctedText) {
    cache.put(cacheKey, correctedText);
  }

  @Override
  public Optional<String> get(String cacheKey) {
    String cached = cache.getIfPresent(cacheKey);
    if (cached != null) {
      LOGGER.debug("LLM cache hit");
      return Optional.of(cached);
    }
    return Optional.empty();
  }

  @Override
  public void clear() {
    cache.invalidateAll();
  }
}
