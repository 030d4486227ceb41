package com.scholary.lecture.corrector.cache;

import java.util.Optional;

/**
 * Cache of LLM corrections, keyed by model and prompt.
 *
 * <p>Lecture transcripts repeat themselves (greetings, closing phrases, re-recorded sections).
 * Caching means an identical prompt is only billed once while the entry lives.
 */
public interface LlmReplyCache {

  /**
   * Store a corrected text.
   *
   * @param cacheKey key from {@link #generateKey(String, String)}
   * @param correctedText the LLM output
   */
  void put(String cacheKey, String correctedText);

  /**
   * Retrieve a cached correction.
   *
   * @param cacheKey key from {@link #generateKey(String, String)}
   * @return the cached text, or empty if not found
   */
  Optional<String> get(String cacheKey);

  /** Drop every entry. */
  void clear();

  /**
   * Generate a cache key for a prompt.
   *
   * @param modelId the model that produced the reply
   * @param instruction the full prompt
   * @return a unique cache key
   */
  static String generateKey(String modelId, String instruction) {
    return modelId + "\n" + instruction;
  }
}
