package com.flamingo.ai.sectionranker.service.ranking.embedding;

/**
 * Maps text to a fixed-length vector.
 *
 * <p>The focus query and every section must be embedded by the same provider so their vectors are
 * comparable. Implementations must be deterministic for identical input and safe to call from
 * several threads.
 */
public interface EmbeddingProvider {

  /**
   * Embeds a text.
   *
   * @param text non-blank text
   * @return embedding vector
   * @throws com.flamingo.ai.sectionranker.exception.EmbeddingException if no vector can be
   *     produced
   */
  float[] embed(String text);
}
