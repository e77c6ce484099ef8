package com.flamingo.ai.sectionranker.service.ranking.embedding;

import com.flamingo.ai.sectionranker.config.RankingConfig;
import com.flamingo.ai.sectionranker.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LangChainEmbeddingProvider implements EmbeddingProvider {

  private final EmbeddingModel embeddingModel;
  private final RankingConfig rankingConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Retry(name = "embedding")
  public float[] embed(String text) {
    if (text == null || text.isBlank()) {
      meterRegistry.counter("embedding.requests.failure", "reason", "blank").increment();
      throw new EmbeddingException("Cannot embed blank text");
    }

    int maxChars = rankingConfig.getEmbedding().getMaxChars();
    String input = text;
    if (maxChars > 0 && input.length() > maxChars) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          maxChars);
      input = input.substring(0, maxChars);
    }

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(input);
      float[] vector =
          response == null || response.content() == null
              ? new float[0]
              : response.content().vector();
      if (vector.length == 0) {
        meterRegistry.counter("embedding.requests.failure", "reason", "empty").increment();
        throw new EmbeddingException("Embedding model returned an empty vector");
      }
      meterRegistry.counter("embedding.requests.success").increment();
      log.trace("Embedded {} chars into {} dimensions", input.length(), vector.length);
      return vector;
    } catch (EmbeddingException e) {
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "reason", "model").increment();
      throw new EmbeddingException("Embedding model call failed: " + e.getMessage(), e);
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }
}
