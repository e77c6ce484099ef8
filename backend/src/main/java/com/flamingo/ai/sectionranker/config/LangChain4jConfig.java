package com.flamingo.ai.sectionranker.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j embedding model.
 *
 * <p>The default "local" provider runs all-MiniLM-L6-v2 in-process, so a run needs neither network
 * access nor an API key. The "openai" provider is available for higher quality embeddings.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LangChain4jConfig {

  private final RankingConfig rankingConfig;

  @Bean
  public EmbeddingModel embeddingModel() {
    RankingConfig.Embedding embedding = rankingConfig.getEmbedding();
    String provider = embedding.getProvider() == null ? "local" : embedding.getProvider().trim();

    switch (provider.toLowerCase()) {
      case "local":
        log.info("Using local embedding model: all-MiniLM-L6-v2 (quantized)");
        return new AllMiniLmL6V2QuantizedEmbeddingModel();
      case "openai":
        RankingConfig.Embedding.OpenAi openai = embedding.getOpenai();
        validateApiKey(openai.getApiKey());
        log.info("Using OpenAI embedding model: {}", openai.getModelName());
        return OpenAiEmbeddingModel.builder()
            .apiKey(openai.getApiKey())
            .modelName(openai.getModelName())
            .dimensions(openai.getDimensions())
            .timeout(Duration.ofSeconds(openai.getTimeoutSeconds()))
            .build();
      default:
        throw new IllegalStateException(
            "Unknown embedding provider '" + provider + "'. Expected 'local' or 'openai'.");
    }
  }

  private void validateApiKey(String apiKey) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required for the openai embedding provider. Set OPENAI_API_KEY.");
    }
  }
}
