package com.flamingo.ai.sectionranker.config;

import com.flamingo.ai.sectionranker.service.analysis.CollectionAnalysisService;
import com.flamingo.ai.sectionranker.service.analysis.model.AnalysisOutput;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Startup runner that analyses the configured collection once.
 *
 * <p>Enabled with {@code ranking.runner.enabled=true}. A failure is logged and does not stop the
 * application.
 */
@Component
@ConditionalOnProperty(prefix = "ranking.runner", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class CollectionRunner implements CommandLineRunner {

  private final CollectionAnalysisService analysisService;
  private final RankingConfig rankingConfig;

  @Override
  public void run(String... args) {
    String collection = rankingConfig.getRunner().getCollection();
    long start = System.currentTimeMillis();
    try {
      Path collectionDir = analysisService.resolveCollection(collection);
      AnalysisOutput output = analysisService.analyzeCollection(collectionDir);
      log.info(
          "Collection {} analysed in {} ms: {} sections written",
          collection,
          System.currentTimeMillis() - start,
          output.extractedSections().size());
    } catch (RuntimeException e) {
      log.error("Analysis of collection {} failed: {}", collection, e.getMessage(), e);
    }
  }
}
