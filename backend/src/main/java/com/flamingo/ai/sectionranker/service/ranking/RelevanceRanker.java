package com.flamingo.ai.sectionranker.service.ranking;

import com.flamingo.ai.sectionranker.config.AsyncConfig;
import com.flamingo.ai.sectionranker.config.RankingConfig;
import com.flamingo.ai.sectionranker.exception.EmbeddingException;
import com.flamingo.ai.sectionranker.service.extraction.model.Section;
import com.flamingo.ai.sectionranker.service.ranking.embedding.EmbeddingProvider;
import com.flamingo.ai.sectionranker.service.ranking.model.ScoredSection;
import com.flamingo.ai.sectionranker.service.ranking.model.TaskDescriptor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Orders a pool of sections by semantic relevance to a task.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Drop sections that violate the task's keyword constraints
 *   <li>Embed the focus query ("role: task") once
 *   <li>Embed each compliant section and score it by cosine similarity to the query
 *   <li>Stable sort by score descending, so ties keep extraction order
 *   <li>Assign ranks 1..N
 * </ol>
 *
 * <p>A section's score depends only on that section and the query. Section embeddings may run
 * concurrently; the sort always runs on the calling thread over the collected scores.
 */
@Service
@Slf4j
public class RelevanceRanker {

  private final KeywordComplianceFilter complianceFilter;
  private final EmbeddingProvider embeddingProvider;
  private final RankingConfig rankingConfig;
  private final MeterRegistry meterRegistry;
  private final Executor executor;

  public RelevanceRanker(
      KeywordComplianceFilter complianceFilter,
      EmbeddingProvider embeddingProvider,
      RankingConfig rankingConfig,
      MeterRegistry meterRegistry,
      @Qualifier(AsyncConfig.RANKING_EXECUTOR) Executor executor) {
    this.complianceFilter = complianceFilter;
    this.embeddingProvider = embeddingProvider;
    this.rankingConfig = rankingConfig;
    this.meterRegistry = meterRegistry;
    this.executor = executor;
  }

  /**
   * Filters and ranks sections.
   *
   * @param sections all candidate sections, in extraction order (document, then discovery)
   * @param task the task descriptor
   * @return compliant sections ordered by score descending with ranks assigned; empty if none
   *     survive filtering
   * @throws EmbeddingException if the focus query itself cannot be embedded
   */
  @Timed(value = "ranking.rank", description = "Time to filter, embed and rank sections")
  public List<ScoredSection> rank(List<Section> sections, TaskDescriptor task) {
    if (sections == null || sections.isEmpty()) {
      return List.of();
    }

    Predicate<Section> compliant = complianceFilter.forTask(task);
    List<Section> candidates = sections.stream().filter(compliant).toList();
    log.info(
        "{} of {} sections satisfy the keyword constraints", candidates.size(), sections.size());
    meterRegistry
        .counter("ranking.sections.filtered")
        .increment(sections.size() - candidates.size());

    if (candidates.isEmpty()) {
      return List.of();
    }

    String focusQuery = task.focusQuery();
    log.debug("Focus query: {}", focusQuery);
    float[] queryVector = embeddingProvider.embed(focusQuery);

    List<OptionalDouble> scores = scoreAll(candidates, queryVector);

    List<Candidate> scored = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      OptionalDouble score = scores.get(i);
      if (score.isPresent()) {
        scored.add(new Candidate(candidates.get(i), score.getAsDouble()));
      }
    }

    // List.sort is stable: equal scores keep extraction order
    scored.sort(Comparator.comparingDouble(Candidate::score).reversed());

    List<ScoredSection> ranked = new ArrayList<>(scored.size());
    for (int i = 0; i < scored.size(); i++) {
      Candidate candidate = scored.get(i);
      ranked.add(new ScoredSection(candidate.section(), candidate.score(), i + 1));
    }

    meterRegistry.counter("ranking.sections.ranked").increment(ranked.size());
    log.info("Ranked {} sections for persona '{}'", ranked.size(), task.personaRole());
    return List.copyOf(ranked);
  }

  /**
   * Returns the first {@code k} ranked sections, or all of them if there are fewer.
   *
   * @throws IllegalArgumentException if {@code k} is negative
   */
  public static List<ScoredSection> topK(List<ScoredSection> ranked, int k) {
    if (k < 0) {
      throw new IllegalArgumentException("k must be >= 0 (was " + k + ")");
    }
    return List.copyOf(ranked.subList(0, Math.min(k, ranked.size())));
  }

  private List<OptionalDouble> scoreAll(List<Section> candidates, float[] queryVector) {
    if (!rankingConfig.getParallelism().isEnabled() || candidates.size() == 1) {
      return candidates.stream().map(section -> score(section, queryVector)).toList();
    }

    List<CompletableFuture<OptionalDouble>> futures =
        candidates.stream()
            .map(
                section ->
                    CompletableFuture.supplyAsync(() -> score(section, queryVector), executor))
            .toList();
    try {
      return futures.stream().map(CompletableFuture::join).toList();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }

  private OptionalDouble score(Section section, float[] queryVector) {
    try {
      float[] sectionVector = embeddingProvider.embed(section.combinedText());
      return OptionalDouble.of(CosineSimilarity.of(queryVector, sectionVector));
    } catch (EmbeddingException e) {
      log.warn(
          "Skipping section '{}' of {} (page {}): {}",
          section.title(),
          section.documentId(),
          section.pageIndex(),
          e.getMessage());
      meterRegistry.counter("ranking.sections.skipped").increment();
      return OptionalDouble.empty();
    }
  }

  private record Candidate(Section section, double score) {}
}
