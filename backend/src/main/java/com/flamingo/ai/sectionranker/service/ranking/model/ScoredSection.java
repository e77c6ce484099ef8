package com.flamingo.ai.sectionranker.service.ranking.model;

import com.flamingo.ai.sectionranker.service.extraction.model.Section;

/**
 * A section with its relevance score and 1-based rank.
 *
 * @param section the extracted section
 * @param score cosine similarity to the focus query, in [-1, 1]
 * @param rank position in the ranking, starting at 1
 */
public record ScoredSection(Section section, double score, int rank) {

  public String documentId() {
    return section.documentId();
  }

  public String title() {
    return section.title();
  }

  public String body() {
    return section.body();
  }

  public int pageIndex() {
    return section.pageIndex();
  }
}
