package com.flamingo.ai.sectionranker.service.extraction.model;

import java.util.List;

/**
 * The text blocks of one page in reading order.
 *
 * @param pageIndex 1-based page number
 * @param blocks blocks ordered top-to-bottom, left-to-right
 */
public record PageLayout(int pageIndex, List<TextBlock> blocks) {

  public PageLayout {
    blocks = blocks == null ? List.of() : List.copyOf(blocks);
  }
}
