package com.flamingo.ai.sectionranker.service.extraction.model;

import java.util.List;

/**
 * Raw page layout of one document.
 *
 * @param documentId identifier of the document (its file name)
 * @param pages pages in document order
 */
public record DocumentLayout(String documentId, List<PageLayout> pages) {

  public DocumentLayout {
    pages = pages == null ? List.of() : List.copyOf(pages);
  }

  public int blockCount() {
    return pages.stream().mapToInt(page -> page.blocks().size()).sum();
  }
}
