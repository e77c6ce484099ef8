package com.flamingo.ai.sectionranker.service.extraction.model;

/**
 * A titled or untitled span of a document's content.
 *
 * @param documentId owning document
 * @param title title text, empty for content preceding the first detected title
 * @param body whitespace-normalized body text
 * @param pageIndex 1-based page of the title, or of the first content if untitled
 * @param discoveryOrder 0-based position of the section within its document
 */
public record Section(
    String documentId, String title, String body, int pageIndex, int discoveryOrder) {

  public Section {
    title = title == null ? "" : title;
    body = body == null ? "" : body;
  }

  public boolean isUntitled() {
    return title.isEmpty();
  }

  /** Title and body joined as {@code "title. body"}; used for filtering and embedding. */
  public String combinedText() {
    if (title.isEmpty()) {
      return body;
    }
    if (body.isEmpty()) {
      return title;
    }
    return title + ". " + body;
  }
}
