package com.flamingo.ai.sectionranker.service.extraction.model;

/**
 * One visually cohesive run of text on a page, as produced by the PDF layout reader.
 *
 * @param documentId identifier of the owning document (its file name)
 * @param pageIndex 1-based page number
 * @param text block text; lines are separated by {@code \n}
 * @param fontSize average font size in points
 * @param fontFamily normalized font family
 * @param bold bold face
 * @param italic italic or oblique face
 * @param lineCount number of lines in the block
 */
public record TextBlock(
    String documentId,
    int pageIndex,
    String text,
    float fontSize,
    String fontFamily,
    boolean bold,
    boolean italic,
    int lineCount) {

  public TextBlock {
    text = text == null ? "" : text;
    fontFamily = fontFamily == null ? "" : fontFamily;
  }

  public int wordCount() {
    String trimmed = text.strip();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }

  /** Character count used to weight the page font profile. */
  public int characterCount() {
    return text.strip().length();
  }

  public StyleSignature styleSignature() {
    return new StyleSignature(fontFamily, bold);
  }
}
