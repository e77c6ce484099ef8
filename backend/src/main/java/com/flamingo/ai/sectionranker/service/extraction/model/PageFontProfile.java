package com.flamingo.ai.sectionranker.service.extraction.model;

/**
 * The dominant body style of a page, weighted by character count.
 *
 * @param dominantFontSize most common font size, rounded to whole points
 * @param dominantStyle most common font family and weight
 */
public record PageFontProfile(float dominantFontSize, StyleSignature dominantStyle) {

  /** Profile used for a page without any text. */
  public static final PageFontProfile FALLBACK =
      new PageFontProfile(10f, new StyleSignature("default", false));
}
