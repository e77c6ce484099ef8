package com.flamingo.ai.sectionranker.service.extraction.model;

import java.util.Locale;

/**
 * The visual emphasis of a text block: its font family and weight.
 *
 * @param fontFamily font family without subset prefix or style suffix, e.g. {@code Helvetica}
 * @param bold whether the block is set in a bold face
 */
public record StyleSignature(String fontFamily, boolean bold) {

  public StyleSignature {
    fontFamily = fontFamily == null ? "" : fontFamily.trim();
  }

  /** Returns {@code true} if weight or font family (case-insensitive) differ. */
  public boolean differsFrom(StyleSignature other) {
    return bold != other.bold
        || !fontFamily.toLowerCase(Locale.ROOT).equals(other.fontFamily.toLowerCase(Locale.ROOT));
  }
}
