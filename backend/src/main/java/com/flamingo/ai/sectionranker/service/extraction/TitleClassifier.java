package com.flamingo.ai.sectionranker.service.extraction;

import com.flamingo.ai.sectionranker.config.RankingConfig;
import com.flamingo.ai.sectionranker.service.extraction.model.PageFontProfile;
import com.flamingo.ai.sectionranker.service.extraction.model.TextBlock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Stateless predicate deciding whether a text block is a section title.
 *
 * <p>A block is a title only if all of the following hold:
 *
 * <ul>
 *   <li>it is short: at most {@code maxTitleLines} lines and fewer than {@code maxTitleWords}
 *       words;
 *   <li>its font is larger than the page's dominant size by more than {@code fontSizeMargin};
 *   <li>its weight or font family differs from the page's dominant style.
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class TitleClassifier {

  private final RankingConfig rankingConfig;

  public boolean isTitle(TextBlock block, PageFontProfile pageProfile) {
    return isShortForm(block) && isLarger(block, pageProfile) && isEmphasized(block, pageProfile);
  }

  boolean isShortForm(TextBlock block) {
    RankingConfig.Extraction thresholds = rankingConfig.getExtraction();
    int words = block.wordCount();
    return words > 0
        && block.lineCount() <= thresholds.getMaxTitleLines()
        && words < thresholds.getMaxTitleWords();
  }

  boolean isLarger(TextBlock block, PageFontProfile pageProfile) {
    float margin = Math.max(0f, rankingConfig.getExtraction().getFontSizeMargin());
    return block.fontSize() > pageProfile.dominantFontSize() + margin;
  }

  boolean isEmphasized(TextBlock block, PageFontProfile pageProfile) {
    return block.styleSignature().differsFrom(pageProfile.dominantStyle());
  }
}
