package com.flamingo.ai.sectionranker.service.extraction;

import com.flamingo.ai.sectionranker.service.extraction.model.PageFontProfile;
import com.flamingo.ai.sectionranker.service.extraction.model.PageLayout;
import com.flamingo.ai.sectionranker.service.extraction.model.StyleSignature;
import com.flamingo.ai.sectionranker.service.extraction.model.TextBlock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Computes the dominant font size and style of a single page.
 *
 * <p>Each block votes for its (rounded size, style) pair with its character count, so one long
 * paragraph outweighs several short captions. Ties go to the style seen first on the page.
 */
@Component
public class PageFontProfiler {

  public PageFontProfile profile(PageLayout page) {
    Map<StyleKey, Integer> weights = new LinkedHashMap<>();
    for (TextBlock block : page.blocks()) {
      int characters = block.characterCount();
      if (characters == 0) {
        continue;
      }
      StyleKey key = new StyleKey(Math.round(block.fontSize()), block.styleSignature());
      weights.merge(key, characters, Integer::sum);
    }

    if (weights.isEmpty()) {
      return PageFontProfile.FALLBACK;
    }

    StyleKey dominant = null;
    int best = -1;
    for (Map.Entry<StyleKey, Integer> entry : weights.entrySet()) {
      if (entry.getValue() > best) {
        best = entry.getValue();
        dominant = entry.getKey();
      }
    }
    return new PageFontProfile(dominant.roundedSize(), dominant.style());
  }

  private record StyleKey(int roundedSize, StyleSignature style) {}
}
