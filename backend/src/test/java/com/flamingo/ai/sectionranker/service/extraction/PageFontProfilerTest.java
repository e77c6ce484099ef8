package com.flamingo.ai.sectionranker.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.sectionranker.service.extraction.model.PageFontProfile;
import com.flamingo.ai.sectionranker.service.extraction.model.PageLayout;
import com.flamingo.ai.sectionranker.service.extraction.model.StyleSignature;
import com.flamingo.ai.sectionranker.service.extraction.model.TextBlock;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PageFontProfiler Tests")
class PageFontProfilerTest {

  private final PageFontProfiler profiler = new PageFontProfiler();

  @Test
  @DisplayName("Should weight styles by character count, not block count")
  void shouldWeightByCharacterCount() {
    PageLayout page =
        new PageLayout(
            1,
            List.of(
                block("Fig 1", 9f, "Arial", false),
                block("Fig 2", 9f, "Arial", false),
                block("Fig 3", 9f, "Arial", false),
                block(
                    "A long paragraph of body text that clearly outweighs the short captions.",
                    11f,
                    "Times",
                    false)));

    PageFontProfile profile = profiler.profile(page);

    assertThat(profile.dominantFontSize()).isEqualTo(11f);
    assertThat(profile.dominantStyle()).isEqualTo(new StyleSignature("Times", false));
  }

  @Test
  @DisplayName("Should round sizes when grouping blocks")
  void shouldRoundSizes() {
    PageLayout page =
        new PageLayout(
            1,
            List.of(
                block("first body paragraph", 10.8f, "Times", false),
                block("second body paragraph", 11.2f, "Times", false),
                block("Heading text here and more", 14f, "Times", true)));

    PageFontProfile profile = profiler.profile(page);

    assertThat(profile.dominantFontSize()).isEqualTo(11f);
    assertThat(profile.dominantStyle().bold()).isFalse();
  }

  @Test
  @DisplayName("Should prefer the first style on the page when weights tie")
  void shouldBreakTiesByFirstSeen() {
    PageLayout page =
        new PageLayout(
            1, List.of(block("abcd", 12f, "Times", true), block("wxyz", 10f, "Arial", false)));

    PageFontProfile profile = profiler.profile(page);

    assertThat(profile.dominantFontSize()).isEqualTo(12f);
    assertThat(profile.dominantStyle()).isEqualTo(new StyleSignature("Times", true));
  }

  @Test
  @DisplayName("Should fall back for a page without text")
  void shouldFallBackForEmptyPage() {
    PageLayout page = new PageLayout(3, List.of(block("   ", 12f, "Times", false)));

    assertThat(profiler.profile(page)).isEqualTo(PageFontProfile.FALLBACK);
    assertThat(profiler.profile(new PageLayout(4, List.of()))).isEqualTo(PageFontProfile.FALLBACK);
  }

  private static TextBlock block(String text, float size, String family, boolean bold) {
    return new TextBlock("doc.pdf", 1, text, size, family, bold, false, 1);
  }
}
