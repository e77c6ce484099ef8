package com.flamingo.ai.sectionranker.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.sectionranker.config.RankingConfig;
import com.flamingo.ai.sectionranker.service.extraction.model.PageFontProfile;
import com.flamingo.ai.sectionranker.service.extraction.model.StyleSignature;
import com.flamingo.ai.sectionranker.service.extraction.model.TextBlock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TitleClassifier Tests")
class TitleClassifierTest {

  private static final PageFontProfile BODY_PROFILE =
      new PageFontProfile(11f, new StyleSignature("Helvetica", false));

  private RankingConfig rankingConfig;
  private TitleClassifier classifier;

  @BeforeEach
  void setUp() {
    rankingConfig = new RankingConfig();
    classifier = new TitleClassifier(rankingConfig);
  }

  @Test
  @DisplayName("Should accept a short, larger, bold block")
  void shouldAcceptTypicalHeading() {
    TextBlock heading = block("Introduction to the Region", 18f, "Helvetica", true, 1);

    assertThat(classifier.isTitle(heading, BODY_PROFILE)).isTrue();
  }

  @Test
  @DisplayName("Should accept a heading that differs only by font family")
  void shouldAcceptDifferentFamily() {
    TextBlock heading = block("Coastal Adventures", 16f, "Georgia", false, 1);

    assertThat(classifier.isTitle(heading, BODY_PROFILE)).isTrue();
  }

  @Nested
  @DisplayName("Each condition is required")
  class EachConditionRequired {

    @Test
    @DisplayName("Should reject a block with more than two lines")
    void shouldRejectTooManyLines() {
      TextBlock block = block("Three\nshort\nlines", 18f, "Helvetica", true, 3);

      assertThat(classifier.isShortForm(block)).isFalse();
      assertThat(classifier.isTitle(block, BODY_PROFILE)).isFalse();
    }

    @Test
    @DisplayName("Should reject a block with ten or more words")
    void shouldRejectTooManyWords() {
      TextBlock block =
          block("one two three four five six seven eight nine ten", 18f, "Helvetica", true, 1);

      assertThat(classifier.isShortForm(block)).isFalse();
      assertThat(classifier.isTitle(block, BODY_PROFILE)).isFalse();
    }

    @Test
    @DisplayName("Should accept nine words as short form")
    void shouldAcceptNineWords() {
      TextBlock block =
          block("one two three four five six seven eight nine", 18f, "Helvetica", true, 2);

      assertThat(classifier.isShortForm(block)).isTrue();
    }

    @Test
    @DisplayName("Should reject a block set at the dominant size")
    void shouldRejectSameSize() {
      TextBlock block = block("Bold Lead-in", 11f, "Helvetica", true, 1);

      assertThat(classifier.isLarger(block, BODY_PROFILE)).isFalse();
      assertThat(classifier.isTitle(block, BODY_PROFILE)).isFalse();
    }

    @Test
    @DisplayName("Should reject a block that is larger only within the margin")
    void shouldRejectWithinMargin() {
      TextBlock block = block("Slightly Larger", 11.4f, "Helvetica", true, 1);

      assertThat(classifier.isLarger(block, BODY_PROFILE)).isFalse();
    }

    @Test
    @DisplayName("Should reject a larger block in the dominant style")
    void shouldRejectSameStyle() {
      TextBlock block = block("Pull Quote", 18f, "helvetica", false, 1);

      assertThat(classifier.isEmphasized(block, BODY_PROFILE)).isFalse();
      assertThat(classifier.isTitle(block, BODY_PROFILE)).isFalse();
    }

    @Test
    @DisplayName("Should reject an empty block")
    void shouldRejectEmptyBlock() {
      TextBlock block = block("  ", 18f, "Helvetica", true, 1);

      assertThat(classifier.isTitle(block, BODY_PROFILE)).isFalse();
    }
  }

  @Test
  @DisplayName("Should honour configured thresholds")
  void shouldHonourConfiguredThresholds() {
    rankingConfig.getExtraction().setMaxTitleWords(3);
    rankingConfig.getExtraction().setFontSizeMargin(0f);

    TextBlock threeWords = block("Three Word Title", 18f, "Helvetica", true, 1);
    TextBlock tinyBump = block("Tiny Bump", 11.2f, "Helvetica", true, 1);

    assertThat(classifier.isTitle(threeWords, BODY_PROFILE)).isFalse();
    assertThat(classifier.isTitle(tinyBump, BODY_PROFILE)).isTrue();
  }

  private static TextBlock block(
      String text, float size, String family, boolean bold, int lineCount) {
    return new TextBlock("doc.pdf", 1, text, size, family, bold, false, lineCount);
  }
}
