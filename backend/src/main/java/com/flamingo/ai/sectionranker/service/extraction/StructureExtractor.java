package com.flamingo.ai.sectionranker.service.extraction;

import com.flamingo.ai.sectionranker.service.extraction.model.DocumentLayout;
import com.flamingo.ai.sectionranker.service.extraction.model.PageFontProfile;
import com.flamingo.ai.sectionranker.service.extraction.model.PageLayout;
import com.flamingo.ai.sectionranker.service.extraction.model.Section;
import com.flamingo.ai.sectionranker.service.extraction.model.TextBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reconstructs a document's sections from visual layout alone.
 *
 * <p>The scan is one forward pass over every page's blocks in reading order. A title block closes
 * the open section and opens a new one; any other block is appended to the open section, opening
 * an untitled one first if content precedes the first title. The font baseline used to classify
 * titles is recomputed for every page.
 *
 * <p>All scan state lives on the stack of {@link #extract}, so one instance can serve concurrent
 * documents.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructureExtractor {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final PageFontProfiler pageFontProfiler;
  private final TitleClassifier titleClassifier;

  private enum ScanState {
    NO_OPEN_SECTION,
    SECTION_OPEN
  }

  /**
   * Segments a document into sections.
   *
   * @param document raw page layout
   * @return sections in discovery order; empty if the document has no text
   */
  public List<Section> extract(DocumentLayout document) {
    List<Section> sections = new ArrayList<>();
    ScanState state = ScanState.NO_OPEN_SECTION;
    OpenSection open = null;

    for (PageLayout page : document.pages()) {
      if (page.blocks().isEmpty()) {
        log.debug("Page {} of {} has no text blocks", page.pageIndex(), document.documentId());
        continue;
      }
      PageFontProfile profile = pageFontProfiler.profile(page);
      log.trace(
          "Page {} of {}: dominant size={}, style={}",
          page.pageIndex(),
          document.documentId(),
          profile.dominantFontSize(),
          profile.dominantStyle());

      for (TextBlock block : page.blocks()) {
        if (block.text().isBlank()) {
          continue;
        }
        if (titleClassifier.isTitle(block, profile)) {
          if (state == ScanState.SECTION_OPEN) {
            sections.add(open.close(sections.size()));
          }
          open = new OpenSection(document.documentId(), clean(block.text()), page.pageIndex());
          state = ScanState.SECTION_OPEN;
        } else {
          if (state == ScanState.NO_OPEN_SECTION) {
            open = new OpenSection(document.documentId(), "", page.pageIndex());
            state = ScanState.SECTION_OPEN;
          }
          open.append(block.text());
        }
      }
    }

    if (state == ScanState.SECTION_OPEN) {
      sections.add(open.close(sections.size()));
    }

    log.debug(
        "Extracted {} sections from {} ({} pages, {} blocks)",
        sections.size(),
        document.documentId(),
        document.pages().size(),
        document.blockCount());
    return List.copyOf(sections);
  }

  /** Collapses whitespace runs, including newlines, to single spaces and trims. */
  static String clean(String text) {
    return WHITESPACE.matcher(text).replaceAll(" ").strip();
  }

  /** Accumulator for the section currently being scanned. */
  private static final class OpenSection {

    private final String documentId;
    private final String title;
    private final int pageIndex;
    private final StringBuilder body = new StringBuilder();

    OpenSection(String documentId, String title, int pageIndex) {
      this.documentId = documentId;
      this.title = title;
      this.pageIndex = pageIndex;
    }

    void append(String text) {
      if (body.length() > 0) {
        body.append(' ');
      }
      body.append(text);
    }

    Section close(int discoveryOrder) {
      return new Section(documentId, title, clean(body.toString()), pageIndex, discoveryOrder);
    }
  }
}
