package com.flamingo.ai.sectionranker.service.extraction;

import com.flamingo.ai.sectionranker.config.RankingConfig;
import com.flamingo.ai.sectionranker.exception.DocumentProcessingException;
import com.flamingo.ai.sectionranker.service.extraction.model.DocumentLayout;
import com.flamingo.ai.sectionranker.service.extraction.model.PageLayout;
import com.flamingo.ai.sectionranker.service.extraction.model.TextBlock;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Component;

/**
 * Reads a PDF into per-page text blocks with font metrics.
 *
 * <p>Uses Apache PDFBox 3.x with position sorting. Words are grouped into lines by baseline, and
 * consecutive lines are merged into one block while they share font family, weight and size and
 * the baseline distance stays within {@code fontSize * blockGapRatio}. A change of style, a larger
 * gap or a page break starts a new block. The document's outline/bookmarks are never consulted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfBoxLayoutReader {

  private static final Pattern SUBSET_PREFIX = Pattern.compile("^[A-Z]{6}\\+");
  private static final float SAME_LINE_TOLERANCE = 2.0f;
  private static final float SAME_SIZE_TOLERANCE = 0.5f;

  private final RankingConfig rankingConfig;

  /**
   * Reads the page layout of a PDF.
   *
   * <p>The caller retains ownership of {@code inputStream}.
   *
   * @param documentId identifier recorded on every block
   * @param inputStream raw PDF bytes
   * @return layout with one {@link PageLayout} per page, including empty pages
   */
  public DocumentLayout read(String documentId, InputStream inputStream) {
    try {
      byte[] bytes = inputStream.readAllBytes();
      return read(documentId, bytes);
    } catch (IOException e) {
      log.error("Could not read PDF stream for {}: {}", documentId, e.getMessage());
      throw new DocumentProcessingException(
          documentId, "Failed to read PDF " + documentId + ": " + e.getMessage(), e);
    }
  }

  public DocumentLayout read(String documentId, byte[] bytes) {
    try (PDDocument pdfDoc = Loader.loadPDF(bytes)) {
      BlockCollectingStripper stripper =
          new BlockCollectingStripper(
              documentId,
              pdfDoc.getNumberOfPages(),
              rankingConfig.getExtraction().getBlockGapRatio());
      stripper.getText(pdfDoc);
      DocumentLayout layout = new DocumentLayout(documentId, stripper.getPages());
      log.debug(
          "Read {}: {} pages, {} blocks", documentId, layout.pages().size(), layout.blockCount());
      return layout;
    } catch (IOException e) {
      log.error("PDFBox parsing failed for {}: {}", documentId, e.getMessage());
      throw new DocumentProcessingException(
          documentId, "Failed to parse PDF " + documentId + ": " + e.getMessage(), e);
    }
  }

  /** Strips subset prefix ({@code ABCDEF+}) and style suffix ({@code -Bold}, {@code ,Italic}). */
  static String fontFamily(String fontName) {
    if (fontName == null || fontName.isBlank()) {
      return "";
    }
    String name = SUBSET_PREFIX.matcher(fontName.trim()).replaceFirst("");
    int cut = indexOfStyleSeparator(name);
    return cut > 0 ? name.substring(0, cut) : name;
  }

  static boolean isBold(PDFont font) {
    if (font == null) {
      return false;
    }
    String name = font.getName() == null ? "" : font.getName().toLowerCase(Locale.ROOT);
    if (name.contains("bold") || name.contains("black") || name.contains("heavy")) {
      return true;
    }
    PDFontDescriptor descriptor = font.getFontDescriptor();
    return descriptor != null && (descriptor.isForceBold() || descriptor.getFontWeight() >= 700f);
  }

  static boolean isItalic(PDFont font) {
    if (font == null) {
      return false;
    }
    String name = font.getName() == null ? "" : font.getName().toLowerCase(Locale.ROOT);
    if (name.contains("italic") || name.contains("oblique")) {
      return true;
    }
    PDFontDescriptor descriptor = font.getFontDescriptor();
    return descriptor != null && descriptor.isItalic();
  }

  private static int indexOfStyleSeparator(String name) {
    int dash = name.indexOf('-');
    int comma = name.indexOf(',');
    if (dash < 0) {
      return comma;
    }
    if (comma < 0) {
      return dash;
    }
    return Math.min(dash, comma);
  }

  // ---- inner types ----

  /** Collects lines during PDFTextStripper traversal and folds them into blocks per page. */
  private static final class BlockCollectingStripper extends PDFTextStripper {

    private final String documentId;
    private final float blockGapRatio;
    private final List<List<TextBlock>> blocksByPage = new ArrayList<>();

    private final List<LineInfo> pageLines = new ArrayList<>();
    private final List<String> currentWords = new ArrayList<>();
    private final List<TextPosition> currentPositions = new ArrayList<>();
    private float lastY = Float.NaN;

    BlockCollectingStripper(String documentId, int pageCount, float blockGapRatio)
        throws IOException {
      super();
      this.documentId = documentId;
      this.blockGapRatio = blockGapRatio;
      for (int i = 0; i < pageCount; i++) {
        blocksByPage.add(new ArrayList<>());
      }
      setSortByPosition(true);
    }

    @Override
    protected void startPage(PDPage page) throws IOException {
      pageLines.clear();
      currentWords.clear();
      currentPositions.clear();
      lastY = Float.NaN;
      super.startPage(page);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
      if (!textPositions.isEmpty()) {
        float y = textPositions.get(0).getYDirAdj();
        if (!Float.isNaN(lastY) && Math.abs(y - lastY) > SAME_LINE_TOLERANCE) {
          flushLine();
        }
        lastY = y;
        currentWords.add(text);
        currentPositions.addAll(textPositions);
      }
      super.writeString(text, textPositions);
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
      flushLine();
      int pageIndex = getCurrentPageNo();
      if (pageIndex >= 1 && pageIndex <= blocksByPage.size()) {
        blocksByPage.set(pageIndex - 1, foldIntoBlocks(pageLines, pageIndex));
      }
      super.endPage(page);
    }

    List<PageLayout> getPages() {
      List<PageLayout> pages = new ArrayList<>(blocksByPage.size());
      for (int i = 0; i < blocksByPage.size(); i++) {
        pages.add(new PageLayout(i + 1, blocksByPage.get(i)));
      }
      return pages;
    }

    private void flushLine() {
      if (currentPositions.isEmpty()) {
        currentWords.clear();
        return;
      }
      String text = String.join(" ", currentWords).strip();
      if (!text.isEmpty()) {
        float avgSize =
            (float)
                currentPositions.stream()
                    .mapToDouble(TextPosition::getFontSizeInPt)
                    .filter(s -> s > 0)
                    .average()
                    .orElse(0.0);
        PDFont font = dominantFont(currentPositions);
        String fontName = font != null && font.getName() != null ? font.getName() : "";
        pageLines.add(
            new LineInfo(
                text,
                currentPositions.get(0).getYDirAdj(),
                avgSize,
                fontFamily(fontName),
                isBold(font),
                isItalic(font)));
      }
      currentWords.clear();
      currentPositions.clear();
    }

    private PDFont dominantFont(List<TextPosition> positions) {
      return positions.stream()
          .filter(p -> p.getUnicode() != null && !p.getUnicode().isBlank())
          .map(TextPosition::getFont)
          .filter(Objects::nonNull)
          .findFirst()
          .orElse(null);
    }

    private List<TextBlock> foldIntoBlocks(List<LineInfo> lines, int pageIndex) {
      List<TextBlock> blocks = new ArrayList<>();
      List<LineInfo> current = new ArrayList<>();
      for (LineInfo line : lines) {
        if (!current.isEmpty() && !continuesBlock(current.get(current.size() - 1), line)) {
          blocks.add(toBlock(current, pageIndex));
          current.clear();
        }
        current.add(line);
      }
      if (!current.isEmpty()) {
        blocks.add(toBlock(current, pageIndex));
      }
      return blocks;
    }

    private boolean continuesBlock(LineInfo previous, LineInfo next) {
      boolean sameStyle =
          previous.bold() == next.bold()
              && previous.fontFamily().equalsIgnoreCase(next.fontFamily())
              && Math.abs(previous.fontSize() - next.fontSize()) <= SAME_SIZE_TOLERANCE;
      float gap = next.y() - previous.y();
      return sameStyle && gap >= 0 && gap <= previous.fontSize() * blockGapRatio;
    }

    private TextBlock toBlock(List<LineInfo> lines, int pageIndex) {
      StringBuilder text = new StringBuilder();
      double sizeSum = 0;
      for (LineInfo line : lines) {
        if (text.length() > 0) {
          text.append('\n');
        }
        text.append(line.text());
        sizeSum += line.fontSize();
      }
      LineInfo first = lines.get(0);
      return new TextBlock(
          documentId,
          pageIndex,
          text.toString(),
          (float) (sizeSum / lines.size()),
          first.fontFamily(),
          first.bold(),
          first.italic(),
          lines.size());
    }
  }

  /**
   * Metrics for a single line of text.
   *
   * @param text words of the line joined by single spaces
   * @param y baseline position measured from the top of the page
   * @param fontSize average font size of the line's glyphs
   * @param fontFamily normalized family of the line's first font
   * @param bold bold face
   * @param italic italic face
   */
  record LineInfo(
      String text, float y, float fontSize, String fontFamily, boolean bold, boolean italic) {}
}
