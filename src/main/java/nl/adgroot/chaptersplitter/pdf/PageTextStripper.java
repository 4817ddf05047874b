package nl.adgroot.chaptersplitter.pdf;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import nl.adgroot.chaptersplitter.text.PageText;
import nl.adgroot.chaptersplitter.text.TextRun;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

/**
 * Collects each page's text lines together with the largest font size on the line.
 *
 * <p>The stripper's own output is not used; run it against {@link java.io.Writer#nullWriter()}.
 */
class PageTextStripper extends PDFTextStripper {

  private final List<PageText> pages = new ArrayList<>();
  private final StringBuilder line = new StringBuilder();
  private List<TextRun> runs = new ArrayList<>();
  private float lineFontSize;

  PageTextStripper() throws IOException {
    setSortByPosition(true);
  }

  List<PageText> getPages() {
    return pages;
  }

  @Override
  protected void startPage(PDPage page) throws IOException {
    super.startPage(page);
    runs = new ArrayList<>();
    resetLine();
  }

  @Override
  protected void writeString(String text, List<TextPosition> textPositions) {
    line.append(text);
    for (TextPosition position : textPositions) {
      lineFontSize = Math.max(lineFontSize, position.getFontSizeInPt());
    }
  }

  @Override
  protected void writeWordSeparator() {
    line.append(' ');
  }

  @Override
  protected void writeLineSeparator() {
    flushLine();
  }

  @Override
  protected void endPage(PDPage page) throws IOException {
    flushLine();
    pages.add(new PageText(getCurrentPageNo(), runs));
    super.endPage(page);
  }

  private void flushLine() {
    String text = line.toString().strip();
    if (!text.isEmpty()) {
      runs.add(new TextRun(text, lineFontSize));
    }
    resetLine();
  }

  private void resetLine() {
    line.setLength(0);
    lineFontSize = 0f;
  }
}
