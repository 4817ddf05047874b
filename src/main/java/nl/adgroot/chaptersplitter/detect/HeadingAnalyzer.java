package nl.adgroot.chaptersplitter.detect;

import java.util.ArrayList;
import java.util.List;
import nl.adgroot.chaptersplitter.text.ChapterCandidate;
import nl.adgroot.chaptersplitter.text.DetectionMethod;
import nl.adgroot.chaptersplitter.text.MarkupUnit;
import nl.adgroot.chaptersplitter.text.PagePosition;
import nl.adgroot.chaptersplitter.text.PageText;
import nl.adgroot.chaptersplitter.text.TextRun;
import nl.adgroot.chaptersplitter.text.UnitPosition;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds chapter headings in documents without a usable outline.
 *
 * <p>Pages are scored by font size and ordinal patterns; markup documents are scanned for
 * {@code h1}..{@code hN} where N depends on the {@link Sensitivity}.
 */
public class HeadingAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(HeadingAnalyzer.class);

  private static final double[] TAG_CONFIDENCE = {1.0, 0.7, 0.5};

  private final Sensitivity sensitivity;

  public HeadingAnalyzer(Sensitivity sensitivity) {
    this.sensitivity = sensitivity;
  }

  public List<ChapterCandidate> analyze(DocumentSource source) {
    if (source.format().isPaginated()) {
      return analyzePages(source.pageTexts());
    }
    return analyzeMarkup(source.markupUnits());
  }

  public List<ChapterCandidate> analyzePages(List<PageText> pages) {
    List<ChapterCandidate> out = new ArrayList<>();
    for (PageText page : pages) {
      double average = page.averageFontSize();
      for (TextRun run : page.runs()) {
        if (run.text().isEmpty() || !isHeading(run, average)) {
          continue;
        }
        double confidence = confidence(run.text(), run.fontSize());
        if (confidence >= sensitivity.minConfidence()) {
          out.add(new ChapterCandidate(run.text(), new PagePosition(page.pageNumber()), 1,
              DetectionMethod.STRUCTURAL, confidence));
          // one chapter start per page
          break;
        }
      }
    }
    return out;
  }

  public List<ChapterCandidate> analyzeMarkup(List<MarkupUnit> units) {
    String query = headingQuery();
    List<ChapterCandidate> out = new ArrayList<>();
    for (MarkupUnit unit : units) {
      Document doc;
      try {
        doc = Jsoup.parse(unit.markup());
      } catch (RuntimeException e) {
        log.warn("Skipping unparseable content document {}: {}", unit.path(), e.getMessage());
        continue;
      }
      for (Element heading : doc.select(query)) {
        String title = heading.text().strip();
        if (title.isEmpty()) {
          continue;
        }
        int depth = heading.tagName().charAt(1) - '0';
        String id = heading.id();
        out.add(new ChapterCandidate(title,
            new UnitPosition(unit.path(), id.isEmpty() ? null : id, unit.unitIndex()),
            depth, DetectionMethod.STRUCTURAL, TAG_CONFIDENCE[depth - 1]));
      }
    }
    return out;
  }

  boolean isHeading(TextRun run, double pageAverageFontSize) {
    if (HeadingPatterns.matches(run.text())) {
      return true;
    }
    return pageAverageFontSize > 0
        && run.fontSize() >= pageAverageFontSize * sensitivity.fontSizeRatio()
        && run.wordCount() <= 10;
  }

  /** Score in [0, 1] for a heading candidate, independent of the page it sits on. */
  public static double confidence(String text, double fontSize) {
    double confidence = 0.5;
    if (HeadingPatterns.matches(text)) {
      confidence += 0.4;
    }
    if (fontSize >= 16) {
      confidence += 0.1;
    } else if (fontSize >= 14) {
      confidence += 0.05;
    }
    int words = text.isBlank() ? 0 : text.strip().split("\\s+").length;
    if (words > 10) {
      confidence -= 0.2;
    } else if (words > 6) {
      confidence -= 0.1;
    }
    return Math.min(1.0, Math.max(0.0, confidence));
  }

  private String headingQuery() {
    StringBuilder sb = new StringBuilder();
    for (int depth = 1; depth <= sensitivity.maxHeadingDepth(); depth++) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append('h').append(depth);
    }
    return sb.toString();
  }
}
