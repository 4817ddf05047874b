package nl.adgroot.chaptersplitter.detect;

import java.util.ArrayList;
import java.util.List;
import nl.adgroot.chaptersplitter.text.ChapterCandidate;
import nl.adgroot.chaptersplitter.text.DetectionMethod;
import nl.adgroot.chaptersplitter.text.MarkupUnit;
import nl.adgroot.chaptersplitter.text.Titles;
import nl.adgroot.chaptersplitter.text.UnitPosition;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** One chapter per content document, in reading order. */
public class ManifestFallback {

  private static final Logger log = LoggerFactory.getLogger(ManifestFallback.class);

  static final double CONFIDENCE = 0.6;

  public List<ChapterCandidate> detect(DocumentSource source) {
    if (source.format().isPaginated()) {
      return List.of();
    }
    return detect(source.markupUnits());
  }

  public List<ChapterCandidate> detect(List<MarkupUnit> units) {
    List<ChapterCandidate> out = new ArrayList<>(units.size());
    for (MarkupUnit unit : units) {
      String title = titleOf(unit);
      if (title.isEmpty()) {
        title = Titles.fromFileName(unit.path());
      }
      out.add(new ChapterCandidate(title, new UnitPosition(unit.path(), null, unit.unitIndex()), 1,
          DetectionMethod.MANIFEST, CONFIDENCE));
    }
    return out;
  }

  static String titleOf(MarkupUnit unit) {
    Document doc;
    try {
      doc = Jsoup.parse(unit.markup());
    } catch (RuntimeException e) {
      log.warn("Could not read title of {}: {}", unit.path(), e.getMessage());
      return "";
    }
    Element title = doc.selectFirst("title");
    if (title != null && !title.text().isBlank()) {
      return title.text().strip();
    }
    for (String tag : List.of("h1", "h2")) {
      Element heading = doc.selectFirst(tag);
      if (heading != null) {
        return heading.text().strip();
      }
    }
    return "";
  }
}
