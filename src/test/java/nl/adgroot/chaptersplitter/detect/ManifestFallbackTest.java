package nl.adgroot.chaptersplitter.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import nl.adgroot.chaptersplitter.text.ChapterCandidate;
import nl.adgroot.chaptersplitter.text.DetectionMethod;
import nl.adgroot.chaptersplitter.text.MarkupUnit;
import nl.adgroot.chaptersplitter.text.UnitPosition;
import org.junit.jupiter.api.Test;

class ManifestFallbackTest {

  private final ManifestFallback fallback = new ManifestFallback();

  @Test
  void detect_oneCandidatePerUnitInOrder() {
    List<MarkupUnit> units = List.of(
        new MarkupUnit("a.xhtml", 1, "<html><head><title> First </title></head><body><h1>Ignored</h1></body></html>"),
        new MarkupUnit("b.xhtml", 2, "<html><head><title></title></head><body><h2>Second</h2></body></html>"),
        new MarkupUnit("c.xhtml", 3, "<html><body><h1>Third</h1><h2>Sub</h2></body></html>"),
        new MarkupUnit("text/the-end.xhtml", 4, "<html><body><p>done</p></body></html>"));

    List<ChapterCandidate> found = fallback.detect(units);

    assertEquals(List.of("First", "Second", "Third", "The End"),
        found.stream().map(ChapterCandidate::title).toList());
    assertEquals(new UnitPosition("text/the-end.xhtml", null, 4), found.get(3).position());
    assertTrue(found.stream().allMatch(c -> c.method() == DetectionMethod.MANIFEST));
    assertTrue(found.stream().allMatch(c -> c.confidence() == ManifestFallback.CONFIDENCE));
  }

  @Test
  void detect_paginatedSource_findsNothing() {
    assertTrue(fallback.detect(FakeDocumentSource.paginated(12)).isEmpty());
  }
}
