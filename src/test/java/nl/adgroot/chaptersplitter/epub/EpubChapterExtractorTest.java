package nl.adgroot.chaptersplitter.epub;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.DetectionMethod;
import nl.adgroot.chaptersplitter.text.PagePosition;
import nl.adgroot.chaptersplitter.text.UnitPosition;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EpubChapterExtractorTest {

  private EpubBook book;
  private EpubChapterExtractor extractor;

  @BeforeEach
  void setUp() throws Exception {
    book = EpubFixtures.readSampleBook();
    extractor = new EpubChapterExtractor(book);
  }

  @Test
  void extract_fragmentChapter_keepsOnlyThatElement() {
    // GIVEN a chapter starting at #part-b of chapter two
    Chapter chapter = chapter("Part B", "text/ch2.xhtml", "part-b", 2);

    // WHEN
    List<EpubItem> units = extractor.extract(chapter);

    // THEN
    assertEquals(1, units.size());
    EpubItem unit = units.get(0);
    assertEquals("text/ch2.xhtml", unit.href());
    String xhtml = unit.text();
    assertTrue(xhtml.startsWith("<?xml"));
    Document doc = Jsoup.parse(xhtml);
    assertEquals("Part B", doc.title());
    assertTrue(doc.getElementById("part-b") != null);
    assertTrue(doc.getElementById("part-a") == null);
    assertFalse(xhtml.contains("First half."));
  }

  @Test
  void extract_missingFragment_usesWholeDocument() {
    Chapter chapter = chapter("Gone", "text/ch2.xhtml", "no-such-id", 2);

    List<EpubItem> units = extractor.extract(chapter);

    assertSame(book.itemByHref("text/ch2.xhtml").orElseThrow(), units.get(0));
  }

  @Test
  void extract_wholeDocumentRange_returnsUnitsInOrder() {
    Chapter chapter = new Chapter("Two and three", new UnitPosition("text/ch2.xhtml", null, 2), 2, 3, 1,
        DetectionMethod.MANIFEST, 0.6);

    List<EpubItem> units = extractor.extract(chapter);

    assertEquals(List.of("text/ch2.xhtml", "text/ch3.xhtml"), units.stream().map(EpubItem::href).toList());
  }

  @Test
  void extract_pageChapter_isRejected() {
    Chapter chapter = new Chapter("Page", new PagePosition(1), 1, 1, 1, DetectionMethod.NATIVE, 1.0);

    assertThrows(IllegalArgumentException.class, () -> extractor.extract(chapter));
  }

  @Test
  void plainText_putsBlocksOnTheirOwnLines() {
    String text = EpubChapterExtractor.plainText(book.itemByHref("text/ch2.xhtml").orElseThrow());

    assertEquals("Chapter Two\n\nPart A\n\nFirst half.\n\nPart B\n\nSecond half.", text);
  }

  @Test
  void plainText_keepsLineBreaksAndCollapsesSpaces() {
    EpubItem unit = new EpubItem("x", "x.xhtml", EpubItem.XHTML,
        "<html><body><p>one   two<br/>three</p></body></html>".getBytes(StandardCharsets.UTF_8));

    assertEquals("one two\nthree", EpubChapterExtractor.plainText(unit));
  }

  private static Chapter chapter(String title, String path, String fragment, int index) {
    return new Chapter(title, new UnitPosition(path, fragment, index), index, index, 2,
        DetectionMethod.NATIVE, 1.0);
  }
}
