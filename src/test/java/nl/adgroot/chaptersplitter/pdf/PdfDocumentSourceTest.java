package nl.adgroot.chaptersplitter.pdf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import nl.adgroot.chaptersplitter.detect.ChapterDetector;
import nl.adgroot.chaptersplitter.detect.DetectionStrategy;
import nl.adgroot.chaptersplitter.detect.MalformedSourceException;
import nl.adgroot.chaptersplitter.detect.OutlineNode;
import nl.adgroot.chaptersplitter.detect.Sensitivity;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.DetectionResult;
import nl.adgroot.chaptersplitter.text.PagePosition;
import nl.adgroot.chaptersplitter.text.PageText;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.junit.jupiter.api.Test;

class PdfDocumentSourceTest {

  @Test
  void outline_convertsBookmarkTreeToOnePageBasedNodes() throws Exception {
    // GIVEN six pages with a nested bookmark tree
    PDDocument doc = PdfFixtures.bodyOnly(6);
    PDDocumentOutline root = PdfFixtures.outline(doc);
    PDOutlineItem part = PdfFixtures.bookmark(doc, root, "Part I", 0);
    PdfFixtures.bookmark(doc, part, "Chapter 1", 1);
    PdfFixtures.bookmark(doc, part, "Chapter 2", 3);
    PdfFixtures.bookmark(doc, root, "Nowhere", -1);
    PdfFixtures.bookmark(doc, root, "Appendix", 5);

    try (PdfDocumentSource source = PdfDocumentSource.of("book.pdf", doc)) {
      // WHEN
      List<OutlineNode> outline = source.outline();

      // THEN
      assertEquals(3, outline.size());
      OutlineNode.Section first = assertInstanceOf(OutlineNode.Section.class, outline.get(0));
      assertEquals("Part I", first.title());
      assertEquals("1", first.destination());
      assertEquals(List.of("2", "4"), first.children().stream().map(OutlineNode::destination).toList());
      assertNull(outline.get(1).destination());
      assertInstanceOf(OutlineNode.Leaf.class, outline.get(2));
      assertEquals("6", outline.get(2).destination());
    }
  }

  @Test
  void outline_absent_isEmpty() throws Exception {
    try (PdfDocumentSource source = PdfDocumentSource.of("plain.pdf", PdfFixtures.bodyOnly(2))) {
      assertTrue(source.outline().isEmpty());
      assertEquals(2, source.totalUnits());
      assertEquals(new PagePosition(1), source.documentStart());
    }
  }

  @Test
  void resolveDestination_acceptsPagesInRangeOnly() throws Exception {
    try (PdfDocumentSource source = PdfDocumentSource.of("plain.pdf", PdfFixtures.bodyOnly(3))) {
      assertEquals(Optional.of(new PagePosition(3)), source.resolveDestination("3"));
      assertTrue(source.resolveDestination("4").isEmpty());
      assertTrue(source.resolveDestination("0").isEmpty());
      assertTrue(source.resolveDestination("intro").isEmpty());
      assertEquals("Page 3", source.untitled(new PagePosition(3)));
    }
  }

  @Test
  void pageTexts_reportLinesWithTheirFontSize() throws Exception {
    PDDocument doc = new PDDocument();
    PdfFixtures.addPage(doc, "Getting Started", 24, PdfFixtures.BODY);
    PdfFixtures.addPage(doc, null, 0, PdfFixtures.BODY);

    try (PdfDocumentSource source = PdfDocumentSource.of("book.pdf", doc)) {
      List<PageText> pages = source.pageTexts();

      assertEquals(2, pages.size());
      assertEquals(1, pages.get(0).pageNumber());
      assertEquals("Getting Started", pages.get(0).runs().get(0).text());
      assertEquals(24f, pages.get(0).runs().get(0).fontSize(), 0.5f);
      assertEquals(12f, pages.get(1).runs().get(0).fontSize(), 0.5f);
      assertTrue(pages.get(0).averageFontSize() > 12);
    }
  }

  @Test
  void detect_usesBookmarksThenFontSizes() throws Exception {
    PDDocument withOutline = PdfFixtures.bodyOnly(30);
    PDDocumentOutline root = PdfFixtures.outline(withOutline);
    PdfFixtures.bookmark(withOutline, root, "One", 0);
    PdfFixtures.bookmark(withOutline, root, "Two", 9);
    PdfFixtures.bookmark(withOutline, root, "Three", 24);

    PDDocument withHeadings = new PDDocument();
    PdfFixtures.addPage(withHeadings, "Chapter 1: Introduction", 18, PdfFixtures.BODY);
    PdfFixtures.addPage(withHeadings, null, 0, PdfFixtures.BODY);
    PdfFixtures.addPage(withHeadings, "Chapter 2: Usage", 18, PdfFixtures.BODY);

    ChapterDetector detector = new ChapterDetector();
    try (PdfDocumentSource a = PdfDocumentSource.of("a.pdf", withOutline);
        PdfDocumentSource b = PdfDocumentSource.of("b.pdf", withHeadings)) {
      DetectionResult native1 = detector.detect(a, DetectionStrategy.HYBRID, Sensitivity.MEDIUM, 1);
      DetectionResult structural = detector.detect(b, DetectionStrategy.HYBRID, Sensitivity.MEDIUM, 1);

      assertEquals("native", native1.strategyUsed());
      assertEquals(List.of("1-9", "10-24", "25-30"),
          native1.chapters().stream().map(Chapter::location).toList());
      assertEquals("structural (fallback)", structural.strategyUsed());
      assertEquals(List.of("1-2", "3-3"), structural.chapters().stream().map(Chapter::location).toList());
    }
  }

  @Test
  void open_rejectsUnreadableAndEmptyDocuments() throws Exception {
    Path garbage = Files.createTempFile("not-a-pdf-", ".pdf");
    Files.writeString(garbage, "this is not a pdf", StandardCharsets.UTF_8);

    assertThrows(MalformedSourceException.class, () -> PdfDocumentSource.open(garbage));
    assertThrows(MalformedSourceException.class,
        () -> PdfDocumentSource.open(garbage.resolveSibling("missing-" + garbage.getFileName())));
    try (PDDocument empty = new PDDocument()) {
      assertThrows(MalformedSourceException.class, () -> PdfDocumentSource.of("empty.pdf", empty));
    }
  }
}
