package nl.adgroot.chaptersplitter.pdf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import nl.adgroot.chaptersplitter.epub.EpubBook;
import nl.adgroot.chaptersplitter.epub.EpubFixtures;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.DetectionMethod;
import nl.adgroot.chaptersplitter.text.UnitPosition;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

class PdfTextReflowMaterializerTest {

  @Test
  void wrap_breaksOnWordsWithinWidth() {
    List<String> lines = PdfTextReflowMaterializer.wrap("one two three four five", 9);

    assertEquals(List.of("one two", "three", "four five"), lines);
  }

  @Test
  void wrap_keepsBlankLinesAndSplitsLongWords() {
    List<String> lines = PdfTextReflowMaterializer.wrap("abcdefghij\r\n\nend", 4);

    assertEquals(List.of("abcd", "efgh", "ij", "", "end"), lines);
  }

  @Test
  void writeLines_alwaysProducesAPage_andAddsPagesAsNeeded() throws Exception {
    PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    List<String> many = new ArrayList<>();
    for (int i = 0; i < 120; i++) {
      many.add("line " + i);
    }

    try (PDDocument empty = new PDDocument(); PDDocument full = new PDDocument()) {
      PdfTextReflowMaterializer.writeLines(empty, List.of(), font);
      PdfTextReflowMaterializer.writeLines(full, many, font);

      assertEquals(1, empty.getNumberOfPages());
      assertEquals(3, full.getNumberOfPages());
    }
  }

  @Test
  void printable_replacesCharactersTheFontCannotShow() {
    PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

    String line = PdfTextReflowMaterializer.printable("naïve\tcafé → 中", font, new HashMap<>());

    assertEquals("naïve café ? ?", line);
    assertTrue(line.chars().noneMatch(Character::isISOControl));
  }

  @Test
  void materialize_rendersChapterTextWithBookAuthor() throws Exception {
    // GIVEN chapter two and three of the sample book
    EpubBook book = EpubFixtures.readSampleBook();
    Chapter chapter = new Chapter("Two and three", new UnitPosition("text/ch2.xhtml", null, 2), 2, 3, 1,
        DetectionMethod.MANIFEST, 0.6);
    Path out = Files.createTempFile("reflow-", ".pdf");

    // WHEN
    new PdfTextReflowMaterializer(book, true).materialize(chapter, out);

    // THEN
    try (PDDocument pdf = Loader.loadPDF(out.toFile())) {
      String text = new PDFTextStripper().getText(pdf);
      assertTrue(text.contains("Second half."));
      assertTrue(text.contains("The end."));
      assertEquals("Two and three", pdf.getDocumentInformation().getTitle());
      assertEquals("Ann Author", pdf.getDocumentInformation().getAuthor());
    }
  }

  @Test
  void materialize_withoutMetadata_leavesInfoEmpty() throws Exception {
    EpubBook book = EpubFixtures.readSampleBook();
    Chapter chapter = new Chapter("Three", new UnitPosition("text/ch3.xhtml", null, 3), 3, 3, 1,
        DetectionMethod.NATIVE, 1.0);
    Path out = Files.createTempFile("reflow-plain-", ".pdf");

    new PdfTextReflowMaterializer(book, false).materialize(chapter, out);

    try (PDDocument pdf = Loader.loadPDF(out.toFile())) {
      assertEquals(1, pdf.getNumberOfPages());
      assertNull(pdf.getDocumentInformation().getAuthor());
    }
  }
}
