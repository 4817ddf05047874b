package nl.adgroot.chaptersplitter.epub;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.ZipFile;
import nl.adgroot.chaptersplitter.detect.OutlineNode;
import org.junit.jupiter.api.Test;

class EpubWriterTest {

  @Test
  void write_generatedNavigationNeverOverwritesBookItems() throws Exception {
    // GIVEN a book whose own content document is called nav.xhtml
    EpubItem own = new EpubItem("nav", "nav.xhtml", EpubItem.XHTML,
        "<html><head><title>Mine</title></head><body><p>my own nav file</p></body></html>"
            .getBytes(StandardCharsets.UTF_8));
    EpubBook book = new EpubBook(List.of(MetadataEntry.of(MetadataEntry.TITLE, "Clash")), List.of(own),
        List.of("nav.xhtml"), List.of(new OutlineNode.Leaf("Mine", "nav.xhtml")));
    Path out = Files.createTempDirectory("epub-writer-").resolve("clash.epub");

    // WHEN
    new EpubWriter().write(book, out);

    // THEN
    try (ZipFile zip = new ZipFile(out.toFile())) {
      assertTrue(zip.getEntry("OEBPS/nav-2.xhtml") != null);
      String mine = new String(zip.getInputStream(zip.getEntry("OEBPS/nav.xhtml")).readAllBytes(),
          StandardCharsets.UTF_8);
      assertTrue(mine.contains("my own nav file"));
    }
    EpubBook read = new EpubReader().read(out);
    assertEquals(List.of("nav.xhtml"), read.contentUnits());
    assertEquals("Mine", read.getToc().get(0).title());
  }

  @Test
  void write_fillsRequiredMetadata() throws Exception {
    EpubItem page = new EpubItem("p", "p.xhtml", EpubItem.XHTML,
        "<html><body><p>x</p></body></html>".getBytes(StandardCharsets.UTF_8));
    EpubBook book = new EpubBook(List.of(), List.of(page), List.of("p.xhtml"), List.of());
    Path out = Files.createTempDirectory("epub-writer-").resolve("bare.epub");

    new EpubWriter().write(book, out);

    EpubBook read = new EpubReader().read(out);
    assertEquals("Untitled", read.getTitle().orElseThrow());
    assertEquals("en", read.getLanguage().orElseThrow());
    assertTrue(read.firstMetadataValue(MetadataEntry.IDENTIFIER).orElseThrow().startsWith("urn:uuid:"));
    assertTrue(read.getMetadata().stream()
        .anyMatch(m -> "dcterms:modified".equals(m.attributes().get("property"))));
  }
}
