package nl.adgroot.chaptersplitter.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class DocumentFormatTest {

  @Test
  void parse_acceptsNamesWithOrWithoutDot() {
    assertEquals(DocumentFormat.PDF, DocumentFormat.parse(" .PDF "));
    assertEquals(DocumentFormat.EPUB, DocumentFormat.parse("epub"));
    assertThrows(IllegalArgumentException.class, () -> DocumentFormat.parse("mobi"));
  }

  @Test
  void fromPath_matchesExtensionIgnoringCase() {
    assertEquals(DocumentFormat.EPUB, DocumentFormat.fromPath(Path.of("books", "Novel.EPUB")).orElseThrow());
    assertEquals(DocumentFormat.PDF, DocumentFormat.fromPath(Path.of("a.pdf")).orElseThrow());
    assertFalse(DocumentFormat.fromPath(Path.of("notes.txt")).isPresent());
  }
}
