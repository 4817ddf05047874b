package nl.adgroot.chaptersplitter.epub;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HrefPathsTest {

  @Test
  void resolve_foldsDotSegments() {
    assertEquals("images/a.png", HrefPaths.resolve("text/", "../images/a.png"));
    assertEquals("text/b.xhtml", HrefPaths.resolve("text/", "./b.xhtml"));
    assertEquals("top.css", HrefPaths.resolve("text/deep/", "/top.css"));
    assertEquals("../outside.css", HrefPaths.resolve("", "../outside.css"));
  }

  @Test
  void directoryOf_keepsTrailingSlash() {
    assertEquals("OEBPS/text/", HrefPaths.directoryOf("OEBPS/text/ch1.xhtml"));
    assertEquals("", HrefPaths.directoryOf("content.opf"));
  }

  @Test
  void stripFragmentAndQuery_cutsAtFirstMarker() {
    assertEquals("a.png", HrefPaths.stripFragmentAndQuery("a.png?x=1#y"));
    assertEquals("a.xhtml", HrefPaths.stripFragmentAndQuery("a.xhtml#frag?not-a-query"));
  }

  @Test
  void isExternal_detectsSchemesAndProtocolRelativeLinks() {
    assertTrue(HrefPaths.isExternal("https://example.org"));
    assertTrue(HrefPaths.isExternal("mailto:someone@example.org"));
    assertTrue(HrefPaths.isExternal("//cdn.example.org/x.css"));
    assertFalse(HrefPaths.isExternal("text/ch1.xhtml"));
  }
}
