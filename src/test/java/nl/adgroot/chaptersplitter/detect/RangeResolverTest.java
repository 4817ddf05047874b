package nl.adgroot.chaptersplitter.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.ChapterCandidate;
import nl.adgroot.chaptersplitter.text.DetectionMethod;
import nl.adgroot.chaptersplitter.text.PagePosition;
import nl.adgroot.chaptersplitter.text.UnitPosition;
import org.junit.jupiter.api.Test;

class RangeResolverTest {

  private final RangeResolver resolver = new RangeResolver();

  @Test
  void resolve_pagesRunUntilNextChapter() {
    // GIVEN starts on pages 1, 10 and 25 of a 30 page document
    List<ChapterCandidate> candidates = List.of(page("A", 1), page("B", 10), page("C", 25));

    // WHEN
    List<Chapter> chapters = resolver.resolve(candidates, 30);

    // THEN
    assertEquals(3, chapters.size());
    assertRange(chapters.get(0), 1, 9);
    assertRange(chapters.get(1), 10, 24);
    assertRange(chapters.get(2), 25, 30);
    int total = chapters.stream().mapToInt(Chapter::pageCount).sum();
    assertEquals(30, total);
  }

  @Test
  void resolve_samePageTwice_keepsTheLaterEntry() {
    List<Chapter> chapters = resolver.resolve(List.of(page("A", 5), page("B", 5), page("C", 8)), 10);

    assertEquals(List.of("B", "C"), chapters.stream().map(Chapter::title).toList());
    assertRange(chapters.get(0), 5, 7);
  }

  @Test
  void resolve_dropsBackwardAndOutOfRangeStarts() {
    List<Chapter> chapters = resolver.resolve(
        List.of(page("A", 5), page("B", 10), page("C", 8), page("D", 50)), 20);

    assertEquals(List.of("A", "B"), chapters.stream().map(Chapter::title).toList());
    assertRange(chapters.get(0), 5, 9);
    assertRange(chapters.get(1), 10, 20);
  }

  @Test
  void resolve_resultIsOrderedAndNonOverlapping() {
    List<Chapter> chapters = resolver.resolve(
        List.of(page("A", 3), page("B", 2), page("C", 7), page("D", 7), page("E", 12)), 12);

    for (int i = 1; i < chapters.size(); i++) {
      assertTrue(chapters.get(i - 1).end() < chapters.get(i).start());
    }
    for (Chapter c : chapters) {
      assertTrue(1 <= c.start() && c.start() <= c.end() && c.end() <= 12);
    }
  }

  @Test
  void resolve_unitsCoverTheirOwnUnit_andDropDuplicates() {
    List<ChapterCandidate> candidates = List.of(
        unit("One", "a.xhtml", null, 1),
        unit("Two", "b.xhtml", "s1", 2),
        unit("Two again", "b.xhtml", "s1", 2),
        unit("Two later", "b.xhtml", "s2", 2),
        unit("Back", "a.xhtml", "x", 1),
        unit("Three", "c.xhtml", null, 3));

    List<Chapter> chapters = resolver.resolve(candidates, 3);

    assertEquals(List.of("One", "Two", "Two later", "Three"), chapters.stream().map(Chapter::title).toList());
    assertRange(chapters.get(0), 1, 1);
    assertRange(chapters.get(3), 3, 3);
  }

  @Test
  void resolve_emptyInput_givesEmptyOutput() {
    assertTrue(resolver.resolve(List.of(), 10).isEmpty());
  }

  private static ChapterCandidate page(String title, int page) {
    return new ChapterCandidate(title, new PagePosition(page), 1, DetectionMethod.NATIVE, 1.0);
  }

  private static ChapterCandidate unit(String title, String path, String fragment, int index) {
    return new ChapterCandidate(title, new UnitPosition(path, fragment, index), 1, DetectionMethod.NATIVE, 1.0);
  }

  private static void assertRange(Chapter chapter, int start, int end) {
    assertEquals(start, chapter.start(), "start of " + chapter.title());
    assertEquals(end, chapter.end(), "end of " + chapter.title());
  }
}
