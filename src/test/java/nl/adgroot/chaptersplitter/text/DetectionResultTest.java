package nl.adgroot.chaptersplitter.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.List;
import org.junit.jupiter.api.Test;

class DetectionResultTest {

  @Test
  void summary_listsStrategyUnitsAndChapters() {
    DetectionResult result = new DetectionResult(List.of(
        chapter("A", 1, 4, 1.0), chapter("B", 5, 9, 0.4)), "structural (fallback)", 9, false);

    String summary = result.summary();

    assertEquals(String.join("\n",
        "Detection Strategy: structural (fallback)",
        "Total Units: 9",
        "Chapters Found: 2",
        "Has Native Structure: No"), summary);
  }

  @Test
  void lowConfidenceChapters_areStrictlyBelowThreshold() {
    DetectionResult result = new DetectionResult(List.of(
        chapter("A", 1, 4, 0.5), chapter("B", 5, 9, 0.49)), "structural", 9, false);

    assertEquals(List.of("B"),
        result.lowConfidenceChapters(0.5).stream().map(Chapter::title).toList());
    assertFalse(result.isFallback());
  }

  private static Chapter chapter(String title, int start, int end, double confidence) {
    return new Chapter(title, new PagePosition(start), start, end, 1, DetectionMethod.STRUCTURAL, confidence);
  }
}
