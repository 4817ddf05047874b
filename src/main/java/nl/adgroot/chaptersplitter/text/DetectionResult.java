package nl.adgroot.chaptersplitter.text;

import java.util.List;

/**
 * Outcome of one detection run.
 *
 * @param chapters           chapters in document order
 * @param strategyUsed       name of the stage that produced the chapters
 * @param totalUnits         total pages (PDF) or content documents (EPUB)
 * @param hasNativeStructure whether the document carries a usable outline
 */
public record DetectionResult(
    List<Chapter> chapters,
    String strategyUsed,
    int totalUnits,
    boolean hasNativeStructure
) {

  public static final String FALLBACK_STRATEGY = "fallback";

  public DetectionResult {
    chapters = List.copyOf(chapters);
  }

  public int chapterCount() {
    return chapters.size();
  }

  public boolean isFallback() {
    return chapters.stream().anyMatch(c -> c.method() == DetectionMethod.FALLBACK);
  }

  public List<Chapter> lowConfidenceChapters(double threshold) {
    return chapters.stream().filter(c -> c.confidence() < threshold).toList();
  }

  public String summary() {
    return String.join("\n",
        "Detection Strategy: " + strategyUsed,
        "Total Units: " + totalUnits,
        "Chapters Found: " + chapterCount(),
        "Has Native Structure: " + (hasNativeStructure ? "Yes" : "No"));
  }
}
