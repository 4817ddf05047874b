package nl.adgroot.chaptersplitter.text;

/**
 * A chapter start found by one of the detectors. Ranges are assigned later by the range resolver.
 */
public record ChapterCandidate(
    String title,
    Position position,
    int level,
    DetectionMethod method,
    double confidence
) {

  public ChapterCandidate {
    title = title == null ? "" : title.strip();
    if (level < 1) {
      throw new IllegalArgumentException("level must be >= 1: " + level);
    }
    confidence = Math.min(1.0, Math.max(0.0, confidence));
  }
}
