package nl.adgroot.chaptersplitter.text;

import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * A detected chapter with its resolved range.
 *
 * <p>{@code start} and {@code end} are inclusive and live in the same space as
 * {@link Position#unitIndex()}: pages for PDF, spine ordinals for EPUB.
 */
public record Chapter(
    String title,
    Position position,
    int start,
    int end,
    int level,
    DetectionMethod method,
    double confidence
) {

  public Chapter {
    Objects.requireNonNull(position, "position");
    Objects.requireNonNull(method, "method");
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("Chapter title must not be blank");
    }
    title = title.strip();
    if (start < 1 || start > end) {
      throw new IllegalArgumentException("Invalid chapter range " + start + "-" + end);
    }
    if (level < 1) {
      throw new IllegalArgumentException("level must be >= 1: " + level);
    }
    if (confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence out of range: " + confidence);
    }
  }

  public static Chapter of(ChapterCandidate candidate, int start, int end) {
    return new Chapter(candidate.title(), candidate.position(), start, end,
        candidate.level(), candidate.method(), candidate.confidence());
  }

  public int pageCount() {
    return end - start + 1;
  }

  /** Fragment-aware location for archive chapters, the page range otherwise. */
  public String location() {
    if (position instanceof UnitPosition unit) {
      return unit.location();
    }
    return start + "-" + end;
  }

  @NotNull
  @Override
  public String toString() {
    return title + ": " + location();
  }
}
