package nl.adgroot.chaptersplitter.detect;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.ChapterCandidate;
import nl.adgroot.chaptersplitter.text.PagePosition;
import nl.adgroot.chaptersplitter.text.Titles;
import nl.adgroot.chaptersplitter.text.UnitPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns inclusive ranges to chapter candidates.
 *
 * <p>Page chapters run until the page before the next chapter start, the last one until the end of
 * the document. Unit chapters cover exactly their own unit.
 */
public class RangeResolver {

  private static final Logger log = LoggerFactory.getLogger(RangeResolver.class);

  public List<Chapter> resolve(List<ChapterCandidate> candidates, int totalUnits) {
    List<ChapterCandidate> pages = new ArrayList<>();
    List<ChapterCandidate> units = new ArrayList<>();
    for (ChapterCandidate c : candidates) {
      if (c.position() instanceof PagePosition) {
        pages.add(c);
      } else {
        units.add(c);
      }
    }
    if (!pages.isEmpty() && !units.isEmpty()) {
      throw new IllegalArgumentException("Cannot mix page and unit positions");
    }
    return pages.isEmpty() ? resolveUnits(units, totalUnits) : resolvePages(pages, totalUnits);
  }

  private List<Chapter> resolvePages(List<ChapterCandidate> candidates, int totalPages) {
    List<ChapterCandidate> kept = new ArrayList<>();
    for (ChapterCandidate c : candidates) {
      int start = c.position().unitIndex();
      if (start > totalPages) {
        log.warn("Dropping '{}': starts on page {} of a {}-page document", c.title(), start, totalPages);
        continue;
      }
      if (!kept.isEmpty()) {
        ChapterCandidate last = kept.get(kept.size() - 1);
        int lastStart = last.position().unitIndex();
        if (start == lastStart) {
          // the later entry on the same page wins, the earlier one would be empty
          log.warn("Dropping '{}': '{}' starts on the same page {}", last.title(), c.title(), start);
          kept.set(kept.size() - 1, c);
          continue;
        }
        if (start < lastStart) {
          log.warn("Dropping '{}': page {} comes before the previous chapter's page {}",
              c.title(), start, lastStart);
          continue;
        }
      }
      kept.add(c);
    }

    List<Chapter> out = new ArrayList<>(kept.size());
    for (int i = 0; i < kept.size(); i++) {
      ChapterCandidate c = kept.get(i);
      int start = c.position().unitIndex();
      int end = i + 1 < kept.size() ? kept.get(i + 1).position().unitIndex() - 1 : totalPages;
      out.add(Chapter.of(withTitle(c), start, end));
    }
    return out;
  }

  private List<Chapter> resolveUnits(List<ChapterCandidate> candidates, int totalUnits) {
    List<Chapter> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    int lastIndex = 0;
    for (ChapterCandidate c : candidates) {
      UnitPosition position = (UnitPosition) c.position();
      int index = position.unitIndex();
      if (index < 1 || index > totalUnits) {
        log.warn("Dropping '{}': unit {} is outside the reading order", c.title(), position);
        continue;
      }
      if (!seen.add(position.location())) {
        log.warn("Dropping '{}': {} is already a chapter start", c.title(), position);
        continue;
      }
      if (index < lastIndex) {
        log.warn("Dropping '{}': {} comes before the previous chapter", c.title(), position);
        continue;
      }
      lastIndex = index;
      out.add(Chapter.of(withTitle(c), index, index));
    }
    return out;
  }

  private static ChapterCandidate withTitle(ChapterCandidate c) {
    if (!c.title().isEmpty()) {
      return c;
    }
    String title = c.position() instanceof UnitPosition unit
        ? Titles.fromFileName(unit.path())
        : "Page " + c.position().unitIndex();
    return new ChapterCandidate(title, c.position(), c.level(), c.method(), c.confidence());
  }
}
