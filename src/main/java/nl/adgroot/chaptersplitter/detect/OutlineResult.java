package nl.adgroot.chaptersplitter.detect;

import java.util.List;
import nl.adgroot.chaptersplitter.text.ChapterCandidate;

public record OutlineResult(List<ChapterCandidate> candidates, boolean hasOutline) {

  public OutlineResult {
    candidates = List.copyOf(candidates);
  }

  static OutlineResult none() {
    return new OutlineResult(List.of(), false);
  }
}
