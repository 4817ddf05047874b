package nl.adgroot.chaptersplitter.text;

import java.util.List;

/** Text runs of one page, in reading order. */
public record PageText(int pageNumber, List<TextRun> runs) {

  public PageText {
    runs = List.copyOf(runs);
  }

  public double averageFontSize() {
    return runs.stream()
        .mapToDouble(TextRun::fontSize)
        .filter(size -> size > 0)
        .average()
        .orElse(0.0);
  }
}
