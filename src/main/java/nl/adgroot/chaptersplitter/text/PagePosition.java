package nl.adgroot.chaptersplitter.text;

import org.jetbrains.annotations.NotNull;

public record PagePosition(int page) implements Position {

  public PagePosition {
    if (page < 1) {
      throw new IllegalArgumentException("Page numbers are 1-based: " + page);
    }
  }

  @Override
  public int unitIndex() {
    return page;
  }

  @NotNull
  @Override
  public String toString() {
    return "page " + page;
  }
}
