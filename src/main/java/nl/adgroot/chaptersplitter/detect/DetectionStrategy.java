package nl.adgroot.chaptersplitter.detect;

import java.util.Locale;

public enum DetectionStrategy {
  NATIVE,
  STRUCTURAL,
  MANIFEST,
  HYBRID;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Case-insensitive; also accepts {@code bookmarks} for {@link #NATIVE} and {@code heuristic}
   * for {@link #STRUCTURAL}. A missing value means {@link #HYBRID}.
   */
  public static DetectionStrategy parse(String value) {
    if (value == null || value.isBlank()) {
      return HYBRID;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "bookmarks":
        return NATIVE;
      case "heuristic":
        return STRUCTURAL;
      default:
        break;
    }
    for (DetectionStrategy strategy : values()) {
      if (strategy.label().equals(normalized)) {
        return strategy;
      }
    }
    throw new IllegalArgumentException("Unknown detection strategy: " + value);
  }
}
