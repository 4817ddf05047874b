package nl.adgroot.chaptersplitter.detect;

import java.util.Locale;

/**
 * Heuristic tuning presets. Higher sensitivity lowers both bars and admits more headings.
 */
public enum Sensitivity {
  LOW(1.5, 0.8, 1),
  MEDIUM(1.3, 0.6, 2),
  HIGH(1.2, 0.4, 3);

  private final double fontSizeRatio;
  private final double minConfidence;
  private final int maxHeadingDepth;

  Sensitivity(double fontSizeRatio, double minConfidence, int maxHeadingDepth) {
    this.fontSizeRatio = fontSizeRatio;
    this.minConfidence = minConfidence;
    this.maxHeadingDepth = maxHeadingDepth;
  }

  /** Multiplier over the page's average font size a run must reach to count as a heading. */
  public double fontSizeRatio() {
    return fontSizeRatio;
  }

  public double minConfidence() {
    return minConfidence;
  }

  /** Deepest {@code h<n>} tag scanned in markup documents. */
  public int maxHeadingDepth() {
    return maxHeadingDepth;
  }

  /** Unknown or missing names resolve to {@link #MEDIUM}. */
  public static Sensitivity parse(String value) {
    if (value == null || value.isBlank()) {
      return MEDIUM;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return MEDIUM;
    }
  }
}
