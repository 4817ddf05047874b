package nl.adgroot.chaptersplitter.text;

public enum DetectionMethod {
  NATIVE,
  STRUCTURAL,
  MANIFEST,
  FALLBACK;

  public String label() {
    return name().toLowerCase();
  }
}
