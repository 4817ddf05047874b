package nl.adgroot.chaptersplitter.text;

/** One line of text with the largest font size used on it. */
public record TextRun(String text, float fontSize) {

  public TextRun {
    text = text == null ? "" : text.strip();
  }

  public int wordCount() {
    return text.isEmpty() ? 0 : text.split("\\s+").length;
  }
}
