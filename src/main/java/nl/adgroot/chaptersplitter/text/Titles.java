package nl.adgroot.chaptersplitter.text;

import java.util.Locale;

public final class Titles {

  private Titles() {
    // utility class
  }

  /**
   * Derives a readable title from a file name: {@code "text/chapter_one-a.xhtml"} becomes
   * {@code "Chapter One A"}.
   */
  public static String fromFileName(String path) {
    if (path == null || path.isBlank()) {
      return "Untitled";
    }
    String name = path;
    int slash = name.lastIndexOf('/');
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    int dot = name.lastIndexOf('.');
    if (dot > 0) {
      name = name.substring(0, dot);
    }
    String spaced = name.replace('_', ' ').replace('-', ' ').trim();
    if (spaced.isEmpty()) {
      return "Untitled";
    }

    StringBuilder sb = new StringBuilder(spaced.length());
    boolean startOfWord = true;
    for (int i = 0; i < spaced.length(); i++) {
      char c = spaced.charAt(i);
      if (Character.isLetter(c)) {
        sb.append(startOfWord
            ? String.valueOf(c).toUpperCase(Locale.ROOT)
            : String.valueOf(c).toLowerCase(Locale.ROOT));
        startOfWord = false;
      } else {
        sb.append(c);
        startOfWord = true;
      }
    }
    return sb.toString().replaceAll("\\s+", " ");
  }
}
