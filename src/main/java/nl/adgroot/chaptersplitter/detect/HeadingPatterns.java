package nl.adgroot.chaptersplitter.detect;

import java.util.List;
import java.util.regex.Pattern;

/** Ordinal heading shapes such as "Chapter 4", "PART IV: Results" or "3. Methods". */
final class HeadingPatterns {

  private static final List<Pattern> PATTERNS = List.of(
      Pattern.compile("^Chapter\\s+(\\d+|[IVXLCDM]+)[\\s:.-]*(.*?)$", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^Part\\s+(\\d+|[IVXLCDM]+)[\\s:.-]*(.*?)$", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^(\\d+)\\.\\s+(.+)$", Pattern.CASE_INSENSITIVE)
  );

  private HeadingPatterns() {
    // utility class
  }

  static boolean matches(String text) {
    if (text == null || text.isEmpty()) {
      return false;
    }
    for (Pattern pattern : PATTERNS) {
      if (pattern.matcher(text).lookingAt()) {
        return true;
      }
    }
    return false;
  }
}
