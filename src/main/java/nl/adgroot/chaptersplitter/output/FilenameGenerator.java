package nl.adgroot.chaptersplitter.output;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.DocumentFormat;
import nl.adgroot.chaptersplitter.text.UnitPosition;

/**
 * Builds output file names from a pattern such as {@code {index:02d}_{title}}.
 *
 * <p>Placeholders: {@code index} (1-based), {@code title} (sanitized), {@code start},
 * {@code end}, {@code pages} and {@code file} (stem of the chapter's content document, or of the
 * source file for paginated documents). Integer placeholders accept a {@code d} format such as
 * {@code :03d}. One generator is used per split run; it suffixes {@code _2}, {@code _3} and so on
 * to names it has already handed out.
 */
public class FilenameGenerator {

  public static final String DEFAULT_PATTERN = "{index:02d}_{title}";
  public static final int DEFAULT_MAX_TITLE_LENGTH = 100;

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)(?::([^}]*))?}");
  private static final Pattern INT_FORMAT = Pattern.compile("0?\\d*d");
  private static final Pattern INVALID_CHARS = Pattern.compile("[<>:\"/\\\\|?*]");
  private static final Pattern SEPARATOR_RUNS = Pattern.compile("(?U)[\\s_]+");

  private final String pattern;
  private final int maxTitleLength;
  private final DocumentFormat format;
  private final String sourceStem;
  private final Set<String> used = new HashSet<>();

  public FilenameGenerator(String pattern, int maxTitleLength, DocumentFormat format, String sourceStem) {
    this.pattern = pattern == null || pattern.isBlank() ? DEFAULT_PATTERN : pattern;
    this.maxTitleLength = maxTitleLength;
    this.format = format;
    this.sourceStem = sourceStem == null ? "" : sourceStem;
  }

  /**
   * @param index 1-based chapter index
   * @throws IllegalArgumentException on an unknown placeholder or format
   */
  public String generate(Chapter chapter, int index) {
    Matcher m = PLACEHOLDER.matcher(pattern);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String value = render(m.group(1), m.group(2), chapter, index);
      m.appendReplacement(sb, Matcher.quoteReplacement(value));
    }
    m.appendTail(sb);
    return unique(withExtension(sb.toString()));
  }

  private String render(String name, String fmt, Chapter chapter, int index) {
    switch (name) {
      case "index":
        return formatInt(name, index, fmt);
      case "start":
        return formatInt(name, chapter.start(), fmt);
      case "end":
        return formatInt(name, chapter.end(), fmt);
      case "pages":
        return formatInt(name, chapter.pageCount(), fmt);
      case "title":
        requireNoFormat(name, fmt);
        return sanitize(chapter.title(), maxTitleLength);
      case "file":
        requireNoFormat(name, fmt);
        return sanitize(fileStem(chapter), maxTitleLength);
      default:
        throw new IllegalArgumentException("Unknown placeholder {" + name + "} in pattern: " + pattern);
    }
  }

  private String fileStem(Chapter chapter) {
    if (chapter.position() instanceof UnitPosition unit) {
      String name = unit.path();
      int slash = name.lastIndexOf('/');
      if (slash >= 0) {
        name = name.substring(slash + 1);
      }
      int dot = name.lastIndexOf('.');
      return dot > 0 ? name.substring(0, dot) : name;
    }
    return sourceStem;
  }

  private String formatInt(String name, int value, String fmt) {
    if (fmt == null || fmt.isEmpty()) {
      return Integer.toString(value);
    }
    if (!INT_FORMAT.matcher(fmt).matches()) {
      throw new IllegalArgumentException("Unsupported format '" + fmt + "' for {" + name + "}");
    }
    return String.format(Locale.ROOT, "%" + fmt, value);
  }

  private void requireNoFormat(String name, String fmt) {
    if (fmt != null && !fmt.isEmpty()) {
      throw new IllegalArgumentException("Placeholder {" + name + "} takes no format: " + fmt);
    }
  }

  // a known document extension is replaced, anything else gets the extension appended
  private String withExtension(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    for (DocumentFormat f : DocumentFormat.values()) {
      if (lower.endsWith(f.extension())) {
        return name.substring(0, name.length() - f.extension().length()) + format.extension();
      }
    }
    return name + format.extension();
  }

  private String unique(String name) {
    if (used.add(name.toLowerCase(Locale.ROOT))) {
      return name;
    }
    String stem = name.substring(0, name.length() - format.extension().length());
    for (int n = 2; ; n++) {
      String candidate = stem + "_" + n + format.extension();
      if (used.add(candidate.toLowerCase(Locale.ROOT))) {
        return candidate;
      }
    }
  }

  /**
   * Makes a title safe as a file name: invalid characters and whitespace runs become single
   * underscores, the result is trimmed of underscores and cut to {@code maxLength} code points.
   * Never returns an empty string.
   */
  public static String sanitize(String title, int maxLength) {
    if (title == null) {
      return "untitled";
    }
    String s = INVALID_CHARS.matcher(title).replaceAll("_");
    s = SEPARATOR_RUNS.matcher(s).replaceAll("_");
    s = stripUnderscores(s, true);
    if (s.codePointCount(0, s.length()) > maxLength) {
      s = s.substring(0, s.offsetByCodePoints(0, Math.max(0, maxLength)));
      s = stripUnderscores(s, false);
    }
    return s.isEmpty() ? "untitled" : s;
  }

  private static String stripUnderscores(String s, boolean leading) {
    int begin = 0;
    int end = s.length();
    if (leading) {
      while (begin < end && s.charAt(begin) == '_') {
        begin++;
      }
    }
    while (end > begin && s.charAt(end - 1) == '_') {
      end--;
    }
    return s.substring(begin, end);
  }
}
