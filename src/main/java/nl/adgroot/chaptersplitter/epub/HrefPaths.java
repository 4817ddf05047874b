package nl.adgroot.chaptersplitter.epub;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/** Archive-internal href arithmetic. All paths use {@code /} and never start with one. */
final class HrefPaths {

  private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");

  private HrefPaths() {
    // utility class
  }

  /** {@code "text/ch1.xhtml"} gives {@code "text/"}, a bare file name gives {@code ""}. */
  static String directoryOf(String path) {
    int slash = path.lastIndexOf('/');
    return slash < 0 ? "" : path.substring(0, slash + 1);
  }

  /** Joins a relative reference to a directory and folds {@code .} and {@code ..} segments. */
  static String resolve(String directory, String reference) {
    if (reference.startsWith("/")) {
      return normalize(reference.substring(1));
    }
    return normalize(directory + reference);
  }

  static String normalize(String path) {
    Deque<String> segments = new ArrayDeque<>();
    for (String segment : path.split("/")) {
      if (segment.isEmpty() || segment.equals(".")) {
        continue;
      }
      if (segment.equals("..")) {
        if (!segments.isEmpty() && !segments.peekLast().equals("..")) {
          segments.removeLast();
        } else {
          segments.addLast(segment);
        }
        continue;
      }
      segments.addLast(segment);
    }
    return String.join("/", segments);
  }

  /** Drops {@code #fragment} and {@code ?query}. */
  static String stripFragmentAndQuery(String reference) {
    int cut = reference.length();
    int hash = reference.indexOf('#');
    if (hash >= 0) {
      cut = hash;
    }
    int query = reference.indexOf('?');
    if (query >= 0 && query < cut) {
      cut = query;
    }
    return reference.substring(0, cut);
  }

  static boolean isExternal(String reference) {
    return SCHEME.matcher(reference).find() || reference.startsWith("//");
  }
}
