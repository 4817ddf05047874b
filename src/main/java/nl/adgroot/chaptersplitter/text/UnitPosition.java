package nl.adgroot.chaptersplitter.text;

import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * A content document inside an archive, optionally narrowed to an element id.
 *
 * @param path      href of the content document, relative to the package document
 * @param fragment  element id inside the document, {@code null} for the whole document
 * @param unitIndex 1-based position of the document in the reading order
 */
public record UnitPosition(String path, String fragment, int unitIndex) implements Position {

  public UnitPosition {
    Objects.requireNonNull(path, "path");
    if (fragment != null && fragment.isBlank()) {
      fragment = null;
    }
  }

  /** Splits {@code "text/ch1.xhtml#sec2"} on the first {@code #}. */
  public static UnitPosition parse(String href, int unitIndex) {
    int hash = href.indexOf('#');
    if (hash < 0) {
      return new UnitPosition(href, null, unitIndex);
    }
    return new UnitPosition(href.substring(0, hash), href.substring(hash + 1), unitIndex);
  }

  public boolean hasFragment() {
    return fragment != null;
  }

  public String location() {
    return hasFragment() ? path + "#" + fragment : path;
  }

  @NotNull
  @Override
  public String toString() {
    return location();
  }
}
