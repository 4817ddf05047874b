package nl.adgroot.chaptersplitter.epub;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One child element of the package metadata, e.g. {@code dc:title} or {@code meta}.
 */
public record MetadataEntry(String name, Map<String, String> attributes, String value) {

  public static final String TITLE = "dc:title";
  public static final String IDENTIFIER = "dc:identifier";
  public static final String LANGUAGE = "dc:language";
  public static final String CREATOR = "dc:creator";

  public MetadataEntry {
    attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    value = value == null ? "" : value;
  }

  public static MetadataEntry of(String name, String value) {
    return new MetadataEntry(name, Map.of(), value);
  }

  /** Matches {@code dc:title} as well as an unprefixed {@code title}. */
  public boolean is(String qualifiedName) {
    if (name.equalsIgnoreCase(qualifiedName)) {
      return true;
    }
    int colon = qualifiedName.indexOf(':');
    return colon >= 0 && name.equalsIgnoreCase(qualifiedName.substring(colon + 1));
  }
}
