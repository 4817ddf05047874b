package nl.adgroot.chaptersplitter.epub;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the manifest items (stylesheets, images, fonts) that extracted content documents
 * depend on, so a chapter archive renders on its own.
 *
 * <p>Stylesheets found this way are followed through their own {@code url(...)} and
 * {@code @import} references. The result is in first-seen order without duplicates.
 */
public class ResourceResolver {

  private static final Logger log = LoggerFactory.getLogger(ResourceResolver.class);

  private static final Pattern CSS_URL = Pattern.compile("url\\(\\s*['\"]?([^'\")]+?)['\"]?\\s*\\)");
  private static final Pattern CSS_IMPORT = Pattern.compile("@import\\s+['\"]([^'\"]+)['\"]");

  private final EpubBook book;

  public ResourceResolver(EpubBook book) {
    this.book = book;
  }

  public List<EpubItem> resolve(List<EpubItem> units) {
    Set<String> unitHrefs = new HashSet<>();
    for (EpubItem unit : units) {
      unitHrefs.add(unit.href());
    }
    Map<String, EpubItem> seen = new LinkedHashMap<>();
    Deque<EpubItem> stylesheets = new ArrayDeque<>();

    for (EpubItem unit : units) {
      for (String reference : markupReferences(unit)) {
        lookup(unit.href(), reference).ifPresent(item -> add(item, unitHrefs, seen, stylesheets));
      }
    }
    while (!stylesheets.isEmpty()) {
      EpubItem stylesheet = stylesheets.poll();
      for (String reference : cssReferences(stylesheet.text())) {
        lookup(stylesheet.href(), reference).ifPresent(item -> add(item, unitHrefs, seen, stylesheets));
      }
    }
    return new ArrayList<>(seen.values());
  }

  private static void add(EpubItem item, Set<String> unitHrefs, Map<String, EpubItem> seen,
      Deque<EpubItem> stylesheets) {
    if (unitHrefs.contains(item.href())) {
      return;
    }
    if (seen.putIfAbsent(item.href(), item) == null && item.isStylesheet()) {
      stylesheets.add(item);
    }
  }

  /**
   * Finds the item a reference points to: first as an href relative to the package document,
   * then relative to the referencing file.
   */
  Optional<EpubItem> lookup(String baseHref, String reference) {
    String href = HrefPaths.stripFragmentAndQuery(reference.strip());
    if (href.isEmpty() || HrefPaths.isExternal(href)) {
      return Optional.empty();
    }
    Optional<EpubItem> direct = book.itemByHref(href);
    if (direct.isPresent()) {
      return direct;
    }
    String resolved = HrefPaths.resolve(HrefPaths.directoryOf(baseHref), href);
    Optional<EpubItem> relative = book.itemByHref(resolved);
    if (relative.isEmpty()) {
      log.debug("Unresolved reference '{}' in {}", reference, baseHref);
    }
    return relative;
  }

  static List<String> markupReferences(EpubItem unit) {
    Document doc;
    try {
      doc = Jsoup.parse(unit.text());
    } catch (RuntimeException e) {
      log.warn("Cannot scan {} for resources: {}", unit.href(), e.getMessage());
      return List.of();
    }
    List<String> out = new ArrayList<>();
    for (Element link : doc.select("link[href]")) {
      if (isStylesheetLink(link)) {
        out.add(link.attr("href"));
      }
    }
    for (Element img : doc.select("img")) {
      // the HTML parser turns a stray <image> outside <svg> into <img href>
      String src = img.hasAttr("src") ? img.attr("src") : img.attr("href");
      if (!src.isEmpty()) {
        out.add(src);
      }
    }
    for (Element image : doc.select("image")) {
      String href = image.hasAttr("xlink:href") ? image.attr("xlink:href") : image.attr("href");
      if (!href.isEmpty()) {
        out.add(href);
      }
    }
    for (Element style : doc.select("style")) {
      out.addAll(cssReferences(style.data()));
    }
    for (Element styled : doc.select("[style]")) {
      out.addAll(cssReferences(styled.attr("style")));
    }
    return out;
  }

  static List<String> cssReferences(String css) {
    List<String> out = new ArrayList<>();
    Matcher url = CSS_URL.matcher(css);
    while (url.find()) {
      out.add(url.group(1));
    }
    Matcher imports = CSS_IMPORT.matcher(css);
    while (imports.find()) {
      out.add(imports.group(1));
    }
    return out;
  }

  private static boolean isStylesheetLink(Element link) {
    for (String rel : link.attr("rel").split("\\s+")) {
      if (rel.equalsIgnoreCase("stylesheet")) {
        return true;
      }
    }
    return false;
  }
}
