package nl.adgroot.chaptersplitter.epub;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import nl.adgroot.chaptersplitter.detect.MalformedSourceException;
import nl.adgroot.chaptersplitter.detect.OutlineNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an EPUB 2 or 3 archive into an {@link EpubBook}.
 *
 * <p>The table of contents comes from the EPUB 3 navigation document when it has entries, from the
 * NCX otherwise.
 */
public class EpubReader {

  private static final Logger log = LoggerFactory.getLogger(EpubReader.class);

  static final String CONTAINER_PATH = "META-INF/container.xml";
  static final String NCX_MEDIA_TYPE = "application/x-dtbncx+xml";

  public EpubBook read(Path path) {
    Map<String, byte[]> entries = readEntries(path);

    byte[] container = entries.get(CONTAINER_PATH);
    if (container == null) {
      throw new MalformedSourceException("Not an EPUB, " + CONTAINER_PATH + " is missing: " + path);
    }
    Element rootfile = firstByLocalName(parseXml(container), "rootfile");
    if (rootfile == null || rootfile.attr("full-path").isBlank()) {
      throw new MalformedSourceException("No package document declared in " + CONTAINER_PATH + ": " + path);
    }
    String opfPath = HrefPaths.normalize(rootfile.attr("full-path"));
    byte[] opfBytes = entries.get(opfPath);
    if (opfBytes == null) {
      throw new MalformedSourceException("Package document " + opfPath + " is missing: " + path);
    }

    Document opf = parseXml(opfBytes);
    String opfDir = HrefPaths.directoryOf(opfPath);

    List<MetadataEntry> metadata = readMetadata(opf);
    Map<String, EpubItem> itemsById = readManifest(opf, entries, opfDir);
    Element spineElement = firstByLocalName(opf, "spine");
    List<String> spine = readSpine(spineElement, itemsById);

    List<OutlineNode> toc = readNav(itemsById);
    if (toc.isEmpty()) {
      toc = readNcx(spineElement, itemsById);
    }

    log.debug("Read {}: {} manifest items, {} spine entries, {} toc roots",
        path.getFileName(), itemsById.size(), spine.size(), toc.size());
    return new EpubBook(metadata, new ArrayList<>(itemsById.values()), spine, toc);
  }

  private static Map<String, byte[]> readEntries(Path path) {
    Map<String, byte[]> entries = new HashMap<>();
    try (ZipFile zip = new ZipFile(path.toFile())) {
      Enumeration<? extends ZipEntry> all = zip.entries();
      while (all.hasMoreElements()) {
        ZipEntry entry = all.nextElement();
        if (entry.isDirectory()) {
          continue;
        }
        try (InputStream in = zip.getInputStream(entry)) {
          entries.put(HrefPaths.normalize(entry.getName()), in.readAllBytes());
        }
      }
    } catch (IOException e) {
      throw new MalformedSourceException("Cannot read EPUB archive " + path + ": " + e.getMessage(), e);
    }
    return entries;
  }

  private static List<MetadataEntry> readMetadata(Document opf) {
    Element metadata = firstByLocalName(opf, "metadata");
    if (metadata == null) {
      return List.of();
    }
    List<MetadataEntry> out = new ArrayList<>();
    for (Element child : metadata.children()) {
      Map<String, String> attributes = new LinkedHashMap<>();
      for (Attribute attribute : child.attributes()) {
        attributes.put(attribute.getKey(), attribute.getValue());
      }
      out.add(new MetadataEntry(child.tagName(), attributes, child.text()));
    }
    return out;
  }

  private static Map<String, EpubItem> readManifest(Document opf, Map<String, byte[]> entries, String opfDir) {
    Map<String, EpubItem> items = new LinkedHashMap<>();
    Element manifest = firstByLocalName(opf, "manifest");
    if (manifest == null) {
      return items;
    }
    int generated = 0;
    for (Element element : byLocalName(manifest, "item")) {
      String href = element.attr("href");
      if (href.isBlank() || HrefPaths.isExternal(href)) {
        continue;
      }
      String id = element.attr("id");
      if (id.isBlank()) {
        id = "item-" + (++generated);
      }
      String normalized = HrefPaths.normalize(href);
      byte[] content = lookup(entries, opfDir, normalized);
      if (content == null) {
        log.warn("Manifest item {} points to missing file {}", id, href);
        continue;
      }
      items.putIfAbsent(id, new EpubItem(id, normalized, element.attr("media-type"), content,
          element.attr("properties")));
    }
    return items;
  }

  private static byte[] lookup(Map<String, byte[]> entries, String opfDir, String href) {
    byte[] content = entries.get(HrefPaths.resolve(opfDir, href));
    if (content == null && href.indexOf('%') >= 0) {
      String decoded = URLDecoder.decode(href.replace("+", "%2B"), StandardCharsets.UTF_8);
      content = entries.get(HrefPaths.resolve(opfDir, decoded));
    }
    return content;
  }

  private static List<String> readSpine(Element spine, Map<String, EpubItem> itemsById) {
    if (spine == null) {
      return List.of();
    }
    List<String> hrefs = new ArrayList<>();
    for (Element itemref : byLocalName(spine, "itemref")) {
      EpubItem item = itemsById.get(itemref.attr("idref"));
      if (item == null) {
        log.warn("Spine references unknown manifest id '{}'", itemref.attr("idref"));
        continue;
      }
      hrefs.add(item.href());
    }
    return hrefs;
  }

  private static List<OutlineNode> readNav(Map<String, EpubItem> itemsById) {
    EpubItem navItem = itemsById.values().stream()
        .filter(item -> item.hasProperty("nav"))
        .findFirst()
        .orElse(null);
    if (navItem == null) {
      return List.of();
    }
    Document doc = Jsoup.parse(navItem.text());
    Element tocNav = null;
    for (Element nav : doc.select("nav")) {
      if ("toc".equals(nav.attr("epub:type"))) {
        tocNav = nav;
        break;
      }
      if (tocNav == null) {
        tocNav = nav;
      }
    }
    Element list = tocNav == null ? null : firstChild(tocNav, "ol");
    if (list == null) {
      return List.of();
    }
    return navList(list, HrefPaths.directoryOf(navItem.href()));
  }

  private static List<OutlineNode> navList(Element ol, String baseDir) {
    List<OutlineNode> out = new ArrayList<>();
    for (Element li : ol.children()) {
      if (!li.tagName().equals("li")) {
        continue;
      }
      Element label = firstChild(li, "a");
      if (label == null) {
        label = firstChild(li, "span");
      }
      String title = label == null ? "" : label.text();
      String destination = label == null ? null : destination(baseDir, label.attr("href"));
      Element nested = firstChild(li, "ol");
      List<OutlineNode> children = nested == null ? List.of() : navList(nested, baseDir);
      out.add(OutlineNode.of(title, destination, children));
    }
    return out;
  }

  private static List<OutlineNode> readNcx(Element spine, Map<String, EpubItem> itemsById) {
    EpubItem ncx = spine == null ? null : itemsById.get(spine.attr("toc"));
    if (ncx == null) {
      ncx = itemsById.values().stream()
          .filter(item -> NCX_MEDIA_TYPE.equals(item.mediaType()))
          .findFirst()
          .orElse(null);
    }
    if (ncx == null) {
      return List.of();
    }
    Element navMap = firstByLocalName(parseXml(ncx.content()), "navMap");
    if (navMap == null) {
      return List.of();
    }
    return navPoints(navMap, HrefPaths.directoryOf(ncx.href()));
  }

  private static List<OutlineNode> navPoints(Element parent, String baseDir) {
    List<OutlineNode> out = new ArrayList<>();
    for (Element point : parent.children()) {
      if (!localName(point).equalsIgnoreCase("navPoint")) {
        continue;
      }
      Element label = firstByLocalName(point, "text");
      Element content = null;
      for (Element child : point.children()) {
        if (localName(child).equalsIgnoreCase("content")) {
          content = child;
          break;
        }
      }
      String title = label == null ? "" : label.text();
      String destination = content == null ? null : destination(baseDir, content.attr("src"));
      out.add(OutlineNode.of(title, destination, navPoints(point, baseDir)));
    }
    return out;
  }

  /** Rebases a navigation href onto the package document directory, keeping the fragment. */
  static String destination(String baseDir, String href) {
    if (href == null || href.isBlank() || HrefPaths.isExternal(href)) {
      return null;
    }
    String path = href;
    String fragment = "";
    int hash = href.indexOf('#');
    if (hash >= 0) {
      path = href.substring(0, hash);
      fragment = href.substring(hash);
    }
    if (path.isEmpty()) {
      return null;
    }
    return HrefPaths.resolve(baseDir, path) + fragment;
  }

  static Document parseXml(byte[] bytes) {
    String xml = new String(bytes, StandardCharsets.UTF_8);
    if (xml.startsWith("\uFEFF")) {
      xml = xml.substring(1);
    }
    return Jsoup.parse(xml, "", Parser.xmlParser());
  }

  static String localName(Element element) {
    String name = element.tagName();
    int colon = name.indexOf(':');
    return colon < 0 ? name : name.substring(colon + 1);
  }

  static List<Element> byLocalName(Element root, String localName) {
    List<Element> out = new ArrayList<>();
    for (Element element : root.getAllElements()) {
      if (localName(element).equalsIgnoreCase(localName)) {
        out.add(element);
      }
    }
    return out;
  }

  static Element firstByLocalName(Element root, String localName) {
    for (Element element : root.getAllElements()) {
      if (localName(element).equalsIgnoreCase(localName)) {
        return element;
      }
    }
    return null;
  }

  private static Element firstChild(Element parent, String tagName) {
    for (Element child : parent.children()) {
      if (child.tagName().equalsIgnoreCase(tagName)) {
        return child;
      }
    }
    return null;
  }
}
