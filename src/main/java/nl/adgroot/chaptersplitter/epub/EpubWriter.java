package nl.adgroot.chaptersplitter.epub;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import nl.adgroot.chaptersplitter.detect.OutlineNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.XmlDeclaration;
import org.jsoup.parser.Parser;

/**
 * Writes an {@link EpubBook} as an EPUB 3 archive with an EPUB 2 NCX for older readers.
 *
 * <p>Layout: {@code mimetype} (stored, first), {@code META-INF/container.xml}, and everything else
 * under {@code OEBPS/}. A navigation document and NCX are generated from the book's toc.
 */
public class EpubWriter {

  static final String MIMETYPE = "application/epub+zip";
  static final String CONTENT_DIR = "OEBPS/";
  static final String PACKAGE_FILE = "content.opf";

  private static final String OPF_NS = "http://www.idpf.org/2007/opf";
  private static final String DC_NS = "http://purl.org/dc/elements/1.1/";
  private static final String XHTML_NS = "http://www.w3.org/1999/xhtml";
  private static final String OPS_NS = "http://www.idpf.org/2007/ops";
  private static final String NCX_NS = "http://www.daisy.org/z3986/2005/ncx/";

  public void write(EpubBook book, Path target) throws IOException {
    Set<String> ids = new HashSet<>();
    Set<String> hrefs = new HashSet<>();
    for (EpubItem item : book.getItems()) {
      ids.add(item.id());
      hrefs.add(item.href());
    }
    String navId = unique("nav", ids);
    String ncxId = unique("ncx", ids);
    String navHref = unique("nav", hrefs) + ".xhtml";
    String ncxHref = unique("toc", hrefs) + ".ncx";

    String title = book.getTitle().orElse("Untitled");
    PackageDocument opf = packageDocument(book, title, navId, navHref, ncxId, ncxHref);

    try (OutputStream out = Files.newOutputStream(target);
        ZipOutputStream zip = new ZipOutputStream(out)) {
      writeStored(zip, "mimetype", MIMETYPE.getBytes(StandardCharsets.US_ASCII));
      writeEntry(zip, "META-INF/container.xml", containerXml());
      for (EpubItem item : book.getItems()) {
        writeEntry(zip, HrefPaths.normalize(CONTENT_DIR + item.href()), item.content());
      }
      writeEntry(zip, CONTENT_DIR + navHref, navXhtml(title, book.getToc()));
      writeEntry(zip, CONTENT_DIR + ncxHref, ncx(title, opf.uid(), book.getToc()));
      writeEntry(zip, CONTENT_DIR + PACKAGE_FILE, bytes(opf.document()));
    }
  }

  private record PackageDocument(Document document, String uid) {}

  private static PackageDocument packageDocument(EpubBook book, String title, String navId,
      String navHref, String ncxId, String ncxHref) {
    Document doc = xmlDocument();
    Element pkg = doc.appendElement("package")
        .attr("xmlns", OPF_NS)
        .attr("version", "3.0");
    Element metadata = pkg.appendElement("metadata")
        .attr("xmlns:dc", DC_NS)
        .attr("xmlns:opf", OPF_NS);

    String uidRef = null;
    String uid = null;
    boolean hasTitle = false;
    boolean hasLanguage = false;
    boolean hasModified = false;
    for (MetadataEntry entry : book.getMetadata()) {
      Element element = metadata.appendElement(entry.name());
      entry.attributes().forEach(element::attr);
      if (!entry.value().isEmpty()) {
        element.text(entry.value());
      }
      if (entry.is(MetadataEntry.IDENTIFIER) && uidRef == null) {
        if (element.attr("id").isEmpty()) {
          element.attr("id", "bookid");
        }
        uidRef = element.attr("id");
        uid = entry.value();
      }
      hasTitle |= entry.is(MetadataEntry.TITLE);
      hasLanguage |= entry.is(MetadataEntry.LANGUAGE);
      hasModified |= "dcterms:modified".equals(entry.attributes().get("property"));
    }
    if (!hasTitle) {
      metadata.appendElement(MetadataEntry.TITLE).text(title);
    }
    if (uidRef == null) {
      uidRef = "bookid";
      uid = "urn:uuid:" + UUID.randomUUID();
      metadata.appendElement(MetadataEntry.IDENTIFIER).attr("id", uidRef).text(uid);
    }
    if (!hasLanguage) {
      metadata.appendElement(MetadataEntry.LANGUAGE).text("en");
    }
    if (!hasModified) {
      metadata.appendElement("meta")
          .attr("property", "dcterms:modified")
          .text(Instant.now().truncatedTo(ChronoUnit.SECONDS).toString());
    }
    pkg.attr("unique-identifier", uidRef);

    Element manifest = pkg.appendElement("manifest");
    Map<String, String> idsByHref = new HashMap<>();
    for (EpubItem item : book.getItems()) {
      idsByHref.putIfAbsent(item.href(), item.id());
      Element element = manifest.appendElement("item")
          .attr("id", item.id())
          .attr("href", item.href())
          .attr("media-type", item.mediaType());
      String properties = withoutNav(item.properties());
      if (properties != null) {
        element.attr("properties", properties);
      }
    }
    manifest.appendElement("item")
        .attr("id", navId)
        .attr("href", navHref)
        .attr("media-type", EpubItem.XHTML)
        .attr("properties", "nav");
    manifest.appendElement("item")
        .attr("id", ncxId)
        .attr("href", ncxHref)
        .attr("media-type", EpubReader.NCX_MEDIA_TYPE);

    Element spine = pkg.appendElement("spine").attr("toc", ncxId);
    for (String href : book.getSpine()) {
      String id = idsByHref.get(href);
      if (id != null) {
        spine.appendElement("itemref").attr("idref", id);
      }
    }
    return new PackageDocument(doc, uid);
  }

  private static String withoutNav(String properties) {
    if (properties == null) {
      return null;
    }
    String kept = String.join(" ", Arrays.stream(properties.split("\\s+"))
        .filter(p -> !p.equals("nav"))
        .toList());
    return kept.isBlank() ? null : kept;
  }

  private static byte[] containerXml() {
    Document doc = xmlDocument();
    doc.appendElement("container")
        .attr("version", "1.0")
        .attr("xmlns", "urn:oasis:names:tc:opendocument:xmlns:container")
        .appendElement("rootfiles")
        .appendElement("rootfile")
        .attr("full-path", CONTENT_DIR + PACKAGE_FILE)
        .attr("media-type", "application/oebps-package+xml");
    return bytes(doc);
  }

  private static byte[] navXhtml(String title, List<OutlineNode> toc) {
    Document doc = xmlDocument();
    doc.appendChild(new DocumentType("html", "", ""));
    Element html = doc.appendElement("html")
        .attr("xmlns", XHTML_NS)
        .attr("xmlns:epub", OPS_NS);
    html.appendElement("head").appendElement("title").text(title);
    Element nav = html.appendElement("body").appendElement("nav")
        .attr("epub:type", "toc")
        .attr("id", "toc");
    nav.appendElement("h1").text(title);
    appendNavList(nav, toc);
    return bytes(doc);
  }

  private static void appendNavList(Element parent, List<OutlineNode> nodes) {
    Element ol = parent.appendElement("ol");
    for (OutlineNode node : nodes) {
      Element li = ol.appendElement("li");
      if (node.destination() != null) {
        li.appendElement("a").attr("href", node.destination()).text(node.title());
      } else {
        li.appendElement("span").text(node.title());
      }
      if (!node.children().isEmpty()) {
        appendNavList(li, node.children());
      }
    }
  }

  private static byte[] ncx(String title, String uid, List<OutlineNode> toc) {
    Document doc = xmlDocument();
    Element ncx = doc.appendElement("ncx")
        .attr("xmlns", NCX_NS)
        .attr("version", "2005-1");
    Element head = ncx.appendElement("head");
    head.appendElement("meta").attr("name", "dtb:uid").attr("content", uid);
    head.appendElement("meta").attr("name", "dtb:depth").attr("content", Integer.toString(depth(toc)));
    head.appendElement("meta").attr("name", "dtb:totalPageCount").attr("content", "0");
    head.appendElement("meta").attr("name", "dtb:maxPageNumber").attr("content", "0");
    ncx.appendElement("docTitle").appendElement("text").text(title);
    appendNavPoints(ncx.appendElement("navMap"), toc, new int[] {0});
    return bytes(doc);
  }

  private static void appendNavPoints(Element parent, List<OutlineNode> nodes, int[] playOrder) {
    for (OutlineNode node : nodes) {
      if (node.destination() == null) {
        appendNavPoints(parent, node.children(), playOrder);
        continue;
      }
      int order = ++playOrder[0];
      Element point = parent.appendElement("navPoint")
          .attr("id", "navpoint-" + order)
          .attr("playOrder", Integer.toString(order));
      point.appendElement("navLabel").appendElement("text").text(node.title());
      point.appendElement("content").attr("src", node.destination());
      appendNavPoints(point, node.children(), playOrder);
    }
  }

  private static int depth(List<OutlineNode> nodes) {
    int max = 0;
    for (OutlineNode node : nodes) {
      max = Math.max(max, 1 + depth(node.children()));
    }
    return Math.max(1, max);
  }

  private static Document xmlDocument() {
    Document doc = new Document("");
    doc.parser(Parser.xmlParser());
    doc.outputSettings()
        .syntax(Document.OutputSettings.Syntax.xml)
        .escapeMode(Entities.EscapeMode.xhtml)
        .charset(StandardCharsets.UTF_8)
        .prettyPrint(true);
    XmlDeclaration declaration = new XmlDeclaration("xml", false);
    declaration.attr("version", "1.0");
    declaration.attr("encoding", "UTF-8");
    doc.appendChild(declaration);
    return doc;
  }

  private static byte[] bytes(Document doc) {
    return doc.outerHtml().getBytes(StandardCharsets.UTF_8);
  }

  private static String unique(String base, Set<String> taken) {
    String candidate = base;
    for (int n = 2; taken.contains(candidate) || taken.contains(candidate + ".xhtml")
        || taken.contains(candidate + ".ncx"); n++) {
      candidate = base + "-" + n;
    }
    taken.add(candidate);
    return candidate;
  }

  private static void writeStored(ZipOutputStream zip, String name, byte[] content) throws IOException {
    ZipEntry entry = new ZipEntry(name);
    entry.setMethod(ZipEntry.STORED);
    entry.setSize(content.length);
    entry.setCompressedSize(content.length);
    CRC32 crc = new CRC32();
    crc.update(content);
    entry.setCrc(crc.getValue());
    zip.putNextEntry(entry);
    zip.write(content);
    zip.closeEntry();
  }

  private static void writeEntry(ZipOutputStream zip, String name, byte[] content) throws IOException {
    ZipEntry entry = new ZipEntry(name);
    entry.setMethod(ZipEntry.DEFLATED);
    zip.putNextEntry(entry);
    zip.write(content);
    zip.closeEntry();
  }
}
