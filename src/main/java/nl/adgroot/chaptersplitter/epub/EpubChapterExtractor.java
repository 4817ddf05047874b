package nl.adgroot.chaptersplitter.epub;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.UnitPosition;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls the content documents of one chapter out of a book.
 *
 * <p>A chapter that starts at an element id gets a new document holding only that element.
 * Otherwise the documents of the chapter's range are returned unchanged.
 */
public class EpubChapterExtractor {

  private static final Logger log = LoggerFactory.getLogger(EpubChapterExtractor.class);

  private static final String XHTML_PROLOG = "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n<!DOCTYPE html>\n";
  private static final String SHELL =
      "<html xmlns=\"http://www.w3.org/1999/xhtml\"><head><title></title></head><body></body></html>";

  private final EpubBook book;
  private final List<String> contentUnits;

  public EpubChapterExtractor(EpubBook book) {
    this.book = book;
    this.contentUnits = book.contentUnits();
  }

  public List<EpubItem> extract(Chapter chapter) {
    if (!(chapter.position() instanceof UnitPosition position)) {
      throw new IllegalArgumentException("Not an archive chapter: " + chapter);
    }
    if (position.hasFragment()) {
      EpubItem unit = book.itemByHref(position.path())
          .orElseThrow(() -> new IllegalArgumentException("No content document " + position.path()));
      return List.of(splice(unit, position.fragment(), chapter.title()));
    }
    List<EpubItem> out = new ArrayList<>();
    for (int i = chapter.start(); i <= chapter.end() && i <= contentUnits.size(); i++) {
      book.itemByHref(contentUnits.get(i - 1)).ifPresent(out::add);
    }
    if (out.isEmpty()) {
      throw new IllegalArgumentException("Chapter range " + chapter.location() + " holds no content documents");
    }
    return out;
  }

  /** The element with the given id inside a fresh document, or the unit itself when the id is missing. */
  EpubItem splice(EpubItem unit, String fragment, String title) {
    Document source = Jsoup.parse(unit.text());
    Element element = source.getElementById(fragment);
    if (element == null) {
      log.warn("No element with id '{}' in {}, using the whole document", fragment, unit.href());
      return unit;
    }
    Document shell = Jsoup.parse(SHELL);
    shell.title(title);
    shell.body().appendChild(element.clone());
    shell.outputSettings()
        .syntax(Document.OutputSettings.Syntax.xml)
        .escapeMode(Entities.EscapeMode.xhtml)
        .charset(StandardCharsets.UTF_8)
        .prettyPrint(false);
    String xhtml = XHTML_PROLOG + shell.html();
    return unit.withContent(xhtml.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Readable text of a content document with one line per block element. Falls back to stripping
   * tags from the raw bytes when the markup cannot be parsed.
   */
  public static String plainText(EpubItem unit) {
    try {
      Document doc = Jsoup.parse(unit.text());
      Element root = doc.body() != null ? doc.body() : doc;
      StringBuilder sb = new StringBuilder();
      NodeTraversor.traverse(new BlockTextVisitor(sb), root);
      return tidy(sb.toString());
    } catch (RuntimeException e) {
      log.warn("Cannot parse {}, stripping tags instead: {}", unit.href(), e.getMessage());
      return tidy(unit.text().replaceAll("<[^>]+>", " "));
    }
  }

  private static String tidy(String text) {
    StringBuilder out = new StringBuilder();
    boolean blank = true;
    for (String line : text.split("\n")) {
      String cleaned = line.replaceAll("[ \\t\\x0B\\f\\r]+", " ").strip();
      if (cleaned.isEmpty()) {
        if (!blank) {
          out.append('\n');
          blank = true;
        }
        continue;
      }
      out.append(cleaned).append('\n');
      blank = false;
    }
    return out.toString().strip();
  }

  private static final class BlockTextVisitor implements NodeVisitor {

    private final StringBuilder sb;

    BlockTextVisitor(StringBuilder sb) {
      this.sb = sb;
    }

    @Override
    public void head(Node node, int depth) {
      if (node instanceof TextNode text) {
        sb.append(text.text());
      } else if (node instanceof Element element) {
        if (element.tagName().equals("br")) {
          sb.append('\n');
        } else if (element.isBlock()) {
          sb.append('\n');
        }
      }
    }

    @Override
    public void tail(Node node, int depth) {
      if (node instanceof Element element && element.isBlock()) {
        sb.append('\n');
      }
    }
  }
}
