package nl.adgroot.chaptersplitter.epub;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import nl.adgroot.chaptersplitter.detect.DocumentSource;
import nl.adgroot.chaptersplitter.detect.MalformedSourceException;
import nl.adgroot.chaptersplitter.detect.OutlineNode;
import nl.adgroot.chaptersplitter.text.DocumentFormat;
import nl.adgroot.chaptersplitter.text.MarkupUnit;
import nl.adgroot.chaptersplitter.text.PageText;
import nl.adgroot.chaptersplitter.text.Position;
import nl.adgroot.chaptersplitter.text.Titles;
import nl.adgroot.chaptersplitter.text.UnitPosition;

/**
 * An EPUB read into memory. Units are the readable documents of the spine; outline destinations
 * are {@code href#fragment} relative to the package document.
 */
public class EpubDocumentSource implements DocumentSource {

  private final String name;
  private final EpubBook book;
  private final List<String> contentUnits;
  private List<MarkupUnit> markupUnits;

  EpubDocumentSource(String name, EpubBook book, List<String> contentUnits) {
    this.name = name;
    this.book = book;
    this.contentUnits = contentUnits;
  }

  public static EpubDocumentSource open(Path path) {
    return of(path.getFileName().toString(), new EpubReader().read(path));
  }

  public static EpubDocumentSource of(String name, EpubBook book) {
    List<String> units = book.contentUnits();
    if (units.isEmpty()) {
      throw new MalformedSourceException("EPUB has no readable documents in its spine: " + name);
    }
    return new EpubDocumentSource(name, book, units);
  }

  public EpubBook getBook() {
    return book;
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.EPUB;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public int totalUnits() {
    return contentUnits.size();
  }

  @Override
  public List<OutlineNode> outline() {
    return book.getToc();
  }

  @Override
  public Optional<Position> resolveDestination(String destination) {
    UnitPosition parsed = UnitPosition.parse(destination, 0);
    int index = contentUnits.indexOf(parsed.path());
    if (index < 0) {
      return Optional.empty();
    }
    return Optional.of(new UnitPosition(parsed.path(), parsed.fragment(), index + 1));
  }

  @Override
  public String untitled(Position position) {
    if (position instanceof UnitPosition unit) {
      return Titles.fromFileName(unit.path());
    }
    return "Untitled";
  }

  @Override
  public List<PageText> pageTexts() {
    return List.of();
  }

  @Override
  public List<MarkupUnit> markupUnits() {
    if (markupUnits == null) {
      List<MarkupUnit> units = new ArrayList<>(contentUnits.size());
      for (int i = 0; i < contentUnits.size(); i++) {
        String href = contentUnits.get(i);
        String markup = book.itemByHref(href).map(EpubItem::text).orElse("");
        units.add(new MarkupUnit(href, i + 1, markup));
      }
      markupUnits = List.copyOf(units);
    }
    return markupUnits;
  }

  @Override
  public Position documentStart() {
    return new UnitPosition(contentUnits.get(0), null, 1);
  }

  @Override
  public void close() {
    // the archive was read into memory and closed already
  }
}
