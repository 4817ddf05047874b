package nl.adgroot.chaptersplitter.pdf;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import nl.adgroot.chaptersplitter.detect.DocumentSource;
import nl.adgroot.chaptersplitter.detect.MalformedSourceException;
import nl.adgroot.chaptersplitter.detect.OutlineNode;
import nl.adgroot.chaptersplitter.text.DocumentFormat;
import nl.adgroot.chaptersplitter.text.MarkupUnit;
import nl.adgroot.chaptersplitter.text.PagePosition;
import nl.adgroot.chaptersplitter.text.PageText;
import nl.adgroot.chaptersplitter.text.Position;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.action.PDAction;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionGoTo;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.destination.PDDestination;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.destination.PDNamedDestination;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.destination.PDPageDestination;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A PDF opened with PDFBox. Outline destinations are 1-based page numbers.
 */
public class PdfDocumentSource implements DocumentSource {

  private static final Logger log = LoggerFactory.getLogger(PdfDocumentSource.class);

  private final String name;
  private final PDDocument document;
  private List<PageText> pageTexts;

  PdfDocumentSource(String name, PDDocument document) {
    this.name = name;
    this.document = document;
  }

  public static PdfDocumentSource open(Path path) {
    PDDocument document;
    try {
      document = Loader.loadPDF(path.toFile());
    } catch (IOException e) {
      throw new MalformedSourceException("Cannot open PDF " + path + ": " + e.getMessage(), e);
    }
    if (document.getNumberOfPages() == 0) {
      closeQuietly(document);
      throw new MalformedSourceException("PDF has no pages: " + path);
    }
    return new PdfDocumentSource(path.getFileName().toString(), document);
  }

  /** Wraps an already loaded document; closing the source closes the document. */
  public static PdfDocumentSource of(String name, PDDocument document) {
    if (document.getNumberOfPages() == 0) {
      throw new MalformedSourceException("PDF has no pages: " + name);
    }
    return new PdfDocumentSource(name, document);
  }

  public PDDocument getDocument() {
    return document;
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.PDF;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public int totalUnits() {
    return document.getNumberOfPages();
  }

  @Override
  public List<OutlineNode> outline() {
    PDDocumentOutline outline = document.getDocumentCatalog().getDocumentOutline();
    if (outline == null) {
      return List.of();
    }
    return children(outline);
  }

  private List<OutlineNode> children(PDOutlineNode parent) {
    List<OutlineNode> out = new ArrayList<>();
    for (PDOutlineItem item : parent.children()) {
      int page = pageOf(item);
      String destination = page > 0 ? Integer.toString(page) : null;
      out.add(OutlineNode.of(item.getTitle(), destination, children(item)));
    }
    return out;
  }

  /** 1-based page of an outline item, or -1 when it points nowhere in this document. */
  int pageOf(PDOutlineItem item) {
    try {
      PDDestination destination = item.getDestination();
      if (destination == null) {
        PDAction action = item.getAction();
        if (action instanceof PDActionGoTo goTo) {
          destination = goTo.getDestination();
        }
      }
      if (destination instanceof PDNamedDestination named) {
        destination = document.getDocumentCatalog().findNamedDestinationPage(named);
      }
      if (destination instanceof PDPageDestination pd) {
        if (pd.getPage() != null) {
          int index = document.getPages().indexOf(pd.getPage());
          return index >= 0 ? index + 1 : -1;
        }
        if (pd.getPageNumber() >= 0) {
          return pd.getPageNumber() + 1;
        }
      }
    } catch (IOException e) {
      log.debug("Cannot resolve destination of outline item '{}': {}", item.getTitle(), e.getMessage());
    }
    return -1;
  }

  @Override
  public Optional<Position> resolveDestination(String destination) {
    int page;
    try {
      page = Integer.parseInt(destination.trim());
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
    if (page < 1 || page > totalUnits()) {
      return Optional.empty();
    }
    return Optional.of(new PagePosition(page));
  }

  @Override
  public String untitled(Position position) {
    return "Page " + position.unitIndex();
  }

  @Override
  public List<PageText> pageTexts() {
    if (pageTexts == null) {
      try {
        PageTextStripper stripper = new PageTextStripper();
        stripper.writeText(document, Writer.nullWriter());
        pageTexts = List.copyOf(stripper.getPages());
      } catch (IOException e) {
        throw new MalformedSourceException("Cannot extract text from " + name + ": " + e.getMessage(), e);
      }
    }
    return pageTexts;
  }

  @Override
  public List<MarkupUnit> markupUnits() {
    return List.of();
  }

  @Override
  public Position documentStart() {
    return new PagePosition(1);
  }

  @Override
  public void close() throws IOException {
    document.close();
  }

  private static void closeQuietly(PDDocument document) {
    try {
      document.close();
    } catch (IOException e) {
      log.debug("Ignoring failure while closing document: {}", e.getMessage());
    }
  }
}
