package nl.adgroot.chaptersplitter.detect;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;
import nl.adgroot.chaptersplitter.text.DocumentFormat;
import nl.adgroot.chaptersplitter.text.MarkupUnit;
import nl.adgroot.chaptersplitter.text.PageText;
import nl.adgroot.chaptersplitter.text.Position;

/**
 * Read-only view of an opened source document, as seen by the detectors.
 *
 * <p>Paginated formats expose {@link #pageTexts()}, archive formats expose
 * {@link #markupUnits()}; the other list is empty.
 */
public interface DocumentSource extends Closeable {

  DocumentFormat format();

  /** Display name, usually the file name. */
  String name();

  /** Pages for PDF, content documents in the spine for EPUB. */
  int totalUnits();

  /** Root entries of the native outline; empty when the document has none. */
  List<OutlineNode> outline();

  Optional<Position> resolveDestination(String destination);

  /** Title for an outline entry that has none. */
  String untitled(Position position);

  List<PageText> pageTexts();

  List<MarkupUnit> markupUnits();

  /** Start position of the single chapter used when nothing else is detected. */
  Position documentStart();
}
