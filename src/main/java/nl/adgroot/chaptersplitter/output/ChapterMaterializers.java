package nl.adgroot.chaptersplitter.output;

import nl.adgroot.chaptersplitter.detect.DocumentSource;
import nl.adgroot.chaptersplitter.epub.EpubChapterMaterializer;
import nl.adgroot.chaptersplitter.epub.EpubDocumentSource;
import nl.adgroot.chaptersplitter.pdf.PdfDocumentSource;
import nl.adgroot.chaptersplitter.pdf.PdfPageRangeMaterializer;
import nl.adgroot.chaptersplitter.pdf.PdfTextReflowMaterializer;
import nl.adgroot.chaptersplitter.text.DocumentFormat;

public final class ChapterMaterializers {

  private ChapterMaterializers() {
    // utility class
  }

  /**
   * Picks the materializer for a source and target format pair.
   *
   * @throws IllegalArgumentException for PDF to EPUB, which is not supported
   */
  public static ChapterMaterializer create(DocumentSource source, DocumentFormat target,
      boolean preserveMetadata) {
    if (source instanceof PdfDocumentSource pdf) {
      if (target == DocumentFormat.PDF) {
        return new PdfPageRangeMaterializer(pdf.getDocument(), preserveMetadata);
      }
      throw new IllegalArgumentException("Cannot write PDF chapters as " + target);
    }
    if (source instanceof EpubDocumentSource epub) {
      if (target == DocumentFormat.EPUB) {
        return new EpubChapterMaterializer(epub.getBook(), preserveMetadata);
      }
      return new PdfTextReflowMaterializer(epub.getBook(), preserveMetadata);
    }
    throw new IllegalArgumentException("Unsupported source: " + source.name());
  }
}
