package nl.adgroot.chaptersplitter.pdf;

import java.io.IOException;
import java.nio.file.Path;
import nl.adgroot.chaptersplitter.output.ChapterMaterializer;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.DocumentFormat;
import org.apache.pdfbox.multipdf.PageExtractor;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;

/** Copies a chapter's page range into a new PDF. */
public class PdfPageRangeMaterializer implements ChapterMaterializer {

  private final PDDocument source;
  private final boolean preserveMetadata;

  public PdfPageRangeMaterializer(PDDocument source, boolean preserveMetadata) {
    this.source = source;
    this.preserveMetadata = preserveMetadata;
  }

  @Override
  public DocumentFormat outputFormat() {
    return DocumentFormat.PDF;
  }

  @Override
  public void materialize(Chapter chapter, Path target) throws IOException {
    int last = Math.min(chapter.end(), source.getNumberOfPages());
    try (PDDocument part = new PageExtractor(source, chapter.start(), last).extract()) {
      // PageExtractor shares the source's information dictionary and XMP metadata
      if (preserveMetadata) {
        PDDocumentInformation info = copyOf(source.getDocumentInformation());
        info.setTitle(chapter.title());
        part.setDocumentInformation(info);
      } else {
        part.setDocumentInformation(new PDDocumentInformation());
        part.getDocumentCatalog().setMetadata(null);
      }
      part.save(target.toFile());
    }
  }

  static PDDocumentInformation copyOf(PDDocumentInformation source) {
    PDDocumentInformation copy = new PDDocumentInformation();
    for (String key : source.getMetadataKeys()) {
      String value = source.getCustomMetadataValue(key);
      if (value != null) {
        copy.setCustomMetadataValue(key, value);
      }
    }
    return copy;
  }
}
