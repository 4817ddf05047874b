package nl.adgroot.chaptersplitter.epub;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import nl.adgroot.chaptersplitter.detect.OutlineNode;
import nl.adgroot.chaptersplitter.output.ChapterMaterializer;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.DocumentFormat;

/** Writes a chapter as a small EPUB holding its documents and the resources they use. */
public class EpubChapterMaterializer implements ChapterMaterializer {

  private final EpubBook book;
  private final boolean preserveMetadata;
  private final EpubChapterExtractor extractor;
  private final ResourceResolver resourceResolver;
  private final EpubWriter writer = new EpubWriter();

  public EpubChapterMaterializer(EpubBook book, boolean preserveMetadata) {
    this.book = book;
    this.preserveMetadata = preserveMetadata;
    this.extractor = new EpubChapterExtractor(book);
    this.resourceResolver = new ResourceResolver(book);
  }

  @Override
  public DocumentFormat outputFormat() {
    return DocumentFormat.EPUB;
  }

  @Override
  public void materialize(Chapter chapter, Path target) throws IOException {
    List<EpubItem> units = extractor.extract(chapter);
    List<EpubItem> items = new ArrayList<>(units);
    items.addAll(resourceResolver.resolve(units));

    List<String> spine = units.stream().map(EpubItem::href).toList();
    List<OutlineNode> toc = List.of(new OutlineNode.Leaf(chapter.title(), spine.get(0)));

    writer.write(new EpubBook(metadataFor(chapter.title()), items, spine, toc), target);
  }

  List<MetadataEntry> metadataFor(String title) {
    List<MetadataEntry> out = new ArrayList<>();
    out.add(MetadataEntry.of(MetadataEntry.TITLE, title));
    if (preserveMetadata) {
      for (MetadataEntry entry : book.getMetadata()) {
        if (!entry.is(MetadataEntry.TITLE)) {
          out.add(entry);
        }
      }
      return out;
    }
    out.add(MetadataEntry.of(MetadataEntry.IDENTIFIER, "urn:uuid:" + UUID.randomUUID()));
    out.add(MetadataEntry.of(MetadataEntry.LANGUAGE, book.getLanguage().orElse("en")));
    return out;
  }
}
