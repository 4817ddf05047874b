package nl.adgroot.chaptersplitter.output;

import java.io.IOException;
import java.nio.file.Path;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.DocumentFormat;

/**
 * Writes one chapter of an opened source document as a standalone file.
 *
 * <p>Implementations read from the source the caller keeps open and never close it.
 */
public interface ChapterMaterializer {

  DocumentFormat outputFormat();

  void materialize(Chapter chapter, Path target) throws IOException;
}
