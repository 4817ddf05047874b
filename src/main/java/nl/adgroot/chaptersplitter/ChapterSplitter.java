package nl.adgroot.chaptersplitter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import nl.adgroot.chaptersplitter.config.AppConfig;
import nl.adgroot.chaptersplitter.detect.ChapterDetector;
import nl.adgroot.chaptersplitter.detect.DetectionStrategy;
import nl.adgroot.chaptersplitter.detect.DocumentSource;
import nl.adgroot.chaptersplitter.detect.MalformedSourceException;
import nl.adgroot.chaptersplitter.detect.Sensitivity;
import nl.adgroot.chaptersplitter.epub.EpubDocumentSource;
import nl.adgroot.chaptersplitter.output.ChapterMaterializer;
import nl.adgroot.chaptersplitter.output.ChapterMaterializers;
import nl.adgroot.chaptersplitter.output.FilenameGenerator;
import nl.adgroot.chaptersplitter.output.OutputWriteException;
import nl.adgroot.chaptersplitter.pdf.PdfDocumentSource;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.DetectionResult;
import nl.adgroot.chaptersplitter.text.DocumentFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects chapters in a PDF or EPUB and writes each one to its own file.
 *
 * <p>Chapters are written one after another in document order. When a write fails the files
 * already written are kept and reported through {@link OutputWriteException}.
 */
public class ChapterSplitter {

  private static final Logger log = LoggerFactory.getLogger(ChapterSplitter.class);

  private final AppConfig config;
  private final ChapterDetector detector;

  public ChapterSplitter(AppConfig config) {
    this(config, new ChapterDetector());
  }

  ChapterSplitter(AppConfig config, ChapterDetector detector) {
    this.config = config;
    this.detector = detector;
  }

  /**
   * @throws MalformedSourceException when the file is missing, has an unsupported extension or
   *     cannot be read
   */
  public static DocumentSource open(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new MalformedSourceException("File not found: " + path);
    }
    DocumentFormat format = DocumentFormat.fromPath(path)
        .orElseThrow(() -> new MalformedSourceException("Unsupported file type (expected .pdf or .epub): " + path));
    if (format == DocumentFormat.PDF) {
      return PdfDocumentSource.open(path);
    }
    return EpubDocumentSource.open(path);
  }

  public DetectionResult detect(Path path) throws IOException {
    try (DocumentSource source = open(path)) {
      return detect(source);
    }
  }

  public DetectionResult detect(DocumentSource source) {
    AppConfig.DetectionConfig cfg = config.detection;
    DetectionResult result = detector.detect(source, DetectionStrategy.parse(cfg.strategy),
        Sensitivity.parse(cfg.sensitivity), cfg.level);
    log.info("Detected {} chapter(s) in {} using {}", result.chapterCount(), source.name(),
        result.strategyUsed());
    return result;
  }

  /** Detects and splits in one pass over the source. */
  public List<Path> split(Path path, Path outputDir) throws IOException {
    try (DocumentSource source = open(path)) {
      return split(source, detect(source).chapters(), outputDir);
    }
  }

  public List<Path> split(DocumentSource source, List<Chapter> chapters, Path outputDir)
      throws IOException {
    DocumentFormat target = outputFormat(source);
    ChapterMaterializer materializer = ChapterMaterializers.create(source, target,
        config.output.preserveMetadata);
    FilenameGenerator names = new FilenameGenerator(config.output.filenamePattern,
        config.output.maxTitleLength, target, stem(source.name()));

    Files.createDirectories(outputDir);

    List<Path> written = new ArrayList<>();
    for (int i = 0; i < chapters.size(); i++) {
      Chapter chapter = chapters.get(i);
      Path file = outputDir.resolve(names.generate(chapter, i + 1));
      try {
        materializer.materialize(chapter, file);
      } catch (IOException e) {
        throw new OutputWriteException(chapter, written, e);
      }
      written.add(file);
      log.debug("Wrote {} ({})", file, chapter.location());
    }
    return written;
  }

  DocumentFormat outputFormat(DocumentSource source) {
    String format = config.output.format;
    if (format == null || format.isBlank()) {
      return source.format();
    }
    return DocumentFormat.parse(format);
  }

  static String stem(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
