package nl.adgroot.chaptersplitter.detect;

import java.util.List;
import java.util.function.Supplier;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.ChapterCandidate;
import nl.adgroot.chaptersplitter.text.DetectionMethod;
import nl.adgroot.chaptersplitter.text.DetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the detection stages for a strategy and returns the first non-empty result.
 *
 * <p>When every stage comes back empty the whole document becomes a single chapter.
 */
public class ChapterDetector {

  private static final Logger log = LoggerFactory.getLogger(ChapterDetector.class);

  static final String WHOLE_DOCUMENT_TITLE = "Complete Document";
  static final String FALLBACK_SUFFIX = " (fallback)";

  private record Stage(String name, Supplier<List<ChapterCandidate>> attempt) {}

  private final OutlineExtractor outlineExtractor;
  private final ManifestFallback manifestFallback;
  private final RangeResolver rangeResolver;

  public ChapterDetector() {
    this(new OutlineExtractor(), new ManifestFallback(), new RangeResolver());
  }

  ChapterDetector(OutlineExtractor outlineExtractor, ManifestFallback manifestFallback,
      RangeResolver rangeResolver) {
    this.outlineExtractor = outlineExtractor;
    this.manifestFallback = manifestFallback;
    this.rangeResolver = rangeResolver;
  }

  /**
   * @param level outline depth to keep, {@code <= 0} for every depth; ignored by the other stages
   */
  public DetectionResult detect(DocumentSource source, DetectionStrategy strategy,
      Sensitivity sensitivity, int level) {
    int totalUnits = source.totalUnits();
    OutlineResult outline = outlineExtractor.extract(source, level);
    HeadingAnalyzer headings = new HeadingAnalyzer(sensitivity);

    Stage nativeStage = new Stage(DetectionStrategy.NATIVE.label(), outline::candidates);
    Stage structuralStage = new Stage(DetectionStrategy.STRUCTURAL.label(), () -> headings.analyze(source));
    Stage manifestStage = new Stage(DetectionStrategy.MANIFEST.label(), () -> manifestFallback.detect(source));

    List<Stage> stages = switch (strategy) {
      case NATIVE -> List.of(nativeStage);
      case STRUCTURAL -> List.of(structuralStage);
      case MANIFEST -> List.of(manifestStage);
      case HYBRID -> List.of(nativeStage, structuralStage, manifestStage);
    };

    for (int i = 0; i < stages.size(); i++) {
      Stage stage = stages.get(i);
      List<Chapter> chapters = rangeResolver.resolve(stage.attempt().get(), totalUnits);
      log.debug("Stage {} produced {} chapter(s) for {}", stage.name(), chapters.size(), source.name());
      if (!chapters.isEmpty()) {
        String used = i == 0 ? stage.name() : stage.name() + FALLBACK_SUFFIX;
        return new DetectionResult(chapters, used, totalUnits, outline.hasOutline());
      }
    }

    log.info("No chapters detected in {}, treating the whole document as one chapter", source.name());
    Chapter whole = new Chapter(WHOLE_DOCUMENT_TITLE, source.documentStart(), 1, totalUnits, 1,
        DetectionMethod.FALLBACK, 1.0);
    return new DetectionResult(List.of(whole), DetectionResult.FALLBACK_STRATEGY, totalUnits,
        outline.hasOutline());
  }
}
