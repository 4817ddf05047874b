package nl.adgroot.chaptersplitter.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import nl.adgroot.chaptersplitter.text.Chapter;

/**
 * Writing a chapter failed. Files written before the failure stay on disk and are listed here;
 * chapters after the failing one were not attempted.
 */
public class OutputWriteException extends IOException {

  private final transient List<Path> writtenFiles;
  private final transient Chapter failedChapter;

  public OutputWriteException(Chapter failedChapter, List<Path> writtenFiles, Throwable cause) {
    super("Could not write chapter '" + failedChapter.title() + "': " + cause.getMessage(), cause);
    this.failedChapter = failedChapter;
    this.writtenFiles = List.copyOf(writtenFiles);
  }

  public List<Path> getWrittenFiles() {
    return writtenFiles;
  }

  public Chapter getFailedChapter() {
    return failedChapter;
  }
}
