package nl.adgroot.chaptersplitter.text;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public enum DocumentFormat {
  PDF(".pdf", true),
  EPUB(".epub", false);

  private final String extension;
  private final boolean paginated;

  DocumentFormat(String extension, boolean paginated) {
    this.extension = extension;
    this.paginated = paginated;
  }

  public String extension() {
    return extension;
  }

  public boolean isPaginated() {
    return paginated;
  }

  public static Optional<DocumentFormat> fromPath(Path path) {
    if (path == null || path.getFileName() == null) {
      return Optional.empty();
    }
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    for (DocumentFormat format : values()) {
      if (name.endsWith(format.extension)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }

  /** Accepts {@code pdf}, {@code .pdf}, {@code EPUB} and so on. */
  public static DocumentFormat parse(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (DocumentFormat format : values()) {
      if (format.extension.equals(normalized) || format.extension.substring(1).equals(normalized)) {
        return format;
      }
    }
    throw new IllegalArgumentException("Unsupported format: " + value);
  }
}
