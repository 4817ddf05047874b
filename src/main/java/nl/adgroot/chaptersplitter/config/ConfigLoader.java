package nl.adgroot.chaptersplitter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import nl.adgroot.chaptersplitter.detect.DetectionStrategy;
import nl.adgroot.chaptersplitter.detect.Sensitivity;
import nl.adgroot.chaptersplitter.text.DocumentFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConfigLoader {

  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

  static final String DEFAULT_RESOURCE = "/config.json";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ConfigLoader() {
    // utility class
  }

  public static AppConfig load(Path path) throws IOException {
    if (!Files.isRegularFile(path)) {
      throw new IOException("Config file not found: " + path);
    }
    AppConfig cfg = MAPPER.readValue(path.toFile(), AppConfig.class);
    log.debug("Loaded config from {}", path);
    return validate(cfg);
  }

  /** The bundled {@code config.json}, or built-in defaults when it is not on the classpath. */
  public static AppConfig loadDefault() throws IOException {
    try (InputStream in = ConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        return validate(new AppConfig());
      }
      return validate(MAPPER.readValue(in, AppConfig.class));
    }
  }

  /**
   * Fills missing sections and rejects values the splitter cannot work with.
   *
   * @throws IllegalArgumentException on an invalid value
   */
  public static AppConfig validate(AppConfig cfg) {
    if (cfg.detection == null) {
      cfg.detection = new AppConfig.DetectionConfig();
    }
    if (cfg.output == null) {
      cfg.output = new AppConfig.OutputConfig();
    }
    if (cfg.confirmation == null) {
      cfg.confirmation = new AppConfig.ConfirmationConfig();
    }

    DetectionStrategy.parse(cfg.detection.strategy);
    if (!isKnownSensitivity(cfg.detection.sensitivity)) {
      log.warn("Unknown sensitivity '{}', using medium", cfg.detection.sensitivity);
    }
    if (cfg.output.maxTitleLength < 1) {
      throw new IllegalArgumentException("output.maxTitleLength must be positive: " + cfg.output.maxTitleLength);
    }
    if (cfg.output.format != null && !cfg.output.format.isBlank()) {
      DocumentFormat.parse(cfg.output.format);
    }
    double threshold = cfg.confirmation.lowConfidenceThreshold;
    if (threshold < 0.0 || threshold > 1.0) {
      throw new IllegalArgumentException("confirmation.lowConfidenceThreshold must be within [0, 1]: " + threshold);
    }
    return cfg;
  }

  private static boolean isKnownSensitivity(String value) {
    if (value == null || value.isBlank()) {
      return true;
    }
    for (Sensitivity sensitivity : Sensitivity.values()) {
      if (sensitivity.name().equalsIgnoreCase(value.trim())) {
        return true;
      }
    }
    return false;
  }
}
