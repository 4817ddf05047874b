package nl.adgroot.chaptersplitter.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {

  public DetectionConfig detection = new DetectionConfig();
  public OutputConfig output = new OutputConfig();
  public ConfirmationConfig confirmation = new ConfirmationConfig();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class DetectionConfig {
    // native, structural, manifest or hybrid; bookmarks and heuristic are accepted as aliases
    public String strategy = "hybrid";

    public String sensitivity = "medium";

    // outline depth used as chapters; 0 keeps every depth
    public int level = 1;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class OutputConfig {
    public String filenamePattern = "{index:02d}_{title}";
    public boolean preserveMetadata = true;
    public int maxTitleLength = 100;

    // pdf or epub; null writes the source format
    public String format = null;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ConfirmationConfig {
    // chapters below this confidence trigger a confirmation prompt before splitting
    public double lowConfidenceThreshold = 0.5;
  }
}
