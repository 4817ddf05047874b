package nl.adgroot.chaptersplitter.epub;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * A manifest entry and its bytes.
 *
 * @param href       path relative to the package document
 * @param properties space separated manifest properties, {@code null} when absent
 */
public record EpubItem(String id, String href, String mediaType, byte[] content, String properties) {

  public static final String XHTML = "application/xhtml+xml";
  public static final String CSS = "text/css";

  public EpubItem {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(href, "href");
    Objects.requireNonNull(content, "content");
    mediaType = mediaType == null ? "application/octet-stream" : mediaType;
    if (properties != null && properties.isBlank()) {
      properties = null;
    }
  }

  public EpubItem(String id, String href, String mediaType, byte[] content) {
    this(id, href, mediaType, content, null);
  }

  public boolean isDocument() {
    return XHTML.equals(mediaType) || "text/html".equals(mediaType);
  }

  public boolean isStylesheet() {
    return CSS.equals(mediaType);
  }

  public boolean hasProperty(String property) {
    return properties != null && Arrays.asList(properties.split("\\s+")).contains(property);
  }

  public String text() {
    return new String(content, StandardCharsets.UTF_8);
  }

  public EpubItem withContent(byte[] newContent) {
    return new EpubItem(id, href, mediaType, newContent, properties);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EpubItem other)) {
      return false;
    }
    return id.equals(other.id) && href.equals(other.href) && mediaType.equals(other.mediaType)
        && Arrays.equals(content, other.content) && Objects.equals(properties, other.properties);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, href, mediaType, Arrays.hashCode(content), properties);
  }

  @NotNull
  @Override
  public String toString() {
    return href + " (" + mediaType + ", " + content.length + " bytes)";
  }
}
