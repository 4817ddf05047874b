package nl.adgroot.chaptersplitter.epub;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import nl.adgroot.chaptersplitter.detect.OutlineNode;

/**
 * In-memory EPUB: package metadata, manifest items, reading order and table of contents.
 *
 * <p>Every href is relative to the package document.
 */
public class EpubBook {

  private final List<MetadataEntry> metadata;
  private final Map<String, EpubItem> itemsByHref = new LinkedHashMap<>();
  private final Map<String, EpubItem> itemsById = new LinkedHashMap<>();
  private final List<String> spine;
  private final List<OutlineNode> toc;

  public EpubBook(List<MetadataEntry> metadata, List<EpubItem> items, List<String> spine,
      List<OutlineNode> toc) {
    this.metadata = List.copyOf(metadata);
    for (EpubItem item : items) {
      itemsByHref.putIfAbsent(item.href(), item);
      itemsById.putIfAbsent(item.id(), item);
    }
    this.spine = List.copyOf(spine);
    this.toc = List.copyOf(toc);
  }

  public List<MetadataEntry> getMetadata() {
    return metadata;
  }

  public List<EpubItem> getItems() {
    return new ArrayList<>(itemsByHref.values());
  }

  /** Hrefs in reading order. */
  public List<String> getSpine() {
    return spine;
  }

  public List<OutlineNode> getToc() {
    return toc;
  }

  public Optional<EpubItem> itemByHref(String href) {
    return Optional.ofNullable(itemsByHref.get(href));
  }

  public Optional<EpubItem> itemById(String id) {
    return Optional.ofNullable(itemsById.get(id));
  }

  public Optional<String> firstMetadataValue(String qualifiedName) {
    return metadata.stream()
        .filter(m -> m.is(qualifiedName))
        .map(MetadataEntry::value)
        .filter(v -> !v.isBlank())
        .findFirst();
  }

  public Optional<String> getTitle() {
    return firstMetadataValue(MetadataEntry.TITLE);
  }

  public Optional<String> getLanguage() {
    return firstMetadataValue(MetadataEntry.LANGUAGE);
  }

  public Optional<String> getCreator() {
    return firstMetadataValue(MetadataEntry.CREATOR);
  }

  /**
   * Spine documents that carry readable content, in reading order. The navigation document is
   * left out.
   */
  public List<String> contentUnits() {
    List<String> out = new ArrayList<>();
    for (String href : spine) {
      EpubItem item = itemsByHref.get(href);
      if (item != null && item.isDocument() && !item.hasProperty("nav") && !out.contains(href)) {
        out.add(href);
      }
    }
    return out;
  }
}
