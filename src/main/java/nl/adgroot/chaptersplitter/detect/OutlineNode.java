package nl.adgroot.chaptersplitter.detect;

import java.util.List;

/**
 * A node of a document's native outline (bookmarks or table of contents).
 *
 * <p>The destination is format specific: a 1-based page number for PDF, an
 * {@code href#fragment} for EPUB. It is {@code null} when the node points nowhere.
 */
public sealed interface OutlineNode permits OutlineNode.Leaf, OutlineNode.Section {

  String title();

  String destination();

  List<OutlineNode> children();

  record Leaf(String title, String destination) implements OutlineNode {

    @Override
    public List<OutlineNode> children() {
      return List.of();
    }
  }

  record Section(String title, String destination, List<OutlineNode> children) implements OutlineNode {

    public Section {
      children = List.copyOf(children);
    }
  }

  static OutlineNode of(String title, String destination, List<OutlineNode> children) {
    if (children == null || children.isEmpty()) {
      return new Leaf(title, destination);
    }
    return new Section(title, destination, children);
  }
}
