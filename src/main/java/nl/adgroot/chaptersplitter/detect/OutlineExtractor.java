package nl.adgroot.chaptersplitter.detect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import nl.adgroot.chaptersplitter.text.ChapterCandidate;
import nl.adgroot.chaptersplitter.text.DetectionMethod;
import nl.adgroot.chaptersplitter.text.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a native outline tree into chapter candidates.
 *
 * <p>The tree is walked depth-first in document order; roots are level 1 and every child is one
 * level deeper than its parent. Nodes whose destination cannot be resolved are skipped.
 */
public class OutlineExtractor {

  private static final Logger log = LoggerFactory.getLogger(OutlineExtractor.class);

  private record Frame(OutlineNode node, int level) {}

  /**
   * @param level keep only nodes at this depth; {@code <= 0} keeps every level
   */
  public OutlineResult extract(DocumentSource source, int level) {
    List<OutlineNode> roots;
    try {
      roots = source.outline();
    } catch (RuntimeException e) {
      log.warn("Could not read outline of {}: {}", source.name(), e.getMessage());
      return OutlineResult.none();
    }
    if (roots == null || roots.isEmpty()) {
      return OutlineResult.none();
    }

    List<ChapterCandidate> all = traverse(roots, source);
    if (level <= 0) {
      return new OutlineResult(all, true);
    }
    List<ChapterCandidate> filtered = all.stream()
        .filter(c -> c.level() == level)
        .toList();
    return new OutlineResult(filtered, true);
  }

  List<ChapterCandidate> traverse(List<OutlineNode> roots, DocumentSource source) {
    List<ChapterCandidate> out = new ArrayList<>();
    Deque<Frame> stack = new ArrayDeque<>();
    pushReversed(stack, roots, 1);

    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      OutlineNode node = frame.node();

      Optional<Position> position = resolve(source, node);
      if (position.isPresent()) {
        String title = node.title();
        if (title == null || title.isBlank()) {
          title = source.untitled(position.get());
        }
        out.add(new ChapterCandidate(title, position.get(), frame.level(), DetectionMethod.NATIVE, 1.0));
      } else {
        log.debug("Skipping outline entry '{}' with unresolvable destination '{}'",
            node.title(), node.destination());
      }

      if (node instanceof OutlineNode.Section section) {
        pushReversed(stack, section.children(), frame.level() + 1);
      }
    }
    return out;
  }

  private static Optional<Position> resolve(DocumentSource source, OutlineNode node) {
    String destination = node.destination();
    if (destination == null || destination.isBlank()) {
      return Optional.empty();
    }
    return source.resolveDestination(destination);
  }

  // pushed back-to-front so that pop() yields document order
  private static void pushReversed(Deque<Frame> stack, List<OutlineNode> nodes, int level) {
    for (int i = nodes.size() - 1; i >= 0; i--) {
      stack.push(new Frame(nodes.get(i), level));
    }
  }
}
