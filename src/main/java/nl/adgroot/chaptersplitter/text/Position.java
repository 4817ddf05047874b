package nl.adgroot.chaptersplitter.text;

/**
 * Where in a document a chapter starts.
 *
 * <p>Paginated documents use {@link PagePosition}, archive documents use {@link UnitPosition}.
 * Both expose a 1-based {@link #unitIndex()} so chapters of either kind can be ordered.
 */
public sealed interface Position permits PagePosition, UnitPosition {

  /** 1-based page number or spine ordinal. */
  int unitIndex();
}
