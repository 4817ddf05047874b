package nl.adgroot.chaptersplitter.text;

/**
 * One content document of an archive in reading order.
 *
 * @param path      href relative to the package document
 * @param unitIndex 1-based spine ordinal
 * @param markup    decoded XHTML source
 */
public record MarkupUnit(String path, int unitIndex, String markup) {
}
