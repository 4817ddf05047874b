package nl.adgroot.chaptersplitter.pdf;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import nl.adgroot.chaptersplitter.epub.EpubBook;
import nl.adgroot.chaptersplitter.epub.EpubChapterExtractor;
import nl.adgroot.chaptersplitter.epub.EpubItem;
import nl.adgroot.chaptersplitter.output.ChapterMaterializer;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.DocumentFormat;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

/**
 * Renders the text of an EPUB chapter onto plain PDF pages. Layout, images and styling are not
 * carried over.
 */
public class PdfTextReflowMaterializer implements ChapterMaterializer {

  static final int CHARS_PER_LINE = 90;
  static final float FONT_SIZE = 11f;
  static final float LEADING = 14f;
  static final float MARGIN = 50f;

  private final EpubBook book;
  private final EpubChapterExtractor extractor;
  private final boolean preserveMetadata;

  public PdfTextReflowMaterializer(EpubBook book, boolean preserveMetadata) {
    this.book = book;
    this.extractor = new EpubChapterExtractor(book);
    this.preserveMetadata = preserveMetadata;
  }

  @Override
  public DocumentFormat outputFormat() {
    return DocumentFormat.PDF;
  }

  @Override
  public void materialize(Chapter chapter, Path target) throws IOException {
    StringBuilder text = new StringBuilder();
    for (EpubItem unit : extractor.extract(chapter)) {
      if (text.length() > 0) {
        text.append("\n\n");
      }
      text.append(EpubChapterExtractor.plainText(unit));
    }

    try (PDDocument out = new PDDocument()) {
      PDFont font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      writeLines(out, wrap(text.toString(), CHARS_PER_LINE), font);

      PDDocumentInformation info = new PDDocumentInformation();
      if (preserveMetadata) {
        info.setTitle(chapter.title());
        book.getCreator().ifPresent(info::setAuthor);
      }
      out.setDocumentInformation(info);
      out.save(target.toFile());
    }
  }

  /** Fills as many US-Letter pages as needed; always produces at least one page. */
  static void writeLines(PDDocument doc, List<String> lines, PDFont font) throws IOException {
    Map<Integer, Boolean> encodable = new HashMap<>();
    int index = 0;
    do {
      PDPage page = new PDPage(PDRectangle.LETTER);
      doc.addPage(page);
      PDRectangle box = page.getMediaBox();
      float y = box.getHeight() - MARGIN;

      try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
        cs.beginText();
        cs.setFont(font, FONT_SIZE);
        cs.newLineAtOffset(MARGIN, y);
        while (index < lines.size() && y >= MARGIN) {
          cs.showText(printable(lines.get(index), font, encodable));
          cs.newLineAtOffset(0, -LEADING);
          y -= LEADING;
          index++;
        }
        cs.endText();
      }
    } while (index < lines.size());
  }

  // characters the font cannot encode become '?'
  static String printable(String line, PDFont font, Map<Integer, Boolean> cache) {
    StringBuilder sb = new StringBuilder(line.length());
    line.codePoints().forEach(cp -> {
      if (cp == '\t') {
        sb.append(' ');
        return;
      }
      boolean ok = cache.computeIfAbsent(cp, c -> canEncode(font, c));
      sb.append(ok ? new String(Character.toChars(cp)) : "?");
    });
    return sb.toString();
  }

  private static boolean canEncode(PDFont font, int codePoint) {
    if (Character.isISOControl(codePoint)) {
      return false;
    }
    try {
      font.encode(new String(Character.toChars(codePoint)));
      return true;
    } catch (IllegalArgumentException | IOException e) {
      return false;
    }
  }

  /** Greedy word wrap at a fixed character budget; blank lines between paragraphs are kept. */
  static List<String> wrap(String text, int width) {
    List<String> lines = new ArrayList<>();
    for (String paragraph : text.replace("\r", "").split("\n", -1)) {
      if (paragraph.isBlank()) {
        lines.add("");
        continue;
      }
      StringBuilder line = new StringBuilder();
      for (String word : paragraph.strip().split("\\s+")) {
        while (word.length() > width) {
          if (line.length() > 0) {
            lines.add(line.toString());
            line.setLength(0);
          }
          lines.add(word.substring(0, width));
          word = word.substring(width);
        }
        if (line.length() > 0 && line.length() + 1 + word.length() > width) {
          lines.add(line.toString());
          line.setLength(0);
        }
        if (line.length() > 0) {
          line.append(' ');
        }
        line.append(word);
      }
      if (line.length() > 0) {
        lines.add(line.toString());
      }
    }
    return lines;
  }
}
