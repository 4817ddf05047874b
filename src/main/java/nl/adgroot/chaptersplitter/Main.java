package nl.adgroot.chaptersplitter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import nl.adgroot.chaptersplitter.config.AppConfig;
import nl.adgroot.chaptersplitter.config.ConfigLoader;
import nl.adgroot.chaptersplitter.detect.DetectionStrategy;
import nl.adgroot.chaptersplitter.detect.DocumentSource;
import nl.adgroot.chaptersplitter.detect.MalformedSourceException;
import nl.adgroot.chaptersplitter.output.OutputWriteException;
import nl.adgroot.chaptersplitter.text.Chapter;
import nl.adgroot.chaptersplitter.text.DetectionResult;
import nl.adgroot.chaptersplitter.text.DocumentFormat;
import nl.adgroot.chaptersplitter.text.UnitPosition;

public class Main {

  static final int EXIT_OK = 0;
  static final int EXIT_ERROR = 1;
  static final int EXIT_USAGE = 2;

  private static final int MAX_TITLE_WIDTH = 50;

  private final BufferedReader in;
  private final PrintStream out;

  Main(InputStream in, PrintStream out) {
    this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    this.out = out;
  }

  public static void main(String[] args) {
    System.exit(new Main(System.in, System.out).run(args));
  }

  static class Cli {
    String command;
    String input;
    String outputDir;
    String strategy;
    String sensitivity;
    Integer level;
    String pattern;
    String format;
    String config;
    boolean noMetadata = false;
    boolean yes = false;
    boolean help = false;
  }

  int run(String[] args) {
    Cli cli;
    try {
      cli = parseArgs(args);
    } catch (IllegalArgumentException e) {
      out.println("Error: " + e.getMessage());
      printUsage();
      return EXIT_USAGE;
    }
    if (cli.help) {
      printUsage();
      return EXIT_OK;
    }

    AppConfig cfg;
    try {
      cfg = cli.config != null ? ConfigLoader.load(Path.of(cli.config)) : ConfigLoader.loadDefault();
      applyOverrides(cli, cfg);
      ConfigLoader.validate(cfg);
    } catch (IOException | IllegalArgumentException e) {
      out.println("Error: invalid configuration: " + e.getMessage());
      return EXIT_USAGE;
    }

    Path input = Path.of(cli.input);
    ChapterSplitter splitter = new ChapterSplitter(cfg);
    try (DocumentSource source = ChapterSplitter.open(input)) {
      printHeader(input, cfg);
      DetectionResult result = splitter.detect(source);
      out.println(result.summary());

      if (cli.command.equals("preview")) {
        printChapters(result);
        return EXIT_OK;
      }

      if (!cli.yes && !confirm(result, cfg.confirmation.lowConfidenceThreshold)) {
        out.println("Aborted.");
        return EXIT_OK;
      }

      Path outputDir = cli.outputDir != null ? Path.of(cli.outputDir) : defaultOutputDir(input);
      out.println();
      out.println("Splitting into " + result.chapterCount() + " chapter(s)...");
      List<Path> written = splitter.split(source, result.chapters(), outputDir);
      for (Path file : written) {
        out.println("WROTE " + file);
      }
      out.println("Successfully split into " + written.size() + " file(s)");
      out.println("Output directory: " + outputDir);
      return EXIT_OK;
    } catch (OutputWriteException e) {
      out.println("Error: " + e.getMessage());
      out.println("Files written before the failure:");
      for (Path file : e.getWrittenFiles()) {
        out.println("  " + file);
      }
      return EXIT_ERROR;
    } catch (MalformedSourceException | IOException | IllegalArgumentException e) {
      out.println("Error: " + e.getMessage());
      return EXIT_ERROR;
    }
  }

  static Cli parseArgs(String[] args) {
    Cli cli = new Cli();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      String value = null;
      int eq = arg.indexOf('=');
      if (arg.startsWith("--") && eq > 0) {
        value = arg.substring(eq + 1);
        arg = arg.substring(0, eq);
      }

      switch (arg) {
        case "-h":
        case "--help":
          cli.help = true;
          return cli;
        case "-o":
        case "--output-dir":
          cli.outputDir = value != null ? value : requireValue(args, ++i, arg);
          break;
        case "--strategy":
          cli.strategy = value != null ? value : requireValue(args, ++i, arg);
          DetectionStrategy.parse(cli.strategy);
          break;
        case "--sensitivity":
          cli.sensitivity = value != null ? value : requireValue(args, ++i, arg);
          if (!List.of("low", "medium", "high").contains(cli.sensitivity.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("--sensitivity must be low, medium or high: " + cli.sensitivity);
          }
          break;
        case "--level":
        case "--toc-level":
        case "--bookmark-level":
          String level = value != null ? value : requireValue(args, ++i, arg);
          try {
            cli.level = Integer.parseInt(level.trim());
          } catch (NumberFormatException e) {
            throw new IllegalArgumentException(arg + " expects a number: " + level);
          }
          break;
        case "--pattern":
          cli.pattern = value != null ? value : requireValue(args, ++i, arg);
          break;
        case "--format":
          cli.format = value != null ? value : requireValue(args, ++i, arg);
          DocumentFormat.parse(cli.format);
          break;
        case "--config":
          cli.config = value != null ? value : requireValue(args, ++i, arg);
          break;
        case "--no-metadata":
          cli.noMetadata = true;
          break;
        case "-y":
        case "--yes":
          cli.yes = true;
          break;
        default:
          if (arg.startsWith("-")) {
            throw new IllegalArgumentException("Unknown option: " + arg);
          }
          if (cli.command == null) {
            cli.command = arg;
          } else if (cli.input == null) {
            cli.input = arg;
          } else {
            throw new IllegalArgumentException("Unexpected argument: " + arg);
          }
      }
    }

    if (cli.command == null) {
      throw new IllegalArgumentException("Missing command (preview or split)");
    }
    if (!cli.command.equals("preview") && !cli.command.equals("split")) {
      throw new IllegalArgumentException("Unknown command: " + cli.command);
    }
    if (cli.input == null) {
      throw new IllegalArgumentException("Missing input file");
    }
    return cli;
  }

  private static String requireValue(String[] args, int i, String flag) {
    if (i >= args.length) {
      throw new IllegalArgumentException("Missing value for " + flag);
    }
    return args[i];
  }

  static void applyOverrides(Cli cli, AppConfig cfg) {
    if (cli.strategy != null) {
      cfg.detection.strategy = cli.strategy;
    }
    if (cli.sensitivity != null) {
      cfg.detection.sensitivity = cli.sensitivity;
    }
    if (cli.level != null) {
      cfg.detection.level = cli.level;
    }
    if (cli.pattern != null) {
      cfg.output.filenamePattern = cli.pattern;
    }
    if (cli.format != null) {
      cfg.output.format = cli.format;
    }
    if (cli.noMetadata) {
      cfg.output.preserveMetadata = false;
    }
  }

  static Path defaultOutputDir(Path input) {
    String stem = ChapterSplitter.stem(input.getFileName().toString());
    Path parent = input.toAbsolutePath().getParent();
    return parent.resolve(stem + "_chapters");
  }

  private boolean confirm(DetectionResult result, double threshold) throws IOException {
    List<Chapter> low = result.lowConfidenceChapters(threshold);
    if (!result.isFallback() && low.isEmpty()) {
      return true;
    }
    out.println();
    if (result.isFallback()) {
      out.println("Warning: no chapters detected, the whole document will be written as one file.");
    }
    if (!low.isEmpty()) {
      out.println("Warning: " + low.size() + " chapter(s) have low confidence.");
    }
    out.print("Continue with splitting? [y/N] ");
    out.flush();
    String answer = in.readLine();
    return answer != null && (answer.trim().equalsIgnoreCase("y") || answer.trim().equalsIgnoreCase("yes"));
  }

  private void printHeader(Path input, AppConfig cfg) {
    out.println("Chapter Splitter");
    out.println("File: " + input);
    out.println("Strategy: " + cfg.detection.strategy);
    out.println("Sensitivity: " + cfg.detection.sensitivity);
    out.println("Level: " + cfg.detection.level);
    out.println();
  }

  private void printChapters(DetectionResult result) {
    out.println();
    out.println(String.format("%-4s %-50s %-24s %5s  %-10s %10s",
        "#", "Title", "Location", "Level", "Method", "Confidence"));
    List<Chapter> chapters = result.chapters();
    for (int i = 0; i < chapters.size(); i++) {
      Chapter c = chapters.get(i);
      out.println(String.format(Locale.ROOT, "%-4d %-50s %-24s %5d  %-10s %9.0f%%",
          i + 1, truncate(c.title()), location(c), c.level(), c.method().label(), c.confidence() * 100));
    }
  }

  private static String location(Chapter chapter) {
    if (chapter.position() instanceof UnitPosition unit) {
      String name = unit.path().substring(unit.path().lastIndexOf('/') + 1);
      return unit.hasFragment() ? name + "#" + unit.fragment() : name;
    }
    String pages = chapter.start() + "-" + chapter.end();
    return pages + " (" + chapter.pageCount() + (chapter.pageCount() == 1 ? " page)" : " pages)");
  }

  private static String truncate(String title) {
    if (title.length() <= MAX_TITLE_WIDTH) {
      return title;
    }
    return title.substring(0, MAX_TITLE_WIDTH - 3) + "...";
  }

  private void printUsage() {
    out.println("Usage:");
    out.println("  chapter-splitter preview <file> [--strategy s] [--sensitivity s] [--level n] [--config path]");
    out.println("  chapter-splitter split <file> [-o dir] [--strategy s] [--sensitivity s] [--level n]");
    out.println("                         [--pattern p] [--no-metadata] [--format pdf|epub] [--yes] [--config path]");
    out.println();
    out.println("Strategies: hybrid (default), native, structural, manifest; bookmarks and heuristic are aliases");
    out.println("Pattern placeholders: {index}, {index:02d}, {title}, {start}, {end}, {pages}, {file}");
  }
}
