package com.citationconstellation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 * citation-constellation [--doi DOI] [--title TITLE] [--author NAME]... [--year YEAR]
 *                        [--max-depth N] SOURCE_DIR...
 * </pre>
 *
 * Each source directory holds the unpacked LaTeX sources of one citing paper. The target paper
 * is described by the options; at least one of them is required.
 */
public class CitationConstellationApp {

    private static final Logger log = LoggerFactory.getLogger(CitationConstellationApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = """
            Usage: citation-constellation [options] SOURCE_DIR...

            Finds where the target paper is cited in each unpacked LaTeX source directory.

            Options:
              --doi DOI        DOI of the target paper
              --title TITLE    title of the target paper
              --author NAME    author of the target paper, first author first (repeatable)
              --year YEAR      publication year of the target paper
              --max-depth N    maximum \\input/\\include nesting (default from configuration)
              -h, --help       show this help
            """;

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CitationConstellationConfig config = CitationConstellationConfig.load();

        String doi = null;
        String title = null;
        String year = null;
        List<String> authors = new ArrayList<>();
        List<Path> sourceDirs = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h", "--help" -> {
                    out.print(USAGE);
                    return EXIT_OK;
                }
                case "--doi", "--title", "--author", "--year", "--max-depth" -> {
                    if (i + 1 >= args.length) {
                        return usageError(err, "Missing value for " + arg);
                    }
                    String value = args[++i];
                    switch (arg) {
                        case "--doi" -> doi = value;
                        case "--title" -> title = value;
                        case "--author" -> authors.add(value);
                        case "--year" -> year = value;
                        default -> {
                            try {
                                config = config.withMaxInclusionDepth(Integer.parseInt(value));
                            } catch (IllegalArgumentException e) {
                                return usageError(err, "Invalid --max-depth: " + value);
                            }
                        }
                    }
                }
                default -> {
                    if (arg.startsWith("--")) {
                        return usageError(err, "Unknown option: " + arg);
                    }
                    sourceDirs.add(Path.of(arg));
                }
            }
        }

        TargetDescriptor target = new TargetDescriptor(doi, title, authors, year);
        if (target.isEmpty()) {
            return usageError(err, "Describe the target paper with at least one of --doi, --title, --author/--year");
        }
        if (sourceDirs.isEmpty()) {
            return usageError(err, "No source directory given");
        }

        List<CitingPaper> papers = new ArrayList<>();
        for (Path dir : sourceDirs) {
            if (Files.isDirectory(dir)) {
                papers.add(CitingPaper.fromSourceDir(dir));
            } else {
                log.warn("Not a directory: {}", dir);
                Path name = dir.getFileName();
                papers.add(new CitingPaper(name == null ? dir.toString() : name.toString(), null, List.of(), null, null));
            }
        }

        List<PaperAnalysis> analyses = new CitationPipeline(config).analyzeAll(papers, target);
        out.println();
        out.println("=== Citation Constellation ===");
        out.println();
        out.print(new ConstellationTreePrinter(config.maxAuthorsShown()).render(target, analyses));
        return EXIT_OK;
    }

    private static int usageError(PrintStream err, String message) {
        err.println(message);
        err.print(USAGE);
        return EXIT_USAGE;
    }
}
