package com.shelfmark.app.cli;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.database.CatalogException;
import com.shelfmark.app.database.CatalogStore.DifferingEntry;
import com.shelfmark.app.database.Entry;
import com.shelfmark.app.inventory.IndexOptions;
import com.shelfmark.app.inventory.IndexSummary;
import com.shelfmark.app.inventory.Indexer;
import com.shelfmark.app.report.CatalogComparator;
import com.shelfmark.app.report.CatalogComparator.ComparisonReport;
import com.shelfmark.app.report.CatalogStats;
import com.shelfmark.app.report.CatalogStats.StatsReport;
import com.shelfmark.app.report.DuplicateFinder;
import com.shelfmark.app.report.DuplicateFinder.DuplicateReport;

public final class Cli {

    private static final Logger logger = LoggerFactory.getLogger(Cli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    public Cli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void run(String[] args) {
        int exitCode = new Cli(System.out, System.err).execute(args);
        if (exitCode != EXIT_OK) System.exit(exitCode);
    }

    public int execute(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return EXIT_OK;
        }

        String cmd = safeLower(args[0]);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        try {
            return switch (cmd) {
                case "index" -> runIndex(rest);
                case "compare" -> runCompare(rest);
                case "dupes", "dupe" -> runDupes(rest);
                case "stats" -> runStats(rest);
                case "help", "-h", "--help" -> {
                    printUsage();
                    yield EXIT_OK;
                }
                default -> {
                    err.println("Unknown command: " + args[0]);
                    printUsage();
                    yield EXIT_USAGE;
                }
            };
        } catch (CatalogException e) {
            logger.error("Fatal {} error", e.kind(), e);
            err.println("Fatal error: " + safeMsg(e));
            return EXIT_FATAL;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure", e);
            err.println("Fatal error: " + safeMsg(e));
            return EXIT_FATAL;
        }
    }

    // ----------------- index -----------------

    private int runIndex(String[] args) {
        ParseResult<IndexArgs> parsed = IndexArgs.parse(args, IndexOptions.defaults());
        if (parsed.help()) {
            printIndexUsage();
            return EXIT_OK;
        }
        if (parsed.error() != null) {
            err.println(parsed.error());
            printIndexUsage();
            return EXIT_USAGE;
        }

        IndexArgs a = parsed.value();
        IndexSummary summary = new Indexer().index(Path.of(a.output()), Path.of(a.root()), a.options());

        switch (summary.outcome()) {
            case TIMED_OUT -> out.println("Processing duration reached; stopped early.");
            case FAILED -> err.println("Error occurred during processing.");
            default -> { }
        }
        out.println(summary.describe());
        return EXIT_OK;
    }

    // ----------------- compare -----------------

    private int runCompare(String[] args) {
        List<String> positional = positional(args, 2, "compare <FIRST> <SECOND>");
        if (positional == null) return EXIT_USAGE;

        ComparisonReport report = new CatalogComparator().compare(Path.of(positional.get(0)), Path.of(positional.get(1)));

        out.println("Files in first: " + report.firstCount());
        out.println("Files in second: " + report.secondCount());
        out.println("Missing in first (" + report.firstRoot() + "): " + report.missingInFirst());
        out.println("Missing in second (" + report.secondRoot() + "): " + report.missingInSecond());
        out.println("Differences:");
        for (DifferingEntry d : report.differing()) {
            out.printf("%s | %s %s %d | %s %s %d%n",
                    d.path(),
                    d.primaryAbspath(), d.primarySignature(), d.primaryTimestamp(),
                    d.secondaryAbspath(), d.secondarySignature(), d.secondaryTimestamp());
        }
        out.println("OK");
        return EXIT_OK;
    }

    // ----------------- dupes -----------------

    private int runDupes(String[] args) {
        List<String> positional = positional(args, 1, "dupes <CATALOG>");
        if (positional == null) return EXIT_USAGE;

        DuplicateReport report = new DuplicateFinder().find(Path.of(positional.get(0)));
        if (report.groupCount() == 0) {
            out.println("No duplicates found.");
            return EXIT_OK;
        }

        for (Map.Entry<String, List<Entry>> group : report.groups().entrySet()) {
            List<Entry> members = group.getValue();
            out.println(group.getKey() + " (" + members.size() + " files, " + members.get(0).size() + " B each)");
            for (Entry e : members) {
                out.println("  " + e.abspath());
            }
        }
        out.println("Groups: " + report.groupCount()
                + ", files: " + report.duplicateFileCount()
                + ", reclaimable: " + report.reclaimableBytes() + " B");
        return EXIT_OK;
    }

    // ----------------- stats -----------------

    private int runStats(String[] args) {
        List<String> positional = positional(args, 1, "stats <CATALOG>");
        if (positional == null) return EXIT_USAGE;

        StatsReport stats = new CatalogStats().compute(Path.of(positional.get(0)));
        out.println("Entries in file: " + stats.entries());
        out.println("Total indexed file size: " + stats.totalSize() + " B (" + stats.totalSize() / 1_000_000 + " MB)");
        out.printf(Locale.ROOT, "Average file size: %.1f B (%.3f MB)%n", stats.averageSize(), stats.averageSize() / 1e6);
        return EXIT_OK;
    }

    // ----------------- usage -----------------

    private void printUsage() {
        out.println("""
                Shelfmark
                Commands:
                  index [-c|--skip-delete-check] [-d|--duration <seconds>] [-s|--no-sync] <ROOT_DIR> <OUTPUT_FILE>
                  compare <FIRST> <SECOND>
                  dupes <CATALOG>
                  stats <CATALOG>
                  help
                """);
    }

    private void printIndexUsage() {
        out.println("""
                Usage:
                  index [-c|--skip-delete-check] [-d|--duration <seconds>] [-s|--no-sync] <ROOT_DIR> <OUTPUT_FILE>

                  -c, --skip-delete-check  keep rows for files that no longer exist
                  -d, --duration           stop processing after N seconds
                  -s, --no-sync            disable synchronous catalog writes
                """);
    }

    // ----------------- parsing -----------------

    private List<String> positional(String[] args, int expected, String usage) {
        List<String> values = new ArrayList<>();
        for (String a : args) {
            if (a.startsWith("-")) {
                err.println("Invalid option: " + a);
                out.println("Usage: " + usage);
                return null;
            }
            values.add(a);
        }
        if (values.size() != expected) {
            err.println("Expected " + expected + " argument(s)");
            out.println("Usage: " + usage);
            return null;
        }
        return values;
    }

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new IllegalArgumentException("Missing value for " + opt);
            return next();
        }
    }

    record ParseResult<T>(T value, boolean help, String error) {
        static <T> ParseResult<T> okResult(T v) { return new ParseResult<>(v, false, null); }
        static <T> ParseResult<T> helpResult() { return new ParseResult<>(null, true, null); }
        static <T> ParseResult<T> errorResult(String e) { return new ParseResult<>(null, false, e); }
    }

    record IndexArgs(String root, String output, IndexOptions options) {
        static ParseResult<IndexArgs> parse(String[] args, IndexOptions defaults) {
            boolean skipDeleteCheck = defaults.skipDeleteCheck();
            OptionalLong duration = defaults.durationSeconds();
            boolean noSync = defaults.disableSync();
            List<String> positional = new ArrayList<>();

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "-c", "--skip-delete-check" -> skipDeleteCheck = true;
                        case "-s", "--no-sync" -> noSync = true;
                        case "-d", "--duration" -> {
                            long seconds = Long.parseLong(c.requireNext(t).trim());
                            if (seconds < 0) return ParseResult.errorResult("Duration must not be negative");
                            duration = OptionalLong.of(seconds);
                        }
                        default -> {
                            if (t.startsWith("-")) return ParseResult.errorResult("Invalid option: " + t);
                            positional.add(t);
                        }
                    }
                }
            } catch (NumberFormatException e) {
                return ParseResult.errorResult("Invalid value for --duration");
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }

            if (positional.size() != 2) {
                return ParseResult.errorResult("Required arguments: <ROOT_DIR> <OUTPUT_FILE>");
            }
            return ParseResult.okResult(new IndexArgs(positional.get(0), positional.get(1),
                    new IndexOptions(skipDeleteCheck, duration, noSync)));
        }
    }

    // ----------------- misc -----------------

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return (m == null || m.isBlank())
                ? (t == null ? "Error" : t.getClass().getSimpleName())
                : m;
    }
}
