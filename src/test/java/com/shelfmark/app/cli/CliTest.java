package com.shelfmark.app.cli;

import com.shelfmark.app.inventory.IndexOptions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

public class CliTest {

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final Cli cli = new Cli(
            new PrintStream(outBytes, true, StandardCharsets.UTF_8),
            new PrintStream(errBytes, true, StandardCharsets.UTF_8));

    private String out() { return outBytes.toString(StandardCharsets.UTF_8); }

    private String err() { return errBytes.toString(StandardCharsets.UTF_8); }

    private static final IndexOptions NO_DEFAULTS = new IndexOptions(false, OptionalLong.empty(), false);

    @Test
    void noArgumentsPrintsUsage() {
        assertEquals(Cli.EXIT_OK, cli.execute(new String[0]));
        assertTrue(out().contains("Commands:"));
    }

    @Test
    void unknownCommandIsUsageError() {
        assertEquals(Cli.EXIT_USAGE, cli.execute(new String[]{"frobnicate"}));
        assertTrue(err().contains("Unknown command"));
    }

    @Test
    void indexThenStatsThenDupes() throws Exception {
        Path root = Files.createTempDirectory("shelfmark-cli-");
        Files.writeString(root.resolve("a.txt"), "same", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("b.txt"), "different", StandardCharsets.UTF_8);
        Path catalog = Files.createTempDirectory("shelfmark-cli-").resolve("catalog.db");

        assertEquals(Cli.EXIT_OK, cli.execute(new String[]{"index", root.toString(), catalog.toString()}));
        assertTrue(out().contains("Added: 2, Updated: 0, Deleted: 0, Skipped: 0, Errors: 0."), out());

        assertEquals(Cli.EXIT_OK, cli.execute(new String[]{"stats", catalog.toString()}));
        assertTrue(out().contains("Entries in file: 2"), out());
        assertTrue(out().contains("Total indexed file size: 13 B"), out());

        assertEquals(Cli.EXIT_OK, cli.execute(new String[]{"dupes", catalog.toString()}));
        assertTrue(out().contains("No duplicates found."), out());
    }

    @Test
    void compareReportsMissingSides() throws Exception {
        Path rootA = Files.createTempDirectory("shelfmark-cli-");
        Path rootB = Files.createTempDirectory("shelfmark-cli-");
        Files.writeString(rootA.resolve("only-a.txt"), "a", StandardCharsets.UTF_8);
        Files.writeString(rootB.resolve("only-b.txt"), "b", StandardCharsets.UTF_8);
        Path first = Files.createTempDirectory("shelfmark-cli-").resolve("a.db");
        Path second = Files.createTempDirectory("shelfmark-cli-").resolve("b.db");

        assertEquals(Cli.EXIT_OK, cli.execute(new String[]{"index", "-c", rootA.toString(), first.toString()}));
        assertEquals(Cli.EXIT_OK, cli.execute(new String[]{"index", rootB.toString(), second.toString()}));
        assertTrue(out().contains("Deleted: -1"), "Skipped sweep is reported as -1");

        assertEquals(Cli.EXIT_OK, cli.execute(new String[]{"compare", first.toString(), second.toString()}));
        assertTrue(out().contains("[only-b.txt]"), out());
        assertTrue(out().contains("[only-a.txt]"), out());
        assertTrue(out().contains("OK"));
    }

    @Test
    void missingRootIsFatal() throws Exception {
        Path base = Files.createTempDirectory("shelfmark-cli-");
        int code = cli.execute(new String[]{"index", base.resolve("absent").toString(), base.resolve("c.db").toString()});

        assertEquals(Cli.EXIT_FATAL, code);
        assertTrue(err().contains("does not exist"), err());
    }

    @Test
    void missingCatalogIsFatal() throws Exception {
        Path absent = Files.createTempDirectory("shelfmark-cli-").resolve("absent.db");
        assertEquals(Cli.EXIT_FATAL, cli.execute(new String[]{"stats", absent.toString()}));
    }

    @Test
    void wrongArityIsUsageError() {
        assertEquals(Cli.EXIT_USAGE, cli.execute(new String[]{"index", "only-one"}));
        assertEquals(Cli.EXIT_USAGE, cli.execute(new String[]{"compare", "one"}));
        assertEquals(Cli.EXIT_USAGE, cli.execute(new String[]{"dupes", "--verbose", "x.db"}));
    }

    @Test
    void indexArgsParseFlags() {
        Cli.ParseResult<Cli.IndexArgs> parsed = Cli.IndexArgs.parse(
                new String[]{"-c", "--duration", "5", "-s", "/data", "/tmp/out.db"}, NO_DEFAULTS);

        assertNull(parsed.error());
        Cli.IndexArgs a = parsed.value();
        assertEquals("/data", a.root());
        assertEquals("/tmp/out.db", a.output());
        assertTrue(a.options().skipDeleteCheck());
        assertTrue(a.options().disableSync());
        assertEquals(OptionalLong.of(5), a.options().durationSeconds());
    }

    @Test
    void indexArgsRejectBadDuration() {
        assertNotNull(Cli.IndexArgs.parse(new String[]{"-d", "soon", "r", "o"}, NO_DEFAULTS).error());
        assertNotNull(Cli.IndexArgs.parse(new String[]{"-d", "-3", "r", "o"}, NO_DEFAULTS).error());
        assertNotNull(Cli.IndexArgs.parse(new String[]{"r", "o", "-d"}, NO_DEFAULTS).error());
        assertTrue(Cli.IndexArgs.parse(new String[]{"--help"}, NO_DEFAULTS).help());
    }

    @Test
    void entryPointLivesOnlyInMain() throws Exception {
        assertThrows(NoSuchMethodException.class, () -> Cli.class.getDeclaredMethod("main", String[].class),
                "The jar has a single entry point");
        assertNotNull(com.shelfmark.app.Main.class.getDeclaredMethod("main", String[].class));
    }
}
