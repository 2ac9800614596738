package com.shelfmark.app.inventory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.database.CatalogException;
import com.shelfmark.app.database.CatalogStore;
import com.shelfmark.app.database.Entry;
import com.shelfmark.app.inventory.IndexSummary.Outcome;

/**
 * Brings a catalog in line with a directory tree: sweeps rows whose file is
 * gone, then adds new files, re-hashes changed ones and skips the rest.
 */
public final class Indexer {

    private static final Logger logger = LoggerFactory.getLogger(Indexer.class);

    private final ContentHasher hasher;
    private final Clock clock;
    private final DirectoryReader reader;

    public Indexer() {
        this(new ContentHasher(), Clock.systemUTC());
    }

    public Indexer(ContentHasher hasher, Clock clock) {
        this(hasher, clock, DirectoryReader.DEFAULT);
    }

    Indexer(ContentHasher hasher, Clock clock, DirectoryReader reader) {
        this.hasher = hasher;
        this.clock = clock;
        this.reader = reader;
    }

    /**
     * Runs one indexing pass. Configuration and storage failures raise
     * {@link CatalogException}; a timeout or an unreadable directory ends the
     * run early but still yields a summary.
     */
    public IndexSummary index(Path catalogFile, Path rootDir, IndexOptions options) {
        Path root = verifyRoot(rootDir);

        Instant start = clock.instant();
        long nowSeconds = start.getEpochSecond();

        try (CatalogStore store = CatalogStore.open(catalogFile)) {
            store.initialize(root.toString(), nowSeconds, options.disableSync());

            long deleted;
            if (options.skipDeleteCheck()) {
                logger.info("Skipping removal of deleted files from catalog.");
                deleted = -1;
            } else {
                deleted = removeDeletedFiles(store, root);
            }

            Traversal traversal = options.durationSeconds().isPresent()
                    ? Traversal.withDeadline(clock, Duration.ofSeconds(options.durationSeconds().getAsLong()))
                    : Traversal.unbounded();
            traversal = traversal.readingWith(reader);

            IndexMetrics metrics = new IndexMetrics();
            Outcome outcome = Outcome.COMPLETED;
            try {
                traversal.walk(root, new IndexingVisitor(store, hasher, root, nowSeconds, metrics));
            } catch (DeadlineExceededException e) {
                logger.warn("Indexing stopped at deadline {}; progress so far is kept.", e.deadline());
                outcome = Outcome.TIMED_OUT;
            } catch (TraversalException e) {
                logger.error("Error occurred during processing of {}", root, e);
                outcome = Outcome.FAILED;
            }

            IndexSummary summary = new IndexSummary(
                    metrics.added.sum(),
                    metrics.updated.sum(),
                    deleted,
                    metrics.skipped.sum(),
                    metrics.errors.sum(),
                    outcome,
                    Duration.between(start, clock.instant())
            );
            logger.info("[INDEX] {} {}", root, summary.describe());
            return summary;
        }
    }

    private static Path verifyRoot(Path rootDir) {
        Path root = rootDir.toAbsolutePath().normalize();
        if (!Files.exists(root)) {
            throw new CatalogException(CatalogException.Kind.CONFIGURATION,
                    "Specified root directory does not exist: " + root);
        }
        if (!Files.isDirectory(root)) {
            throw new CatalogException(CatalogException.Kind.CONFIGURATION,
                    "Specified root directory is not a directory: " + root);
        }
        return root;
    }

    /**
     * Removes rows whose file no longer exists under {@code root}.
     * Returns the number removed, or -1 when the tree could not be listed.
     */
    private long removeDeletedFiles(CatalogStore store, Path root) {
        Set<String> inCatalog = new TreeSet<>(store.listAllPaths());

        PathCollector onDisk = new PathCollector();
        try {
            Traversal.unbounded().readingWith(reader).walk(root, onDisk);
        } catch (TraversalException e) {
            // a partial listing would make present files look deleted
            logger.error("Could not list files under {}; skipping deletion sweep.", root, e);
            return -1;
        }

        inCatalog.removeAll(onDisk.paths());

        long removed = 0;
        for (String abspath : inCatalog) {
            String key = Entry.logicalPath(root, Path.of(abspath));
            logger.debug("Removing entry {}", key);
            store.removeEntry(key);
            removed++;
        }
        if (removed > 0) {
            logger.info("Removed {} entries for files that no longer exist.", removed);
        }
        return removed;
    }
}
