package com.shelfmark.app.inventory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.database.CatalogStore;
import com.shelfmark.app.database.Entry;

/**
 * Main-pass visitor: adds unseen files, re-hashes stale ones, skips the rest.
 * Hashing failures are counted and never stop the run; catalog failures propagate.
 */
final class IndexingVisitor implements FileVisitor {

    private static final Logger logger = LoggerFactory.getLogger(IndexingVisitor.class);

    private final CatalogStore store;
    private final ContentHasher hasher;
    private final Path root;
    private final long nowSeconds;
    private final IndexMetrics metrics;

    IndexingVisitor(CatalogStore store, ContentHasher hasher, Path root, long nowSeconds, IndexMetrics metrics) {
        this.store = store;
        this.hasher = hasher;
        this.root = root;
        this.nowSeconds = nowSeconds;
        this.metrics = metrics;
    }

    @Override
    public void visitFile(Path file, BasicFileAttributes attrs) {
        String key = Entry.logicalPath(root, file);
        long modified = attrs.lastModifiedTime().to(TimeUnit.SECONDS);

        Optional<Entry> found = store.getEntry(key);
        if (found.isEmpty()) {
            if (write(file, attrs.size(), modified)) metrics.added.increment();
            return;
        }

        if (found.get().isStale(modified)) {
            logger.debug("File changed since last indexing: {}", key);
            if (write(file, attrs.size(), modified)) metrics.updated.increment();
        } else {
            metrics.skipped.increment();
        }
    }

    private boolean write(Path file, long size, long modified) {
        long startNs = System.nanoTime();
        String signature;
        try {
            signature = hasher.hash(file);
        } catch (IOException e) {
            logger.warn("Error occurred during processing {}: {}", file, e.toString());
            metrics.errors.increment();
            return false;
        }

        Entry entry = Entry.of(root, file, signature, size, modified, nowSeconds);
        if (logger.isDebugEnabled()) {
            long micros = Math.max(1, TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - startNs));
            logger.debug("Hashed {} in {} ms @ {} MB/s", entry.path(), micros / 1000, throughput(size, micros));
        }
        store.upsertEntry(entry);
        return true;
    }

    static String throughput(long bytes, long micros) {
        return String.format(Locale.ROOT, "%.2f", (double) bytes / Math.max(1, micros));
    }
}
