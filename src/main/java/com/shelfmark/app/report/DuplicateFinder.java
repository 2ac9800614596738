package com.shelfmark.app.report;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.database.CatalogStore;
import com.shelfmark.app.database.Entry;

/**
 * Groups a catalog's entries by content signature.
 */
public final class DuplicateFinder {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateFinder.class);

    /**
     * @param groups signature to members, signatures ascending, each group holding two or more entries
     */
    public record DuplicateReport(Map<String, List<Entry>> groups) {

        public int groupCount() {
            return groups.size();
        }

        public long duplicateFileCount() {
            return groups.values().stream().mapToLong(List::size).sum();
        }

        /**
         * Bytes freed by keeping a single copy of every group.
         */
        public long reclaimableBytes() {
            long total = 0;
            for (List<Entry> members : groups.values()) {
                total += members.get(0).size() * (members.size() - 1L);
            }
            return total;
        }
    }

    public DuplicateReport find(Path catalog) {
        try (CatalogStore store = CatalogStore.openExisting(catalog)) {
            DuplicateReport report = new DuplicateReport(store.findDuplicates());
            logger.info("[DUPES] {}: {} groups, {} files", catalog, report.groupCount(), report.duplicateFileCount());
            return report;
        }
    }
}
