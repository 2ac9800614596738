package com.shelfmark.app.report;

import java.nio.file.Path;

import com.shelfmark.app.database.CatalogSide;
import com.shelfmark.app.database.CatalogStore;

public final class CatalogStats {

    public record StatsReport(long entries, long totalSize, double averageSize) {}

    public StatsReport compute(Path catalog) {
        try (CatalogStore store = CatalogStore.openExisting(catalog)) {
            long entries = store.countEntries(CatalogSide.PRIMARY);
            long totalSize = store.totalSize();
            double average = entries == 0 ? 0d : (double) totalSize / entries;
            return new StatsReport(entries, totalSize, average);
        }
    }
}
