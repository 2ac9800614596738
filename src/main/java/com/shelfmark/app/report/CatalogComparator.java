package com.shelfmark.app.report;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.database.CatalogSide;
import com.shelfmark.app.database.CatalogStore;
import com.shelfmark.app.database.CatalogStore.CatalogMetadata;
import com.shelfmark.app.database.CatalogStore.DifferingEntry;
import com.shelfmark.app.database.CatalogStore.MissingPaths;

/**
 * Compares two catalogs by logical path. Neither catalog is modified.
 */
public final class CatalogComparator {

    private static final Logger logger = LoggerFactory.getLogger(CatalogComparator.class);

    public record ComparisonReport(String firstRoot, String secondRoot,
                                   long firstCount, long secondCount,
                                   List<String> missingInFirst, List<String> missingInSecond,
                                   List<DifferingEntry> differing) {

        public boolean identical() {
            return missingInFirst.isEmpty() && missingInSecond.isEmpty() && differing.isEmpty();
        }
    }

    public ComparisonReport compare(Path firstCatalog, Path secondCatalog) {
        try (CatalogStore store = CatalogStore.openExisting(firstCatalog)) {
            store.bindSecondary(secondCatalog);

            long firstCount = store.countEntries(CatalogSide.PRIMARY);
            long secondCount = store.countEntries(CatalogSide.SECONDARY);
            MissingPaths missing = store.findMissing();
            List<DifferingEntry> differing = store.compareDiffering();

            ComparisonReport report = new ComparisonReport(
                    rootOf(store, CatalogSide.PRIMARY),
                    rootOf(store, CatalogSide.SECONDARY),
                    firstCount,
                    secondCount,
                    missing.missingInPrimary(),
                    missing.missingInSecondary(),
                    differing
            );
            logger.info("[COMPARE] {} vs {}: {} missing in first, {} missing in second, {} differing",
                    firstCatalog, secondCatalog,
                    report.missingInFirst().size(), report.missingInSecond().size(), differing.size());
            return report;
        }
    }

    private static String rootOf(CatalogStore store, CatalogSide side) {
        return store.getMetadata(side).map(CatalogMetadata::path).orElse("");
    }
}
