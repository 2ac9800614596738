package com.shelfmark.app.database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.extension.ExtensionCallback;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.config.Config;
import com.shelfmark.app.database.CatalogException.Kind;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Handle over one catalog file.
 * <p>
 * The pool is pinned to a single SQLite connection that lives as long as the
 * handle, so per-connection state ({@code PRAGMA synchronous}, the attached
 * secondary catalog) holds for every query issued through this store. A
 * handle drives at most one writer; callers serialize access.
 */
public final class CatalogStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CatalogStore.class);

    public record CatalogMetadata(String path, long lastUpdated) {}

    public record MissingPaths(List<String> missingInPrimary, List<String> missingInSecondary) {}

    public record DifferingEntry(String path,
                                 String primaryAbspath, String primarySignature, long primaryTimestamp,
                                 String secondaryAbspath, String secondarySignature, long secondaryTimestamp) {}

    private final Path file;
    private final String jdbcUrl;
    private final HikariDataSource dataSource;
    private final Jdbi jdbi;
    private volatile Path secondary;

    private CatalogStore(Path file) {
        this.file = file;
        this.jdbcUrl = "jdbc:sqlite:" + file;
        this.dataSource = createDataSource(file, jdbcUrl);
        this.jdbi = Jdbi.create(dataSource);
        this.jdbi.installPlugin(new SqlObjectPlugin());
    }

    /**
     * Opens a catalog for indexing, creating the file (and its parent directories) if needed.
     */
    public static CatalogStore open(Path file) {
        Path abs = file.toAbsolutePath().normalize();
        try {
            Path parent = abs.getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new CatalogException(Kind.CONFIGURATION, "Could not create directory for catalog " + abs, e);
        }
        return new CatalogStore(abs);
    }

    /**
     * Opens a catalog that must already exist; used by the read-only reports.
     */
    public static CatalogStore openExisting(Path file) {
        Path abs = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(abs)) {
            throw new CatalogException(Kind.CONFIGURATION, "Catalog file does not exist: " + abs);
        }
        return new CatalogStore(abs);
    }

    private static HikariDataSource createDataSource(Path file, String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setPoolName("shelfmark-" + file.getFileName());
        config.setConnectionTestQuery("SELECT 1");
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(1);
        // never recycle the connection: PRAGMA and ATTACH state live on it
        config.setMaxLifetime(0);
        config.setIdleTimeout(0);
        config.addDataSourceProperty("busy_timeout", String.valueOf(Config.getBusyTimeoutMillis()));

        try {
            return new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new CatalogException(Kind.STORAGE, "Could not open catalog " + file, e);
        }
    }

    public Path file() {
        return file;
    }

    // --- Lifecycle -----------------------------------------------------------

    /**
     * Creates the schema if absent and binds the catalog to {@code root}.
     * A catalog built for another root is rejected.
     */
    public void initialize(String root, long nowSeconds, boolean disableSync) {
        if (disableSync) {
            logger.info("Disabling synchronous writes for {}", file);
            try {
                jdbi.useHandle(h -> h.execute("PRAGMA synchronous = OFF"));
            } catch (JdbiException e) {
                throw new CatalogException(Kind.STORAGE, "Could not set synchronous pragma on " + file, e);
            }
        }

        migrate();

        long rows = withDao("count metadata", CatalogDao::countMetadata);
        if (rows == 0) {
            int inserted = withDao("insert metadata", dao -> dao.insertMetadata(root, nowSeconds));
            if (inserted != 1) {
                throw invariant("Unexpected number of changes when inserting metadata: " + inserted);
            }
        } else if (rows == 1) {
            CatalogMetadata metadata = getMetadata(CatalogSide.PRIMARY)
                    .orElseThrow(() -> invariant("Metadata row vanished from " + file));
            if (!metadata.path().equals(root)) {
                logger.error("Existing catalog {} is for '{}', not '{}'", file, metadata.path(), root);
                throw new CatalogException(Kind.CONFIGURATION,
                        "Existing catalog is for '" + metadata.path() + "', not '" + root + "'");
            }
        } else {
            throw invariant("Catalog " + file + " holds " + rows + " metadata rows");
        }

        logger.info("Catalog {} bound to root {}", file, root);
    }

    private void migrate() {
        Flyway flyway = Flyway.configure()
                .dataSource(jdbcUrl, null, null)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load();
        try {
            try {
                flyway.migrate();
            } catch (FlywayValidateException e) {
                logger.warn("Flyway validation failed for {}; attempting repair.", file, e);
                flyway.repair();
                flyway.migrate();
            }
        } catch (FlywayException e) {
            logger.error("Schema creation failed for {}", file, e);
            throw new CatalogException(Kind.STORAGE, "Schema creation failed for " + file, e);
        }
    }

    /**
     * Attaches a second catalog, queried read-only, for the lifetime of this handle.
     */
    public void bindSecondary(Path otherCatalog) {
        Path abs = otherCatalog.toAbsolutePath().normalize();
        if (!Files.isRegularFile(abs)) {
            logger.error("Could not attach catalog {}: file does not exist", abs);
            throw new CatalogException(Kind.CONFIGURATION, "Cannot attach missing catalog " + abs);
        }
        try {
            jdbi.useHandle(h -> h.execute("ATTACH DATABASE ? AS " + CatalogSide.SECONDARY.schema(), abs.toString()));
        } catch (JdbiException e) {
            logger.error("Could not attach catalog {}", abs, e);
            throw new CatalogException(Kind.CONFIGURATION, "Could not attach catalog " + abs, e);
        }
        secondary = abs;
    }

    @Override
    public void close() {
        dataSource.close();
    }

    // --- Entries -------------------------------------------------------------

    public void upsertEntry(Entry entry) {
        int changed = withDao("upsert entry " + entry.path(), dao -> dao.upsertEntry(entry));
        if (changed != 1) {
            throw invariant("Unexpected number of changes when upserting " + entry.path() + ": " + changed);
        }
    }

    /**
     * Looks an entry up by logical path. Empty means not found; any other
     * failure surfaces as a {@link CatalogException}.
     */
    public Optional<Entry> getEntry(String path) {
        return withDao("look up entry " + path, dao -> dao.fetchEntry(path));
    }

    /**
     * Removes exactly one entry. Callers only remove paths they have just read
     * from the catalog, so a miss means the catalog changed underneath them.
     */
    public void removeEntry(String path) {
        int removed = withDao("remove entry " + path, dao -> dao.deleteEntry(path));
        if (removed != 1) {
            throw invariant("Unexpected number of changes when removing " + path + ": " + removed);
        }
    }

    public List<String> listAllPaths() {
        return withDao("list paths", CatalogDao::fetchAllAbspaths);
    }

    public long countEntries(CatalogSide side) {
        if (side == CatalogSide.SECONDARY) requireSecondary();
        return withDao("count entries", dao -> dao.countEntries(side.schema()));
    }

    public long totalSize() {
        return withDao("sum sizes", CatalogDao::sumSize);
    }

    public Optional<CatalogMetadata> getMetadata(CatalogSide side) {
        if (side == CatalogSide.SECONDARY) requireSecondary();
        return withDao("read metadata", dao -> dao.fetchMetadata(side.schema()));
    }

    // --- Queries -------------------------------------------------------------

    public MissingPaths findMissing() {
        requireSecondary();
        List<String> missingInPrimary = withDao("find paths missing in primary", CatalogDao::fetchMissingInPrimary);
        List<String> missingInSecondary = withDao("find paths missing in secondary", CatalogDao::fetchMissingInSecondary);
        return new MissingPaths(missingInPrimary, missingInSecondary);
    }

    public List<DifferingEntry> compareDiffering() {
        requireSecondary();
        return withDao("compare signatures", CatalogDao::fetchDiffering);
    }

    /**
     * Signature groups with at least two members, keyed in ascending signature order.
     */
    public Map<String, List<Entry>> findDuplicates() {
        List<Entry> rows = withDao("find duplicates", CatalogDao::fetchDuplicateEntries);
        Map<String, List<Entry>> groups = new LinkedHashMap<>();
        for (Entry e : rows) {
            groups.computeIfAbsent(e.signature(), k -> new ArrayList<>()).add(e);
        }
        return groups;
    }

    // --- Helpers -------------------------------------------------------------

    private <R> R withDao(String action, ExtensionCallback<R, CatalogDao, RuntimeException> callback) {
        try {
            return jdbi.withExtension(CatalogDao.class, callback);
        } catch (JdbiException | IllegalStateException e) {
            logger.error("Failed to {} in {}", action, file, e);
            throw new CatalogException(Kind.STORAGE, "Failed to " + action + " in " + file, e);
        }
    }

    private void requireSecondary() {
        if (secondary == null) {
            throw new CatalogException(Kind.CONFIGURATION, "No secondary catalog bound to " + file);
        }
    }

    private CatalogException invariant(String message) {
        logger.error(message);
        return new CatalogException(Kind.INVARIANT, message);
    }
}
