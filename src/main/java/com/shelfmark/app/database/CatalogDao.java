package com.shelfmark.app.database;

import java.util.List;
import java.util.Optional;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.customizer.Define;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import com.shelfmark.app.database.CatalogStore.CatalogMetadata;
import com.shelfmark.app.database.CatalogStore.DifferingEntry;

public interface CatalogDao {

    // --- Metadata ------------------------------------------------------------

    @SqlQuery("SELECT COUNT(1) FROM metadata")
    long countMetadata();

    @SqlUpdate("INSERT INTO metadata(path, last_updated) VALUES(:path, :lastUpdated)")
    int insertMetadata(@Bind("path") String path, @Bind("lastUpdated") long lastUpdated);

    @SqlQuery("SELECT path, last_updated AS lastUpdated FROM <schema>.metadata")
    @RegisterConstructorMapper(CatalogMetadata.class)
    Optional<CatalogMetadata> fetchMetadata(@Define("schema") String schema);

    // --- Entries -------------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO entries
            (path, abspath, basename, dirname, signature, size, timestamp, updated)
        VALUES
            (:path, :abspath, :basename, :dirname, :signature, :size, :timestamp, :updated)
        ON CONFLICT(path) DO UPDATE SET
            abspath   = excluded.abspath,
            basename  = excluded.basename,
            dirname   = excluded.dirname,
            signature = excluded.signature,
            size      = excluded.size,
            timestamp = excluded.timestamp,
            updated   = excluded.updated
        """)
    int upsertEntry(@BindMethods Entry entry);

    @SqlQuery("""
        SELECT path, abspath, basename, dirname, signature, size, timestamp, updated
          FROM entries
         WHERE path = :path
        """)
    @RegisterRowMapper(Entry.EntryMapper.class)
    Optional<Entry> fetchEntry(@Bind("path") String path);

    @SqlUpdate("DELETE FROM entries WHERE path = :path")
    int deleteEntry(@Bind("path") String path);

    @SqlQuery("SELECT abspath FROM entries")
    List<String> fetchAllAbspaths();

    @SqlQuery("SELECT COUNT(1) FROM <schema>.entries")
    long countEntries(@Define("schema") String schema);

    @SqlQuery("SELECT COALESCE(SUM(size), 0) FROM entries")
    long sumSize();

    // --- Two-catalog queries -------------------------------------------------

    @SqlQuery("""
        SELECT s.path
          FROM second.entries s
          LEFT JOIN main.entries m ON m.path = s.path
         WHERE m.path IS NULL
         ORDER BY s.path
        """)
    List<String> fetchMissingInPrimary();

    @SqlQuery("""
        SELECT m.path
          FROM main.entries m
          LEFT JOIN second.entries s ON s.path = m.path
         WHERE s.path IS NULL
         ORDER BY m.path
        """)
    List<String> fetchMissingInSecondary();

    @SqlQuery("""
        SELECT m.path      AS path,
               m.abspath   AS primaryAbspath,
               m.signature AS primarySignature,
               m.timestamp AS primaryTimestamp,
               s.abspath   AS secondaryAbspath,
               s.signature AS secondarySignature,
               s.timestamp AS secondaryTimestamp
          FROM main.entries m
          JOIN second.entries s ON s.path = m.path
         WHERE m.signature != s.signature
         ORDER BY m.path
        """)
    @RegisterConstructorMapper(DifferingEntry.class)
    List<DifferingEntry> fetchDiffering();

    // --- Duplicates ----------------------------------------------------------

    /**
     * Every entry whose signature occurs more than once, ordered by signature
     * and then by rowid so members keep their scan order.
     */
    @SqlQuery("""
        SELECT path, abspath, basename, dirname, signature, size, timestamp, updated
          FROM entries
         WHERE signature IN (
                SELECT signature
                  FROM entries
                 GROUP BY signature
                HAVING COUNT(*) > 1
               )
         ORDER BY signature, rowid
        """)
    @RegisterRowMapper(Entry.EntryMapper.class)
    List<Entry> fetchDuplicateEntries();
}
