package com.shelfmark.app.database;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * One indexed file: identity, content signature, size and timestamps.
 *
 * @param path      logical path relative to the catalog root, always '/'-separated
 * @param abspath   absolute path at the time the row was written
 * @param basename  file name
 * @param dirname   absolute parent directory
 * @param signature lowercase hex SHA-256 of the content
 * @param size      size in bytes
 * @param timestamp file modification time, unix seconds
 * @param updated   unix seconds of the indexing run that last wrote this row
 */
public record Entry(String path, String abspath, String basename, String dirname, String signature,
                    long size, long timestamp, long updated) {

    public static Entry of(Path root, Path file, String signature, long size, long modifiedSeconds, long nowSeconds) {
        Path abs = file.toAbsolutePath().normalize();
        Path parent = abs.getParent();
        return new Entry(
                logicalPath(root, abs),
                abs.toString(),
                abs.getFileName().toString(),
                parent == null ? "" : parent.toString(),
                signature,
                size,
                modifiedSeconds,
                nowSeconds
        );
    }

    /**
     * True when the file changed after this row was last written.
     * Equal timestamps count as current.
     */
    public boolean isStale(long fileModifiedSeconds) {
        return updated < fileModifiedSeconds;
    }

    public static String logicalPath(Path root, Path file) {
        Path rel = root.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize());
        return rel.toString().replace('\\', '/');
    }

    public static final class EntryMapper implements RowMapper<Entry> {
        @Override
        public Entry map(ResultSet rs, StatementContext ctx) throws SQLException {
            return new Entry(
                    rs.getString("path"),
                    rs.getString("abspath"),
                    rs.getString("basename"),
                    rs.getString("dirname"),
                    rs.getString("signature"),
                    rs.getLong("size"),
                    rs.getLong("timestamp"),
                    rs.getLong("updated")
            );
        }
    }
}
