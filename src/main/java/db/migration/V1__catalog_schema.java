package db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Catalog schema: singleton metadata row, one row per indexed file and a
 * non-unique signature index for duplicate grouping and comparison joins.
 */
public final class V1__catalog_schema extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();

        // Catalogs written before Flyway bookkeeping already hold these tables; keep it idempotent.
        ensureSchema(conn);
        ensureIndexes(conn);
    }

    private void ensureSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS metadata (
                    path         TEXT PRIMARY KEY,
                    last_updated INTEGER
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS entries (
                    path      TEXT PRIMARY KEY,
                    abspath   TEXT NOT NULL,
                    basename  TEXT NOT NULL,
                    dirname   TEXT NOT NULL,
                    signature TEXT NOT NULL,
                    size      INTEGER NOT NULL,
                    timestamp INTEGER NOT NULL,
                    updated   INTEGER NOT NULL
                )
                """);
        }
    }

    private void ensureIndexes(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("CREATE INDEX IF NOT EXISTS idx_entries_signature ON entries(signature)");
        }
    }
}
