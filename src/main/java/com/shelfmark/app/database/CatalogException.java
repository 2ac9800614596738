package com.shelfmark.app.database;

/**
 * Unrecoverable catalog failure. The process is expected to stop after
 * reporting it; a catalog is never left half-written by continuing.
 */
public class CatalogException extends RuntimeException {

    public enum Kind {
        /** Missing or non-directory root, root mismatch, attach failure, missing catalog file. */
        CONFIGURATION,
        /** A mutating statement touched an unexpected number of rows. */
        INVARIANT,
        /** DDL or query failure reported by the database. */
        STORAGE
    }

    private final Kind kind;

    public CatalogException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CatalogException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
