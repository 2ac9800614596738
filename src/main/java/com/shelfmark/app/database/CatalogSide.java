package com.shelfmark.app.database;

/**
 * Which of the two bound catalogs a query targets.
 */
public enum CatalogSide {
    PRIMARY("main"),
    SECONDARY("second");

    private final String schema;

    CatalogSide(String schema) {
        this.schema = schema;
    }

    String schema() {
        return schema;
    }
}
