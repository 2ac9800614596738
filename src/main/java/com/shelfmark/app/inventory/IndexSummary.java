package com.shelfmark.app.inventory;

import java.time.Duration;

/**
 * Result of one indexing run. {@code deleted} is -1 when the deletion sweep did not run.
 */
public record IndexSummary(long added, long updated, long deleted, long skipped, long errors,
                           Outcome outcome, Duration elapsed) {

    public enum Outcome {
        COMPLETED,
        /** The deadline passed; counts cover the files reached before it. */
        TIMED_OUT,
        /** A directory could not be read; counts cover the files reached before it. */
        FAILED
    }

    public String describe() {
        return "Added: " + added
                + ", Updated: " + updated
                + ", Deleted: " + deleted
                + ", Skipped: " + skipped
                + ", Errors: " + errors + ".";
    }
}
