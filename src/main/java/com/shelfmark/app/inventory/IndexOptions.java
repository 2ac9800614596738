package com.shelfmark.app.inventory;

import java.util.OptionalLong;

import com.shelfmark.app.config.Config;

/**
 * Per-run indexing switches.
 *
 * @param skipDeleteCheck skip the deletion sweep; stale rows for removed files remain
 * @param durationSeconds soft time budget for the main traversal, empty for unbounded
 * @param disableSync     turn off synchronous writes, trading durability for throughput
 */
public record IndexOptions(boolean skipDeleteCheck, OptionalLong durationSeconds, boolean disableSync) {

    public IndexOptions {
        if (durationSeconds == null) durationSeconds = OptionalLong.empty();
        if (durationSeconds.isPresent() && durationSeconds.getAsLong() < 0) {
            throw new IllegalArgumentException("durationSeconds must not be negative: " + durationSeconds.getAsLong());
        }
    }

    public static IndexOptions defaults() {
        return new IndexOptions(
                Config.isSkipDeleteCheckDefault(),
                Config.getIndexDurationSeconds(),
                Config.isDisableSyncDefault()
        );
    }
}
