package com.shelfmark.app.inventory;

import java.util.concurrent.atomic.LongAdder;

/**
 * Outcome counters of one indexing run. Safe to increment from several threads.
 */
public final class IndexMetrics {
    public final LongAdder added = new LongAdder();
    public final LongAdder updated = new LongAdder();
    public final LongAdder skipped = new LongAdder();
    public final LongAdder errors = new LongAdder();
}
