package com.shelfmark.app.inventory;

import java.time.Instant;

/**
 * The traversal deadline passed. Signals early termination, not a failure.
 */
public class DeadlineExceededException extends TraversalException {

    private final Instant deadline;

    public DeadlineExceededException(Instant deadline) {
        super("Traversal deadline passed at " + deadline);
        this.deadline = deadline;
    }

    public Instant deadline() {
        return deadline;
    }
}
