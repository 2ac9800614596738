package com.shelfmark.app.inventory;

/**
 * A traversal stopped before reaching every file. Files already handed to the
 * visitor stay processed.
 */
public class TraversalException extends Exception {

    public TraversalException(String message) {
        super(message);
    }

    public TraversalException(String message, Throwable cause) {
        super(message, cause);
    }
}
