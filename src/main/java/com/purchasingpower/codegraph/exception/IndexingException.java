package com.purchasingpower.codegraph.exception;

/**
 * Fatal error that aborts an indexing run.
 *
 * Thrown before any write for environment problems (missing tool binary,
 * unreachable graph store, unreadable project root).
 */
public class IndexingException extends RuntimeException {

    public IndexingException(String message) {
        super(message);
    }

    public IndexingException(String message, Throwable cause) {
        super(message, cause);
    }
}
