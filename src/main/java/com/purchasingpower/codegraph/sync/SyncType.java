package com.purchasingpower.codegraph.sync;

/**
 * Outcome category of an indexing run.
 */
public enum SyncType {
    /**
     * Nothing was persisted for the service before this run.
     */
    INITIAL_FULL_INDEX,

    /**
     * Every file re-extracted on request, regardless of its hash.
     */
    FORCED_FULL_INDEX,

    /**
     * Only changed, new or deleted files were touched.
     */
    INCREMENTAL,

    /**
     * No file changed since the previous run; nothing was written.
     */
    NO_CHANGES,

    /**
     * The run stopped early on a cancellation signal.
     */
    CANCELLED
}
