package com.purchasingpower.codegraph.sync;

/**
 * Cooperative cancellation signal, checked between files.
 */
public class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
