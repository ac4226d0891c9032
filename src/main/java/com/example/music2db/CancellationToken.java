package com.example.music2db;

public final class CancellationToken {
    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    /**
     * Token that is never cancelled, for one-off runs and tests.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }
}
