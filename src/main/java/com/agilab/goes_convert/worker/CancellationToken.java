package com.agilab.goes_convert.worker;

/**
 * Cooperative stop flag. Set once from any thread, polled by the owning worker between stages.
 */
public final class CancellationToken {

    private volatile boolean cancellationRequested;

    public void cancel() {
        cancellationRequested = true;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested;
    }
}
