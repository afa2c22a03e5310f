package com.platform.inventory.reconciliation;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag for one reconciliation pass.
 * Checked before the remote listing and before each orphan's transaction.
 */
public final class CancellationToken {
    
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
    
    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Reconciliation cancelled");
        }
    }
}
