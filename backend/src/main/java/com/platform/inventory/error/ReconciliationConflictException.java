package com.platform.inventory.error;

/**
 * A pass for the provider is already running. Passes for one provider must not overlap.
 */
public class ReconciliationConflictException extends InventoryException {
    
    private final long providerId;
    private final String runningJobId;
    
    public ReconciliationConflictException(long providerId, String runningJobId) {
        super(ErrorCode.RECONCILIATION_IN_PROGRESS,
            String.format("Reconciliation already running for provider %d (job %s)", providerId, runningJobId));
        this.providerId = providerId;
        this.runningJobId = runningJobId;
    }
    
    public long getProviderId() {
        return providerId;
    }
    
    public String getRunningJobId() {
        return runningJobId;
    }
}
