package com.platform.inventory.error;

/**
 * Removal of a single orphaned instance failed and its transaction was rolled back.
 * Never escapes the cleanup batch.
 */
public class OrphanCleanupException extends InventoryException {
    
    private final long instanceId;
    private final String instanceName;
    
    public OrphanCleanupException(long instanceId, String instanceName, String message) {
        super(ErrorCode.ORPHAN_CLEANUP_FAILED, message);
        this.instanceId = instanceId;
        this.instanceName = instanceName;
    }
    
    public long getInstanceId() {
        return instanceId;
    }
    
    public String getInstanceName() {
        return instanceName;
    }
}
