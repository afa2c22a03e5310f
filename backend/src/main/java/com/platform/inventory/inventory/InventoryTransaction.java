package com.platform.inventory.inventory;

import com.platform.inventory.model.LocalInstance;

/**
 * Operations available inside one per-orphan transaction.
 * Everything done through a handle commits or rolls back together.
 */
public interface InventoryTransaction {
    
    /**
     * Number of port mappings owned by the instance.
     */
    long countPortMappings(long instanceId);
    
    /**
     * Delete every port mapping owned by the instance.
     * A failure here leaves the transaction usable.
     *
     * @return rows deleted, possibly zero
     */
    int deletePortMappings(long instanceId);
    
    /**
     * Mark the instance row deleted so it drops out of non-terminal queries.
     *
     * @throws com.platform.inventory.error.OrphanCleanupException if no live row was updated
     */
    void softDeleteInstance(LocalInstance instance);
}
