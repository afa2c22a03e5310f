package com.platform.inventory.reconciliation;

import java.util.List;

/**
 * Totals accumulated while removing orphans.
 *
 * @param processedCount       orphans whose transaction committed end to end
 * @param cleanedInstances     instance rows soft-deleted
 * @param cleanedPortMappings  port mapping rows removed
 * @param cleanedInstanceNames names of cleaned instances, in cleanup order
 * @param failedInstanceNames  names of orphans whose transaction rolled back
 * @param warningCount         orphans cleaned while their port mappings could not be removed
 * @param cancelled            whether the batch stopped early on cancellation
 */
public record CleanupResult(
    int processedCount,
    int cleanedInstances,
    int cleanedPortMappings,
    List<String> cleanedInstanceNames,
    List<String> failedInstanceNames,
    int warningCount,
    boolean cancelled
) {
    
    public CleanupResult {
        cleanedInstanceNames = List.copyOf(cleanedInstanceNames);
        failedInstanceNames = List.copyOf(failedInstanceNames);
    }
    
    public static CleanupResult empty() {
        return new CleanupResult(0, 0, 0, List.of(), List.of(), 0, false);
    }
}
