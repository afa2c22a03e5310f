package com.platform.inventory.reconciliation;

import com.platform.inventory.model.LocalInstance;

import java.util.List;

/**
 * Outcome of comparing remote and local instance sets.
 *
 * @param checkedCount         number of local instances examined
 * @param orphans              local instances with no remote counterpart, ordered by id
 * @param duplicateRemoteNames names the provider reported more than once
 */
public record DriftReport(
    int checkedCount,
    List<LocalInstance> orphans,
    List<String> duplicateRemoteNames
) {
    
    public DriftReport {
        orphans = List.copyOf(orphans);
        duplicateRemoteNames = List.copyOf(duplicateRemoteNames);
    }
    
    public boolean hasOrphans() {
        return !orphans.isEmpty();
    }
}
