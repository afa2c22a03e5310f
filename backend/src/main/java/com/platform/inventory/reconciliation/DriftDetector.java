package com.platform.inventory.reconciliation;

import com.platform.inventory.model.LocalInstance;
import com.platform.inventory.model.RemoteInstance;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds local instances the provider no longer reports.
 * Matching is by name only. Runs in O(R + L).
 */
@Component
public class DriftDetector {
    
    public DriftReport detect(List<RemoteInstance> remoteInstances, List<LocalInstance> localInstances) {
        Map<String, RemoteInstance> remoteByName = new HashMap<>();
        Set<String> duplicates = new TreeSet<>();
        
        for (RemoteInstance remote : remoteInstances) {
            // first one wins, only the name matters here
            if (remoteByName.putIfAbsent(remote.name(), remote) != null) {
                duplicates.add(remote.name());
            }
        }
        
        List<LocalInstance> orphans = localInstances.stream()
            .filter(local -> !remoteByName.containsKey(local.name()))
            .sorted(Comparator.comparingLong(LocalInstance::id))
            .toList();
        
        return new DriftReport(localInstances.size(), orphans, List.copyOf(duplicates));
    }
}
