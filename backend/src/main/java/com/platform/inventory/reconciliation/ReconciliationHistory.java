package com.platform.inventory.reconciliation;

import com.platform.inventory.config.ReconciliationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded in-memory record of finished passes, oldest first.
 */
@Component
public class ReconciliationHistory {
    
    private final List<ReconciliationResult> results = new ArrayList<>();
    private final int maxSize;
    
    public ReconciliationHistory(ReconciliationProperties properties) {
        this.maxSize = Math.max(1, properties.getHistorySize());
    }
    
    public synchronized void record(ReconciliationResult result) {
        results.add(result);
        
        if (results.size() > maxSize) {
            results.remove(0);
        }
    }
    
    public synchronized List<ReconciliationResult> all() {
        return List.copyOf(results);
    }
    
    public synchronized List<ReconciliationResult> forProvider(long providerId) {
        return results.stream()
            .filter(r -> r.providerId() == providerId)
            .toList();
    }
}
