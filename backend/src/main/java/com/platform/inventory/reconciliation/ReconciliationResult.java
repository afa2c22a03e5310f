package com.platform.inventory.reconciliation;

import java.time.Instant;
import java.util.List;

/**
 * Result of one reconciliation pass for one provider.
 */
public record ReconciliationResult(
    String jobId,
    long providerId,
    String providerName,
    Outcome outcome,
    int checkedCount,
    int orphanCount,
    int processedOrphanCount,
    int cleanedInstanceCount,
    int cleanedPortMappingCount,
    List<String> cleanedInstanceNames,
    List<String> failedInstanceNames,
    List<String> duplicateRemoteNames,
    String summary,
    String error,
    Instant startedAt,
    Instant finishedAt
) {
    
    public enum Outcome {
        /** Pass ran to the end. Some orphans may still have failed. */
        COMPLETED,
        /** Pass stopped early on cancellation. Counts are partial. */
        CANCELLED,
        /** Connectivity or query failure. Nothing was cleaned. */
        FAILED
    }
    
    public ReconciliationResult {
        cleanedInstanceNames = List.copyOf(cleanedInstanceNames);
        failedInstanceNames = List.copyOf(failedInstanceNames);
        duplicateRemoteNames = List.copyOf(duplicateRemoteNames);
    }
    
    public static ReconciliationResult failed(
            String jobId, long providerId, String providerName, String error, Instant startedAt) {
        return new ReconciliationResult(
            jobId, providerId, providerName, Outcome.FAILED,
            0, 0, 0, 0, 0,
            List.of(), List.of(), List.of(),
            null, error, startedAt, Instant.now()
        );
    }
    
    public boolean isCancelled() {
        return outcome == Outcome.CANCELLED;
    }
    
    public long durationMs() {
        return finishedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
