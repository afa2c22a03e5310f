package com.platform.inventory.reconciliation;

import java.time.Instant;

/**
 * Published when an orphan's port mappings could not be removed
 * but the instance itself was still cleaned up.
 */
public record CleanupWarningEvent(
    long providerId,
    String providerName,
    long instanceId,
    String instanceName,
    long portMappingsLeft,
    String message,
    Instant occurredAt
) {
}
