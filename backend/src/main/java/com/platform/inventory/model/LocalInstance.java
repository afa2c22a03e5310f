package com.platform.inventory.model;

import java.time.Instant;

/**
 * Locally tracked instance record.
 */
public record LocalInstance(
    long id,
    String name,
    long providerId,
    String status,
    Instant createdAt,
    Instant updatedAt
) {
    
    public QuotaBucket quotaBucket() {
        return QuotaBucket.of(status);
    }
}
