package com.platform.inventory.quota;

/**
 * Instance counts of one provider grouped by quota bucket.
 *
 * @param used     instances in a stable status
 * @param pending  instances in a transitional status
 * @param terminal instances in a terminal status, not counted toward quota
 * @param unknown  instances whose status belongs to no bucket, not counted toward quota
 */
public record QuotaUsage(long providerId, long used, long pending, long terminal, long unknown) {
    
    public long counted() {
        return used + pending;
    }
}
