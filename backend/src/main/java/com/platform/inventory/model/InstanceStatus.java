package com.platform.inventory.model;

import java.util.List;

/**
 * Instance status values and their quota buckets.
 *
 * Stable statuses count toward used quota, transitional statuses toward pending quota,
 * terminal statuses toward neither. A status outside these lists belongs to no bucket.
 */
public final class InstanceStatus {
    
    // Stable
    public static final String RUNNING = "running";
    public static final String STOPPED = "stopped";
    public static final String ERROR = "error";
    
    // Transitional
    public static final String CREATING = "creating";
    public static final String RESETTING = "resetting";
    
    // Terminal
    public static final String DELETING = "deleting";
    public static final String DELETED = "deleted";
    public static final String FAILED = "failed";
    
    private static final List<String> STABLE = List.of(RUNNING, STOPPED, ERROR);
    private static final List<String> TRANSITIONAL = List.of(CREATING, RESETTING);
    private static final List<String> TERMINAL = List.of(DELETING, DELETED, FAILED);
    private static final List<String> TERMINAL_DELETION = List.of(DELETING, DELETED);
    
    private InstanceStatus() {
    }
    
    public static List<String> stableStatuses() {
        return STABLE;
    }
    
    public static List<String> transitionalStatuses() {
        return TRANSITIONAL;
    }
    
    public static List<String> terminalStatuses() {
        return TERMINAL;
    }
    
    /**
     * Statuses that count toward used quota. Transitional statuses are excluded
     * so an instance is never counted as both used and pending.
     */
    public static List<String> quotaCountableStatuses() {
        return STABLE;
    }
    
    /**
     * Statuses of rows that are already gone or on their way out.
     * Reconciliation never looks at these again.
     */
    public static List<String> terminalDeletionStatuses() {
        return TERMINAL_DELETION;
    }
    
    public static boolean isStable(String status) {
        return status != null && STABLE.contains(status);
    }
    
    public static boolean isTransitional(String status) {
        return status != null && TRANSITIONAL.contains(status);
    }
    
    public static boolean isTerminal(String status) {
        return status != null && TERMINAL.contains(status);
    }
}
