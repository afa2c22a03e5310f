package com.platform.inventory.model;

/**
 * Quota bucket an instance status falls into.
 */
public enum QuotaBucket {
    STABLE,         // counts toward used quota
    TRANSITIONAL,   // counts toward pending quota
    TERMINAL,       // counts toward neither
    UNKNOWN;        // unrecognized status, not counted
    
    public static QuotaBucket of(String status) {
        if (InstanceStatus.isStable(status)) {
            return STABLE;
        }
        if (InstanceStatus.isTransitional(status)) {
            return TRANSITIONAL;
        }
        if (InstanceStatus.isTerminal(status)) {
            return TERMINAL;
        }
        return UNKNOWN;
    }
}
