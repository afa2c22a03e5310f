package com.platform.inventory.model;

/**
 * A compute backend whose instances are mirrored in the local inventory.
 */
public record Provider(
    long id,
    String name,
    String type,
    String endpoint,
    String apiToken,
    String status
) {
    
    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_INACTIVE = "inactive";
    
    public boolean isActive() {
        return STATUS_ACTIVE.equals(status);
    }
    
    /**
     * Copy without credentials, safe to return from the API or log.
     */
    public Provider redacted() {
        return new Provider(id, name, type, endpoint, null, status);
    }
}
