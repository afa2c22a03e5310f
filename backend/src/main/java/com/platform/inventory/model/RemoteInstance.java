package com.platform.inventory.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Instance as reported by a provider. Only the name takes part in reconciliation.
 */
public record RemoteInstance(
    String name,
    String status,
    Map<String, Object> metadata
) {
    
    public RemoteInstance {
        // provider payloads may carry null values, which Map.copyOf rejects
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
    
    public static RemoteInstance named(String name) {
        return new RemoteInstance(name, null, Map.of());
    }
}
