package com.platform.inventory.provider;

import com.platform.inventory.model.RemoteInstance;

import java.util.List;

/**
 * API of one provider backend.
 * Implementations throw {@link com.platform.inventory.error.ConnectivityException}
 * when the backend cannot be reached or rejects the credentials.
 */
public interface ProviderClient {
    
    /**
     * Verify the provider is reachable and accepts our credentials.
     */
    void checkConnection();
    
    /**
     * Every instance the provider currently knows about.
     */
    List<RemoteInstance> listInstances();
}
