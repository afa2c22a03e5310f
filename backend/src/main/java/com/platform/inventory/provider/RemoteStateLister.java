package com.platform.inventory.provider;

import com.platform.inventory.model.Provider;
import com.platform.inventory.model.RemoteInstance;
import com.platform.inventory.reconciliation.CancellationToken;

import java.util.List;

/**
 * Authoritative instance state, as reported by the provider.
 * Both operations throw {@link com.platform.inventory.error.ConnectivityException}
 * on failure. No partial listing is ever returned.
 */
public interface RemoteStateLister {
    
    void checkConnection(Provider provider);
    
    /**
     * @throws java.util.concurrent.CancellationException if the token was cancelled before the call
     */
    List<RemoteInstance> listInstances(Provider provider, CancellationToken cancellationToken);
}
